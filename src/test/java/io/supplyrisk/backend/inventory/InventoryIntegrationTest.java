package io.supplyrisk.backend.inventory;

import static io.supplyrisk.backend.testutil.TestSupplyChainFactory.location;
import static io.supplyrisk.backend.testutil.TestSupplyChainFactory.product;
import static io.supplyrisk.backend.testutil.TestSupplyChainFactory.supplier;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.supplyrisk.backend.TestcontainersConfiguration;
import io.supplyrisk.backend.exception.ResourceConflictException;
import io.supplyrisk.backend.exception.ResourceNotFoundException;
import io.supplyrisk.backend.inventory.dto.CreateInventoryRequest;
import io.supplyrisk.backend.inventory.dto.UpdateInventoryRequest;
import io.supplyrisk.backend.location.LocationService;
import io.supplyrisk.backend.multitenancy.TenantContext;
import io.supplyrisk.backend.product.ProductService;
import io.supplyrisk.backend.supplier.SupplierService;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class InventoryIntegrationTest {

  private static final String TENANT = "inventory-it";
  private static final String OTHER_TENANT = "inventory-it-other";

  @Autowired private InventoryService inventoryService;
  @Autowired private SupplierService supplierService;
  @Autowired private ProductService productService;
  @Autowired private LocationService locationService;

  private UUID supplierId;
  private UUID foreignLocationId;

  @BeforeAll
  void createSupplier() {
    supplierId =
        TenantContext.callWithTenant(TENANT, () -> supplierService.create(supplier("SUP-INV")))
            .id();
    foreignLocationId =
        TenantContext.callWithTenant(
                OTHER_TENANT, () -> locationService.create(location("LOC-INV-OTHER")))
            .id();
  }

  @BeforeEach
  void bindTenant() {
    TenantContext.setActiveTenant(TENANT);
  }

  @AfterEach
  void clearTenant() {
    TenantContext.clearActiveTenant();
  }

  @Test
  void create_defaultsQuantitiesToZero() {
    var product = productService.create(product("SKU-INV-DEF", supplierId));
    var warehouse = locationService.create(location("LOC-INV-DEF"));

    var row =
        inventoryService.create(
            new CreateInventoryRequest(product.id(), warehouse.id(), null, null, null, null));

    assertThat(row.quantityOnHand()).isZero();
    assertThat(row.quantityReserved()).isZero();
    assertThat(row.reorderPoint()).isZero();
    assertThat(row.lastCountDate()).isNull();
  }

  @Test
  void secondRowForSameProductAndLocation_isConflict() {
    var product = productService.create(product("SKU-INV-DUP", supplierId));
    var warehouse = locationService.create(location("LOC-INV-DUP"));
    inventoryService.create(
        new CreateInventoryRequest(product.id(), warehouse.id(), 1, 0, 0, null));

    assertThatThrownBy(
            () ->
                inventoryService.create(
                    new CreateInventoryRequest(product.id(), warehouse.id(), 2, 0, 0, null)))
        .isInstanceOf(ResourceConflictException.class);
  }

  @Test
  void upsert_createsThenUpdatesSingleRow() {
    var product = productService.create(product("SKU-INV-UPS", supplierId));
    var warehouse = locationService.create(location("LOC-INV-UPS"));

    var first =
        inventoryService.upsert(
            product.id(), warehouse.id(), new UpdateInventoryRequest(10, null, 3, null));
    var second =
        inventoryService.upsert(
            product.id(), warehouse.id(), new UpdateInventoryRequest(25, 5, null, null));

    assertThat(second.id()).isEqualTo(first.id());
    assertThat(second.quantityOnHand()).isEqualTo(25);
    assertThat(second.quantityReserved()).isEqualTo(5);
    assertThat(second.reorderPoint()).isEqualTo(3);
    assertThat(inventoryService.findAll(InventorySpecifications.forProduct(product.id())))
        .hasSize(1);
  }

  @Test
  void totalOnHand_sumsAcrossLocations() {
    var product = productService.create(product("SKU-INV-SUM", supplierId));
    var north = locationService.create(location("LOC-INV-N"));
    var south = locationService.create(location("LOC-INV-S"));
    inventoryService.create(new CreateInventoryRequest(product.id(), north.id(), 30, 0, 0, null));
    inventoryService.create(new CreateInventoryRequest(product.id(), south.id(), 12, 0, 0, null));

    assertThat(inventoryService.totalOnHand(product.id())).isEqualTo(42L);
    assertThat(inventoryService.totalOnHand(UUID.randomUUID())).isZero();
  }

  @Test
  void create_atLocationOfAnotherTenant_isNotFound() {
    var product = productService.create(product("SKU-INV-FOREIGN", supplierId));

    assertThatThrownBy(
            () ->
                inventoryService.create(
                    new CreateInventoryRequest(product.id(), foreignLocationId, 1, 0, 0, null)))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void findAll_belowReorderPoint() {
    var product = productService.create(product("SKU-INV-LOW", supplierId));
    var warehouse = locationService.create(location("LOC-INV-LOW"));
    var low =
        inventoryService.create(
            new CreateInventoryRequest(product.id(), warehouse.id(), 2, 0, 10, null));

    var found =
        inventoryService.findAll(
            InventorySpecifications.forProduct(product.id())
                .and(InventorySpecifications.belowReorderPoint()));

    assertThat(found).extracting(r -> r.id()).containsExactly(low.id());
  }
}

package io.supplyrisk.backend.location;

import static io.supplyrisk.backend.testutil.TestSupplyChainFactory.location;
import static io.supplyrisk.backend.testutil.TestSupplyChainFactory.product;
import static io.supplyrisk.backend.testutil.TestSupplyChainFactory.route;
import static io.supplyrisk.backend.testutil.TestSupplyChainFactory.supplier;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.supplyrisk.backend.TestcontainersConfiguration;
import io.supplyrisk.backend.exception.ResourceConflictException;
import io.supplyrisk.backend.exception.ResourceNotFoundException;
import io.supplyrisk.backend.inventory.InventoryService;
import io.supplyrisk.backend.inventory.dto.CreateInventoryRequest;
import io.supplyrisk.backend.location.dto.LocationResponse;
import io.supplyrisk.backend.location.dto.UpdateLocationRequest;
import io.supplyrisk.backend.multitenancy.TenantContext;
import io.supplyrisk.backend.product.ProductService;
import io.supplyrisk.backend.route.RouteService;
import io.supplyrisk.backend.route.TransportMode;
import io.supplyrisk.backend.supplier.SupplierService;
import java.math.BigDecimal;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class LocationIntegrationTest {

  private static final String TENANT = "location-it";

  @Autowired private LocationService locationService;
  @Autowired private RouteService routeService;
  @Autowired private SupplierService supplierService;
  @Autowired private ProductService productService;
  @Autowired private InventoryService inventoryService;
  @Autowired private JdbcTemplate jdbcTemplate;

  @BeforeEach
  void bindTenant() {
    TenantContext.setActiveTenant(TENANT);
  }

  @AfterEach
  void clearTenant() {
    TenantContext.clearActiveTenant();
  }

  @Test
  void update_changesStatusAndCoordinates() {
    var created = locationService.create(location("LOC-UPD"));

    var updated =
        locationService.update(
            created.id(),
            new UpdateLocationRequest(
                "Rotterdam Port",
                LocationType.PORT,
                LocationStatus.MAINTENANCE,
                null,
                "Rotterdam",
                null,
                "NL",
                null,
                new BigDecimal("51.9244000"),
                new BigDecimal("4.4777000"),
                null));

    assertThat(updated.status()).isEqualTo(LocationStatus.MAINTENANCE);
    assertThat(updated.latitude()).isEqualByComparingTo("51.9244");
    assertThat(updated.country()).isEqualTo("NL");
  }

  @Test
  void create_defaultsStatusToActive() {
    assertThat(locationService.create(location("LOC-DEF")).status())
        .isEqualTo(LocationStatus.ACTIVE);
  }

  @Test
  void duplicateCode_inSameTenant_isConflict() {
    locationService.create(location("LOC-DUP"));

    assertThatThrownBy(() -> locationService.create(location("LOC-DUP")))
        .isInstanceOf(ResourceConflictException.class);
  }

  @Test
  void delete_isRejectedWhileRoutesUseLocation() {
    var origin = locationService.create(location("LOC-ORIGIN"));
    var destination = locationService.create(location("LOC-DEST"));
    routeService.create(route(origin.id(), destination.id(), TransportMode.RAIL));

    assertThatThrownBy(() -> locationService.delete(destination.id()))
        .isInstanceOf(ResourceConflictException.class);
    assertThat(locationService.findById(destination.id()).code()).isEqualTo("LOC-DEST");
  }

  @Test
  void delete_cascadesToInventory() {
    var warehouse = locationService.create(location("LOC-INV"));
    var supplier = supplierService.create(supplier("SUP-LOC-INV"));
    var product = productService.create(product("SKU-LOC-INV", supplier.id()));
    var row =
        inventoryService.create(
            new CreateInventoryRequest(product.id(), warehouse.id(), 12, 0, 0, null));

    locationService.delete(warehouse.id());

    assertThatThrownBy(() -> inventoryService.findById(row.id()))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void findAll_filtersByType() {
    locationService.create(location("LOC-TYPE-W"));

    var warehouses = locationService.findAll(LocationSpecifications.ofType(LocationType.WAREHOUSE));

    assertThat(warehouses).extracting(LocationResponse::code).contains("LOC-TYPE-W");
    assertThat(warehouses).allMatch(l -> l.type() == LocationType.WAREHOUSE);
  }

  @Test
  void schema_rejectsLatitudeOutOfRange() {
    var created = locationService.create(location("LOC-LAT"));

    assertThatThrownBy(
            () ->
                jdbcTemplate.update(
                    "UPDATE locations SET latitude = 95 WHERE id = ?", created.id()))
        .isInstanceOf(DataIntegrityViolationException.class);
  }
}

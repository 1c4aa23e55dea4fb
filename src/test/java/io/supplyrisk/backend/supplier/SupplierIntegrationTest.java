package io.supplyrisk.backend.supplier;

import static io.supplyrisk.backend.testutil.TestSupplyChainFactory.product;
import static io.supplyrisk.backend.testutil.TestSupplyChainFactory.supplier;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.supplyrisk.backend.TestcontainersConfiguration;
import io.supplyrisk.backend.exception.ResourceConflictException;
import io.supplyrisk.backend.multitenancy.TenantContext;
import io.supplyrisk.backend.product.ProductService;
import io.supplyrisk.backend.supplier.dto.CreateSupplierRequest;
import io.supplyrisk.backend.supplier.dto.SupplierResponse;
import io.supplyrisk.backend.supplier.dto.UpdateSupplierRequest;
import org.junit.jupiter.api.AfterEach;
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
class SupplierIntegrationTest {

  private static final String TENANT = "supplier-it";
  private static final String OTHER_TENANT = "supplier-it-other";

  @Autowired private SupplierService supplierService;
  @Autowired private ProductService productService;

  @BeforeEach
  void bindTenant() {
    TenantContext.setActiveTenant(TENANT);
  }

  @AfterEach
  void clearTenant() {
    TenantContext.clearActiveTenant();
  }

  @Test
  void create_thenFindById_roundTripsEveryField() {
    var request =
        new CreateSupplierRequest(
            "SUP-RT", "Round Trip GmbH", "AT", "rt@example.test", "+43 1 234", "Ring 1", 5, "vip");

    var created = supplierService.create(request);
    var found = supplierService.findById(created.id());

    assertThat(found.id()).isNotNull();
    assertThat(found.code()).isEqualTo(request.code());
    assertThat(found.name()).isEqualTo(request.name());
    assertThat(found.country()).isEqualTo(request.country());
    assertThat(found.contactEmail()).isEqualTo(request.contactEmail());
    assertThat(found.contactPhone()).isEqualTo(request.contactPhone());
    assertThat(found.address()).isEqualTo(request.address());
    assertThat(found.rating()).isEqualTo(5);
    assertThat(found.notes()).isEqualTo("vip");
    assertThat(found.createdAt()).isNotNull();
    assertThat(found.updatedAt()).isNotNull();
  }

  @Test
  void update_advancesUpdatedAtAndKeepsCreatedAt() {
    var created = supplierService.create(supplier("SUP-UPD"));
    SupplierResponse before = supplierService.findById(created.id());

    supplierService.update(
        created.id(), new UpdateSupplierRequest("Renamed", "PL", null, null, null, 2, null));
    SupplierResponse after = supplierService.findById(created.id());

    assertThat(after.name()).isEqualTo("Renamed");
    assertThat(after.rating()).isEqualTo(2);
    assertThat(after.createdAt()).isEqualTo(before.createdAt());
    assertThat(after.updatedAt()).isAfter(before.updatedAt());
  }

  @Test
  void create_defaultsRatingToThree() {
    var created =
        supplierService.create(
            new CreateSupplierRequest("SUP-DEF", "Default", "DE", null, null, null, null, null));

    assertThat(created.rating()).isEqualTo(Supplier.DEFAULT_RATING);
  }

  @Test
  void duplicateCode_inSameTenant_isConflict() {
    supplierService.create(supplier("SUP-DUP"));

    assertThatThrownBy(() -> supplierService.create(supplier("SUP-DUP")))
        .isInstanceOf(ResourceConflictException.class);
  }

  @Test
  void sameCode_inAnotherTenant_isAllowed() {
    supplierService.create(supplier("SUP-SHARED"));

    var other =
        TenantContext.callWithTenant(
            OTHER_TENANT, () -> supplierService.create(supplier("SUP-SHARED")));

    assertThat(other.code()).isEqualTo("SUP-SHARED");
  }

  @Test
  void delete_isRejectedWhileProductsReferenceSupplier() {
    var referenced = supplierService.create(supplier("SUP-REF"));
    productService.create(product("SKU-REF", referenced.id()));

    assertThatThrownBy(() -> supplierService.delete(referenced.id()))
        .isInstanceOf(ResourceConflictException.class);
    assertThat(supplierService.findById(referenced.id()).code()).isEqualTo("SUP-REF");
  }

  @Test
  void findAll_filtersByCountryAndRating() {
    supplierService.create(
        new CreateSupplierRequest("SUP-JP1", "Kyoto", "JP", null, null, null, 5, null));
    supplierService.create(
        new CreateSupplierRequest("SUP-JP2", "Osaka", "JP", null, null, null, 1, null));

    var found =
        supplierService.findAll(
            SupplierSpecifications.inCountry("JP").and(SupplierSpecifications.ratedAtLeast(4)));

    assertThat(found).extracting(SupplierResponse::code).containsExactly("SUP-JP1");
  }
}

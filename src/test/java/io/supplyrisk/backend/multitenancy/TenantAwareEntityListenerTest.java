package io.supplyrisk.backend.multitenancy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.supplyrisk.backend.exception.MissingTenantContextException;
import io.supplyrisk.backend.exception.ResourceNotFoundException;
import io.supplyrisk.backend.provisioning.Tenant;
import io.supplyrisk.backend.supplier.Supplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TenantAwareEntityListenerTest {

  private final TenantAwareEntityListener listener = new TenantAwareEntityListener();

  @AfterEach
  void tearDown() {
    TenantContext.clearActiveTenant();
  }

  @Test
  void stampTenant_overridesCallerSuppliedTenant() {
    var supplier = new Supplier("SUP-1", "Acme", "DE", 4);
    supplier.setTenantId("someone-else");

    TenantContext.runWithTenant("acme", () -> listener.stampTenant(supplier));

    assertThat(supplier.getTenantId()).isEqualTo("acme");
  }

  @Test
  void stampTenant_requiresActiveTenant() {
    var supplier = new Supplier("SUP-1", "Acme", "DE", 4);

    assertThatThrownBy(() -> listener.stampTenant(supplier))
        .isInstanceOf(MissingTenantContextException.class);
  }

  @Test
  void stampTenant_ignoresEntitiesThatAreNotTenantAware() {
    var tenant = new Tenant("acme", "Acme Corp");

    assertThatCode(() -> listener.stampTenant(tenant)).doesNotThrowAnyException();
  }

  @Test
  void verifyOwnership_rejectsRowOfAnotherTenant() {
    var supplier = new Supplier("SUP-1", "Acme", "DE", 4);
    supplier.setTenantId("globex");

    assertThatThrownBy(
            () -> TenantContext.runWithTenant("acme", () -> listener.verifyOwnership(supplier)))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void verifyOwnership_acceptsRowOfActiveTenant() {
    var supplier = new Supplier("SUP-1", "Acme", "DE", 4);
    supplier.setTenantId("acme");

    assertThatCode(
            () -> TenantContext.runWithTenant("acme", () -> listener.verifyOwnership(supplier)))
        .doesNotThrowAnyException();
  }
}

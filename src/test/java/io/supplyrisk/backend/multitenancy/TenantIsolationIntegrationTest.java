package io.supplyrisk.backend.multitenancy;

import static io.supplyrisk.backend.testutil.TestSupplyChainFactory.location;
import static io.supplyrisk.backend.testutil.TestSupplyChainFactory.riskEvent;
import static io.supplyrisk.backend.testutil.TestSupplyChainFactory.supplier;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.supplyrisk.backend.TestcontainersConfiguration;
import io.supplyrisk.backend.exception.MissingTenantContextException;
import io.supplyrisk.backend.exception.ResourceNotFoundException;
import io.supplyrisk.backend.inventory.InventoryService;
import io.supplyrisk.backend.location.LocationService;
import io.supplyrisk.backend.location.LocationStatus;
import io.supplyrisk.backend.location.LocationType;
import io.supplyrisk.backend.location.dto.UpdateLocationRequest;
import io.supplyrisk.backend.provisioning.TenantProvisioningService;
import io.supplyrisk.backend.riskevent.RiskEventService;
import io.supplyrisk.backend.riskevent.RiskSeverity;
import io.supplyrisk.backend.supplier.Supplier;
import io.supplyrisk.backend.supplier.SupplierService;
import io.supplyrisk.backend.supplier.SupplierSpecifications;
import io.supplyrisk.backend.supplier.dto.SupplierResponse;
import io.supplyrisk.backend.supplier.dto.UpdateSupplierRequest;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.support.TransactionTemplate;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class TenantIsolationIntegrationTest {

  private static final String T1 = "isolation-t1";
  private static final String T2 = "isolation-t2";
  private static final String SCENARIO_T1 = "isolation-scenario-t1";
  private static final String SCENARIO_T2 = "isolation-scenario-t2";

  @Autowired private SupplierService supplierService;
  @Autowired private LocationService locationService;
  @Autowired private RiskEventService riskEventService;
  @Autowired private InventoryService inventoryService;
  @Autowired private TenantProvisioningService provisioningService;
  @Autowired private EntityStores stores;
  @Autowired private TransactionTemplate transactionTemplate;
  @Autowired private JdbcTemplate jdbcTemplate;

  @Test
  void findAll_returnsOnlyActiveTenantsRows() {
    TenantContext.runWithTenant(SCENARIO_T1, () -> supplierService.create(supplier("SUP-A")));
    TenantContext.runWithTenant(SCENARIO_T2, () -> supplierService.create(supplier("SUP-B")));

    List<SupplierResponse> seenByT1 =
        TenantContext.callWithTenant(SCENARIO_T1, () -> supplierService.findAll(null));
    List<SupplierResponse> seenByT2 =
        TenantContext.callWithTenant(SCENARIO_T2, () -> supplierService.findAll(null));

    assertThat(seenByT1).extracting(SupplierResponse::code).containsExactly("SUP-A");
    assertThat(seenByT2).extracting(SupplierResponse::code).containsExactly("SUP-B");
  }

  @Test
  void crossTenantUpdate_isNotFoundAndLeavesRowUnchanged() {
    var created =
        TenantContext.callWithTenant(T1, () -> locationService.create(location("LOC-X")));
    var rename =
        new UpdateLocationRequest(
            "Hijacked",
            LocationType.PORT,
            LocationStatus.ACTIVE,
            null,
            null,
            null,
            "DE",
            null,
            null,
            null,
            null);

    assertThatThrownBy(
            () ->
                TenantContext.runWithTenant(
                    T2, () -> locationService.update(created.id(), rename)))
        .isInstanceOf(ResourceNotFoundException.class);

    var reread = TenantContext.callWithTenant(T1, () -> locationService.findById(created.id()));
    assertThat(reread.name()).isEqualTo(created.name());
    assertThat(reread.type()).isEqualTo(LocationType.WAREHOUSE);
  }

  @Test
  void crossTenantReadAndDelete_areNotFound() {
    var created =
        TenantContext.callWithTenant(T1, () -> supplierService.create(supplier("SUP-DEL")));

    assertThatThrownBy(
            () -> TenantContext.runWithTenant(T2, () -> supplierService.findById(created.id())))
        .isInstanceOf(ResourceNotFoundException.class);
    assertThatThrownBy(
            () -> TenantContext.runWithTenant(T2, () -> supplierService.delete(created.id())))
        .isInstanceOf(ResourceNotFoundException.class);

    var stillThere =
        TenantContext.callWithTenant(T1, () -> supplierService.findById(created.id()));
    assertThat(stillThere.code()).isEqualTo("SUP-DEL");
  }

  @Test
  void create_stampsActiveTenantOverCallerSuppliedValue() {
    var supplier = new Supplier("SUP-STAMP", "Stamp Co", "FR", 2);
    supplier.setTenantId(T2);

    var saved =
        TenantContext.callWithTenant(
            T1,
            () ->
                transactionTemplate.execute(
                    status -> stores.forEntity(Supplier.class).create(supplier)));

    String storedTenant =
        jdbcTemplate.queryForObject(
            "SELECT tenant_id FROM suppliers WHERE id = ?", String.class, saved.getId());
    assertThat(storedTenant).isEqualTo(T1);
  }

  @Test
  void everyOperationKind_requiresActiveTenant() {
    var anyId = UUID.randomUUID();
    var update = new UpdateSupplierRequest("n", "DE", null, null, null, 3, null);

    assertThatThrownBy(() -> supplierService.create(supplier("SUP-NONE")))
        .isInstanceOf(MissingTenantContextException.class);
    assertThatThrownBy(() -> supplierService.findById(anyId))
        .isInstanceOf(MissingTenantContextException.class);
    assertThatThrownBy(() -> supplierService.findAll(SupplierSpecifications.inCountry("DE")))
        .isInstanceOf(MissingTenantContextException.class);
    assertThatThrownBy(() -> supplierService.update(anyId, update))
        .isInstanceOf(MissingTenantContextException.class);
    assertThatThrownBy(() -> supplierService.delete(anyId))
        .isInstanceOf(MissingTenantContextException.class);
    assertThatThrownBy(() -> riskEventService.countBySeverity(null))
        .isInstanceOf(MissingTenantContextException.class);
    assertThatThrownBy(() -> inventoryService.totalOnHand(anyId))
        .isInstanceOf(MissingTenantContextException.class);

    Integer rows =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM suppliers WHERE code = 'SUP-NONE'", Integer.class);
    assertThat(rows).isZero();
  }

  @Test
  void aggregates_areScopedToActiveTenant() {
    TenantContext.runWithTenant(
        T1,
        () -> {
          riskEventService.create(riskEvent("Flood", RiskSeverity.HIGH));
          riskEventService.create(riskEvent("Heat", RiskSeverity.HIGH));
        });
    TenantContext.runWithTenant(
        T2, () -> riskEventService.create(riskEvent("Strike", RiskSeverity.HIGH)));

    var t1Counts = TenantContext.callWithTenant(T1, () -> riskEventService.countBySeverity(null));
    var t2Counts = TenantContext.callWithTenant(T2, () -> riskEventService.countBySeverity(null));

    assertThat(t1Counts).containsEntry(RiskSeverity.HIGH, 2L).containsEntry(RiskSeverity.LOW, 0L);
    assertThat(t2Counts).containsEntry(RiskSeverity.HIGH, 1L);
  }

  @Test
  void tenantRegistry_passesThroughWithoutTenant() {
    provisioningService.provision("isolation-registry", "Registry Check");

    assertThat(provisioningService.findByExternalId("isolation-registry")).isPresent();
    assertThat(TenantContext.getActiveTenant()).isEmpty();
  }
}

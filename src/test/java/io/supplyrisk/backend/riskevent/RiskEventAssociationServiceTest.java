package io.supplyrisk.backend.riskevent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.supplyrisk.backend.exception.ResourceConflictException;
import io.supplyrisk.backend.exception.ResourceNotFoundException;
import io.supplyrisk.backend.multitenancy.EntityStore;
import io.supplyrisk.backend.multitenancy.EntityStores;
import io.supplyrisk.backend.supplier.Supplier;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.jpa.domain.Specification;

@ExtendWith(MockitoExtension.class)
class RiskEventAssociationServiceTest {

  private static final UUID EVENT_ID = UUID.randomUUID();
  private static final UUID SUPPLIER_ID = UUID.randomUUID();

  @Mock private EntityStores stores;
  @Mock private EntityStore<RiskEvent> riskEventStore;
  @Mock private EntityStore<Supplier> supplierStore;
  @Mock private EntityStore<RiskEventSupplier> linkStore;

  private RiskEventAssociationService service;

  @BeforeEach
  void setUp() {
    when(stores.forEntity(RiskEvent.class)).thenReturn(riskEventStore);
    service = new RiskEventAssociationService(stores);
  }

  @Test
  void addAssociation_createsLinkForPair() {
    stubLinkStores();
    when(linkStore.create(any(RiskEventSupplier.class))).thenAnswer(inv -> inv.getArgument(0));

    var response = service.addAssociation(RiskEventLinkType.SUPPLIER, EVENT_ID, SUPPLIER_ID);

    assertThat(response.riskEventId()).isEqualTo(EVENT_ID);
    assertThat(response.linkedId()).isEqualTo(SUPPLIER_ID);
    assertThat(response.linkType()).isEqualTo("suppliers");
  }

  @Test
  void addAssociation_rejectsSupplierOutsideActiveTenant() {
    when(stores.forEntity(Supplier.class)).thenReturn(supplierStore);
    when(supplierStore.getById(SUPPLIER_ID))
        .thenThrow(new ResourceNotFoundException("Supplier", SUPPLIER_ID));

    assertThatThrownBy(
            () -> service.addAssociation(RiskEventLinkType.SUPPLIER, EVENT_ID, SUPPLIER_ID))
        .isInstanceOf(ResourceNotFoundException.class);
    verify(linkStore, never()).create(any());
  }

  @Test
  void addAssociation_surfacesDuplicateAsConflict() {
    stubLinkStores();
    when(linkStore.create(any(RiskEventSupplier.class)))
        .thenThrow(new ResourceConflictException("Constraint violation", "duplicate link"));

    assertThatThrownBy(
            () -> service.addAssociation(RiskEventLinkType.SUPPLIER, EVENT_ID, SUPPLIER_ID))
        .isInstanceOf(ResourceConflictException.class);
  }

  @Test
  @SuppressWarnings("unchecked")
  void removeAssociation_deletesMatchingLinksThroughScopedStore() {
    when(stores.forEntity(RiskEventSupplier.class)).thenReturn(linkStore);
    when(linkStore.deleteAll(any(Specification.class))).thenReturn(1);

    int removed = service.removeAssociation(RiskEventLinkType.SUPPLIER, EVENT_ID, SUPPLIER_ID);

    assertThat(removed).isEqualTo(1);
  }

  @Test
  void linkedIdsByRiskEvent_skipsQueryForEmptyBatch() {
    var result = service.linkedIdsByRiskEvent(RiskEventLinkType.SUPPLIER, List.of());

    assertThat(result).isEmpty();
    verify(stores, never()).forEntity(RiskEventSupplier.class);
  }

  private void stubLinkStores() {
    when(stores.forEntity(Supplier.class)).thenReturn(supplierStore);
    when(stores.forEntity(RiskEventSupplier.class)).thenReturn(linkStore);
    when(supplierStore.getById(SUPPLIER_ID)).thenReturn(new Supplier("SUP-1", "Acme", "DE", 4));
  }
}

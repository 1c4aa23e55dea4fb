package io.supplyrisk.backend.riskevent;

import io.supplyrisk.backend.multitenancy.TenantAwareEntityListener;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.Table;
import java.util.UUID;

@Entity
@Table(name = "risk_event_suppliers")
@EntityListeners(TenantAwareEntityListener.class)
public class RiskEventSupplier extends RiskEventLink {

  @Column(name = "supplier_id", nullable = false, updatable = false)
  private UUID supplierId;

  protected RiskEventSupplier() {}

  public RiskEventSupplier(UUID riskEventId, UUID supplierId) {
    super(riskEventId);
    this.supplierId = supplierId;
  }

  @Override
  public UUID getLinkedId() {
    return supplierId;
  }

  public UUID getSupplierId() {
    return supplierId;
  }
}

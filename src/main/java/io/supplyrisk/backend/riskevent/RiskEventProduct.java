package io.supplyrisk.backend.riskevent;

import io.supplyrisk.backend.multitenancy.TenantAwareEntityListener;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.Table;
import java.util.UUID;

@Entity
@Table(name = "risk_event_products")
@EntityListeners(TenantAwareEntityListener.class)
public class RiskEventProduct extends RiskEventLink {

  @Column(name = "product_id", nullable = false, updatable = false)
  private UUID productId;

  protected RiskEventProduct() {}

  public RiskEventProduct(UUID riskEventId, UUID productId) {
    super(riskEventId);
    this.productId = productId;
  }

  @Override
  public UUID getLinkedId() {
    return productId;
  }

  public UUID getProductId() {
    return productId;
  }
}

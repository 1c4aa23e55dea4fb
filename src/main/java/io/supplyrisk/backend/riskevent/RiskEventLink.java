package io.supplyrisk.backend.riskevent;

import io.supplyrisk.backend.multitenancy.TenantAware;
import jakarta.persistence.Column;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;
import java.time.Instant;
import java.util.UUID;

/**
 * Junction row pairing a risk event with one supplier, product, location or route. Links are
 * immutable: they are created and removed, never updated.
 */
@MappedSuperclass
public abstract class RiskEventLink implements TenantAware {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "tenant_id", nullable = false, updatable = false, length = 64)
  private String tenantId;

  @Column(name = "risk_event_id", nullable = false, updatable = false)
  private UUID riskEventId;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected RiskEventLink() {}

  protected RiskEventLink(UUID riskEventId) {
    this.riskEventId = riskEventId;
    this.createdAt = Instant.now();
  }

  /** Id of the supplier, product, location or route on the other side. */
  public abstract UUID getLinkedId();

  @Override
  public String getTenantId() {
    return tenantId;
  }

  @Override
  public void setTenantId(String tenantId) {
    this.tenantId = tenantId;
  }

  public UUID getId() {
    return id;
  }

  public UUID getRiskEventId() {
    return riskEventId;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}

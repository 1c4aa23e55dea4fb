package io.supplyrisk.backend.riskevent;

import io.supplyrisk.backend.multitenancy.TenantAwareEntityListener;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.Table;
import java.util.UUID;

@Entity
@Table(name = "risk_event_routes")
@EntityListeners(TenantAwareEntityListener.class)
public class RiskEventRoute extends RiskEventLink {

  @Column(name = "route_id", nullable = false, updatable = false)
  private UUID routeId;

  protected RiskEventRoute() {}

  public RiskEventRoute(UUID riskEventId, UUID routeId) {
    super(riskEventId);
    this.routeId = routeId;
  }

  @Override
  public UUID getLinkedId() {
    return routeId;
  }

  public UUID getRouteId() {
    return routeId;
  }
}

package io.supplyrisk.backend.riskevent;

import io.supplyrisk.backend.multitenancy.TenantAwareEntityListener;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.Table;
import java.util.UUID;

@Entity
@Table(name = "risk_event_locations")
@EntityListeners(TenantAwareEntityListener.class)
public class RiskEventLocation extends RiskEventLink {

  @Column(name = "location_id", nullable = false, updatable = false)
  private UUID locationId;

  protected RiskEventLocation() {}

  public RiskEventLocation(UUID riskEventId, UUID locationId) {
    super(riskEventId);
    this.locationId = locationId;
  }

  @Override
  public UUID getLinkedId() {
    return locationId;
  }

  public UUID getLocationId() {
    return locationId;
  }
}

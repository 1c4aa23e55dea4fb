package io.supplyrisk.backend.route;

import io.supplyrisk.backend.exception.InvalidStateException;
import io.supplyrisk.backend.multitenancy.TenantAware;
import io.supplyrisk.backend.multitenancy.TenantAwareEntityListener;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/** A lane between two locations. At most one route per (origin, destination, mode) per tenant. */
@Entity
@Table(name = "shipment_routes")
@EntityListeners(TenantAwareEntityListener.class)
public class ShipmentRoute implements TenantAware {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "tenant_id", nullable = false, updatable = false, length = 64)
  private String tenantId;

  @Column(name = "origin_location_id", nullable = false)
  private UUID originLocationId;

  @Column(name = "destination_location_id", nullable = false)
  private UUID destinationLocationId;

  @Column(name = "transit_time_days", nullable = false)
  private int transitTimeDays;

  @Enumerated(EnumType.STRING)
  @Column(name = "transport_mode", nullable = false, length = 20)
  private TransportMode transportMode;

  @Column(name = "distance", precision = 10, scale = 2)
  private BigDecimal distance;

  @Column(name = "cost", precision = 12, scale = 2)
  private BigDecimal cost;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected ShipmentRoute() {}

  public ShipmentRoute(
      UUID originLocationId,
      UUID destinationLocationId,
      int transitTimeDays,
      TransportMode transportMode) {
    requireDistinctEnds(originLocationId, destinationLocationId);
    this.originLocationId = originLocationId;
    this.destinationLocationId = destinationLocationId;
    this.transitTimeDays = transitTimeDays;
    this.transportMode = transportMode;
    this.createdAt = Instant.now();
    this.updatedAt = this.createdAt;
  }

  public void reroute(UUID originLocationId, UUID destinationLocationId, TransportMode mode) {
    requireDistinctEnds(originLocationId, destinationLocationId);
    this.originLocationId = originLocationId;
    this.destinationLocationId = destinationLocationId;
    this.transportMode = mode;
    this.updatedAt = Instant.now();
  }

  public void updateLogistics(int transitTimeDays, BigDecimal distance, BigDecimal cost) {
    this.transitTimeDays = transitTimeDays;
    this.distance = distance;
    this.cost = cost;
    this.updatedAt = Instant.now();
  }

  private static void requireDistinctEnds(UUID origin, UUID destination) {
    if (origin != null && origin.equals(destination)) {
      throw new InvalidStateException(
          "Invalid route", "Origin and destination must be different locations");
    }
  }

  // --- TenantAware ---

  @Override
  public String getTenantId() {
    return tenantId;
  }

  @Override
  public void setTenantId(String tenantId) {
    this.tenantId = tenantId;
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public UUID getOriginLocationId() {
    return originLocationId;
  }

  public UUID getDestinationLocationId() {
    return destinationLocationId;
  }

  public int getTransitTimeDays() {
    return transitTimeDays;
  }

  public TransportMode getTransportMode() {
    return transportMode;
  }

  public BigDecimal getDistance() {
    return distance;
  }

  public BigDecimal getCost() {
    return cost;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}

package io.supplyrisk.backend.inventory;

import io.supplyrisk.backend.multitenancy.TenantAware;
import io.supplyrisk.backend.multitenancy.TenantAwareEntityListener;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** Stock of one product at one location. Unique per (tenant, product, location). */
@Entity
@Table(name = "inventory")
@EntityListeners(TenantAwareEntityListener.class)
public class Inventory implements TenantAware {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "tenant_id", nullable = false, updatable = false, length = 64)
  private String tenantId;

  @Column(name = "product_id", nullable = false, updatable = false)
  private UUID productId;

  @Column(name = "location_id", nullable = false, updatable = false)
  private UUID locationId;

  @Column(name = "quantity_on_hand", nullable = false)
  private int quantityOnHand;

  @Column(name = "quantity_reserved", nullable = false)
  private int quantityReserved;

  @Column(name = "reorder_point", nullable = false)
  private int reorderPoint;

  @Column(name = "last_count_date")
  private Instant lastCountDate;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Inventory() {}

  public Inventory(UUID productId, UUID locationId) {
    this.productId = productId;
    this.locationId = locationId;
    this.createdAt = Instant.now();
    this.updatedAt = this.createdAt;
  }

  /** Null arguments leave the current value in place. */
  public void updateQuantities(
      Integer quantityOnHand, Integer quantityReserved, Integer reorderPoint) {
    if (quantityOnHand != null) {
      this.quantityOnHand = quantityOnHand;
    }
    if (quantityReserved != null) {
      this.quantityReserved = quantityReserved;
    }
    if (reorderPoint != null) {
      this.reorderPoint = reorderPoint;
    }
    this.updatedAt = Instant.now();
  }

  public void recordCount(Instant lastCountDate) {
    this.lastCountDate = lastCountDate;
    this.updatedAt = Instant.now();
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

  public UUID getProductId() {
    return productId;
  }

  public UUID getLocationId() {
    return locationId;
  }

  public int getQuantityOnHand() {
    return quantityOnHand;
  }

  public int getQuantityReserved() {
    return quantityReserved;
  }

  public int getReorderPoint() {
    return reorderPoint;
  }

  public Instant getLastCountDate() {
    return lastCountDate;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}

package io.supplyrisk.backend.product;

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

@Entity
@Table(name = "products")
@EntityListeners(TenantAwareEntityListener.class)
public class Product implements TenantAware {

  public static final String DEFAULT_UNIT_OF_MEASURE = "unit";

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "tenant_id", nullable = false, updatable = false, length = 64)
  private String tenantId;

  @Column(name = "sku", nullable = false)
  private String sku;

  @Column(name = "name", nullable = false)
  private String name;

  @Column(name = "description")
  private String description;

  @Column(name = "category", nullable = false)
  private String category;

  @Column(name = "unit_of_measure", nullable = false)
  private String unitOfMeasure;

  @Column(name = "lead_time_days", nullable = false)
  private int leadTimeDays;

  @Column(name = "supplier_id", nullable = false)
  private UUID supplierId;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Product() {}

  public Product(
      String sku,
      String name,
      String category,
      String unitOfMeasure,
      int leadTimeDays,
      UUID supplierId) {
    this.sku = sku;
    this.name = name;
    this.category = category;
    this.unitOfMeasure = unitOfMeasure != null ? unitOfMeasure : DEFAULT_UNIT_OF_MEASURE;
    this.leadTimeDays = leadTimeDays;
    this.supplierId = supplierId;
    this.createdAt = Instant.now();
    this.updatedAt = this.createdAt;
  }

  public void update(
      String name,
      String description,
      String category,
      String unitOfMeasure,
      int leadTimeDays,
      UUID supplierId) {
    this.name = name;
    this.description = description;
    this.category = category;
    if (unitOfMeasure != null) {
      this.unitOfMeasure = unitOfMeasure;
    }
    this.leadTimeDays = leadTimeDays;
    this.supplierId = supplierId;
    this.updatedAt = Instant.now();
  }

  public void setDescription(String description) {
    this.description = description;
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

  public String getSku() {
    return sku;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public String getCategory() {
    return category;
  }

  public String getUnitOfMeasure() {
    return unitOfMeasure;
  }

  public int getLeadTimeDays() {
    return leadTimeDays;
  }

  public UUID getSupplierId() {
    return supplierId;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}

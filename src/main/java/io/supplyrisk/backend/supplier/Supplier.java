package io.supplyrisk.backend.supplier;

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
@Table(name = "suppliers")
@EntityListeners(TenantAwareEntityListener.class)
public class Supplier implements TenantAware {

  public static final int DEFAULT_RATING = 3;

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "tenant_id", nullable = false, updatable = false, length = 64)
  private String tenantId;

  @Column(name = "code", nullable = false)
  private String code;

  @Column(name = "name", nullable = false)
  private String name;

  @Column(name = "country", nullable = false)
  private String country;

  @Column(name = "contact_email")
  private String contactEmail;

  @Column(name = "contact_phone")
  private String contactPhone;

  @Column(name = "address")
  private String address;

  @Column(name = "rating", nullable = false)
  private int rating;

  @Column(name = "notes")
  private String notes;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Supplier() {}

  public Supplier(String code, String name, String country, Integer rating) {
    this.code = code;
    this.name = name;
    this.country = country;
    this.rating = rating != null ? rating : DEFAULT_RATING;
    this.createdAt = Instant.now();
    this.updatedAt = this.createdAt;
  }

  public void updateDetails(String name, String country, Integer rating) {
    this.name = name;
    this.country = country;
    if (rating != null) {
      this.rating = rating;
    }
    this.updatedAt = Instant.now();
  }

  public void updateContact(String contactEmail, String contactPhone, String address) {
    this.contactEmail = contactEmail;
    this.contactPhone = contactPhone;
    this.address = address;
    this.updatedAt = Instant.now();
  }

  public void setNotes(String notes) {
    this.notes = notes;
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

  public String getCode() {
    return code;
  }

  public String getName() {
    return name;
  }

  public String getCountry() {
    return country;
  }

  public String getContactEmail() {
    return contactEmail;
  }

  public String getContactPhone() {
    return contactPhone;
  }

  public String getAddress() {
    return address;
  }

  public int getRating() {
    return rating;
  }

  public String getNotes() {
    return notes;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}

package io.supplyrisk.backend.riskevent;

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
import java.time.Instant;
import java.util.UUID;

/**
 * A disruption affecting suppliers, products, locations or routes. The resolution date, when set,
 * never precedes the start date; the entity refuses such a state and the schema has a matching
 * CHECK constraint.
 */
@Entity
@Table(name = "risk_events")
@EntityListeners(TenantAwareEntityListener.class)
public class RiskEvent implements TenantAware {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "tenant_id", nullable = false, updatable = false, length = 64)
  private String tenantId;

  @Enumerated(EnumType.STRING)
  @Column(name = "event_type", nullable = false, length = 40)
  private EventType eventType;

  @Enumerated(EnumType.STRING)
  @Column(name = "severity", nullable = false, length = 20)
  private RiskSeverity severity;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private RiskStatus status;

  @Column(name = "start_date", nullable = false)
  private Instant startDate;

  @Column(name = "resolution_date")
  private Instant resolutionDate;

  @Column(name = "title", nullable = false, length = 255)
  private String title;

  @Column(name = "description", nullable = false, columnDefinition = "TEXT")
  private String description;

  @Column(name = "impact_assessment", columnDefinition = "TEXT")
  private String impactAssessment;

  @Column(name = "mitigation_plan", columnDefinition = "TEXT")
  private String mitigationPlan;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected RiskEvent() {}

  public RiskEvent(
      EventType eventType,
      RiskSeverity severity,
      String title,
      String description,
      Instant startDate) {
    this.eventType = eventType;
    this.severity = severity;
    this.status = RiskStatus.ACTIVE;
    this.title = title;
    this.description = description;
    this.startDate = startDate;
    this.createdAt = Instant.now();
    this.updatedAt = this.createdAt;
  }

  public void updateDetails(
      EventType eventType, RiskSeverity severity, String title, String description) {
    this.eventType = eventType;
    this.severity = severity;
    this.title = title;
    this.description = description;
    this.updatedAt = Instant.now();
  }

  public void updateAssessment(String impactAssessment, String mitigationPlan) {
    this.impactAssessment = impactAssessment;
    this.mitigationPlan = mitigationPlan;
    this.updatedAt = Instant.now();
  }

  public void changeStatus(RiskStatus status) {
    this.status = status;
    this.updatedAt = Instant.now();
  }

  /** Sets both dates together; {@code resolutionDate} may be null for an open event. */
  public void reschedule(Instant startDate, Instant resolutionDate) {
    if (resolutionDate != null && resolutionDate.isBefore(startDate)) {
      throw new InvalidStateException(
          "Invalid risk event dates",
          "Resolution date " + resolutionDate + " is before start date " + startDate);
    }
    this.startDate = startDate;
    this.resolutionDate = resolutionDate;
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

  public EventType getEventType() {
    return eventType;
  }

  public RiskSeverity getSeverity() {
    return severity;
  }

  public RiskStatus getStatus() {
    return status;
  }

  public Instant getStartDate() {
    return startDate;
  }

  public Instant getResolutionDate() {
    return resolutionDate;
  }

  public String getTitle() {
    return title;
  }

  public String getDescription() {
    return description;
  }

  public String getImpactAssessment() {
    return impactAssessment;
  }

  public String getMitigationPlan() {
    return mitigationPlan;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}

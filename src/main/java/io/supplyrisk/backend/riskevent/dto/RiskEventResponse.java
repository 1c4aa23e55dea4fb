package io.supplyrisk.backend.riskevent.dto;

import io.supplyrisk.backend.riskevent.EventType;
import io.supplyrisk.backend.riskevent.RiskEvent;
import io.supplyrisk.backend.riskevent.RiskSeverity;
import io.supplyrisk.backend.riskevent.RiskStatus;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** A risk event with the ids of everything linked to it. */
public record RiskEventResponse(
    UUID id,
    EventType eventType,
    RiskSeverity severity,
    RiskStatus status,
    Instant startDate,
    Instant resolutionDate,
    String title,
    String description,
    String impactAssessment,
    String mitigationPlan,
    List<UUID> supplierIds,
    List<UUID> productIds,
    List<UUID> locationIds,
    List<UUID> routeIds,
    Instant createdAt,
    Instant updatedAt) {

  public static RiskEventResponse from(
      RiskEvent event,
      List<UUID> supplierIds,
      List<UUID> productIds,
      List<UUID> locationIds,
      List<UUID> routeIds) {
    return new RiskEventResponse(
        event.getId(),
        event.getEventType(),
        event.getSeverity(),
        event.getStatus(),
        event.getStartDate(),
        event.getResolutionDate(),
        event.getTitle(),
        event.getDescription(),
        event.getImpactAssessment(),
        event.getMitigationPlan(),
        supplierIds,
        productIds,
        locationIds,
        routeIds,
        event.getCreatedAt(),
        event.getUpdatedAt());
  }
}

package io.supplyrisk.backend.riskevent.dto;

import io.supplyrisk.backend.riskevent.EventType;
import io.supplyrisk.backend.riskevent.RiskSeverity;
import io.supplyrisk.backend.riskevent.RiskStatus;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;

public record UpdateRiskEventRequest(
    @NotNull EventType eventType,
    @NotNull RiskSeverity severity,
    @NotNull RiskStatus status,
    @NotNull Instant startDate,
    Instant resolutionDate,
    @NotBlank @Size(max = 255) String title,
    @NotBlank String description,
    String impactAssessment,
    String mitigationPlan) {

  @AssertTrue(message = "resolutionDate must not be before startDate")
  public boolean isDateOrderValid() {
    return startDate == null || resolutionDate == null || !resolutionDate.isBefore(startDate);
  }
}

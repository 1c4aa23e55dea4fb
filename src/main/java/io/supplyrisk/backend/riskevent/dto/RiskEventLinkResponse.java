package io.supplyrisk.backend.riskevent.dto;

import io.supplyrisk.backend.riskevent.RiskEventLink;
import io.supplyrisk.backend.riskevent.RiskEventLinkType;
import java.time.Instant;
import java.util.UUID;

public record RiskEventLinkResponse(
    UUID id, UUID riskEventId, String linkType, UUID linkedId, Instant createdAt) {

  public static RiskEventLinkResponse from(RiskEventLinkType<?> type, RiskEventLink link) {
    return new RiskEventLinkResponse(
        link.getId(),
        link.getRiskEventId(),
        type.pathSegment(),
        link.getLinkedId(),
        link.getCreatedAt());
  }
}

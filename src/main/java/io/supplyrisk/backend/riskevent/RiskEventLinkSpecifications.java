package io.supplyrisk.backend.riskevent;

import java.util.Collection;
import java.util.UUID;
import org.springframework.data.jpa.domain.Specification;

final class RiskEventLinkSpecifications {

  private RiskEventLinkSpecifications() {}

  static <L extends RiskEventLink> Specification<L> forRiskEvent(UUID riskEventId) {
    return (root, query, cb) -> cb.equal(root.get("riskEventId"), riskEventId);
  }

  static <L extends RiskEventLink> Specification<L> forRiskEvents(Collection<UUID> riskEventIds) {
    return (root, query, cb) -> root.get("riskEventId").in(riskEventIds);
  }

  static <L extends RiskEventLink> Specification<L> linking(
      RiskEventLinkType<L> type, UUID riskEventId, UUID linkedId) {
    Specification<L> sameEvent = forRiskEvent(riskEventId);
    return sameEvent.and((root, query, cb) -> cb.equal(root.get(type.linkedAttribute()), linkedId));
  }
}

package io.supplyrisk.backend.riskevent;

import java.time.Instant;
import org.springframework.data.jpa.domain.Specification;

public final class RiskEventSpecifications {

  private RiskEventSpecifications() {}

  public static Specification<RiskEvent> ofType(EventType eventType) {
    return (root, query, cb) -> cb.equal(root.get("eventType"), eventType);
  }

  public static Specification<RiskEvent> withSeverity(RiskSeverity severity) {
    return (root, query, cb) -> cb.equal(root.get("severity"), severity);
  }

  public static Specification<RiskEvent> withStatus(RiskStatus status) {
    return (root, query, cb) -> cb.equal(root.get("status"), status);
  }

  public static Specification<RiskEvent> startedAfter(Instant from) {
    return (root, query, cb) -> cb.greaterThanOrEqualTo(root.<Instant>get("startDate"), from);
  }

  /** Events with no resolution date yet. */
  public static Specification<RiskEvent> unresolved() {
    return (root, query, cb) -> cb.isNull(root.get("resolutionDate"));
  }
}

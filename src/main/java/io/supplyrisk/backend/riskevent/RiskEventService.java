package io.supplyrisk.backend.riskevent;

import io.supplyrisk.backend.multitenancy.EntityStore;
import io.supplyrisk.backend.multitenancy.EntityStores;
import io.supplyrisk.backend.riskevent.dto.CreateRiskEventRequest;
import io.supplyrisk.backend.riskevent.dto.RiskEventResponse;
import io.supplyrisk.backend.riskevent.dto.UpdateRiskEventRequest;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class RiskEventService {

  private static final Logger log = LoggerFactory.getLogger(RiskEventService.class);

  private final EntityStore<RiskEvent> riskEvents;
  private final RiskEventAssociationService associations;

  public RiskEventService(EntityStores stores, RiskEventAssociationService associations) {
    this.riskEvents = stores.forEntity(RiskEvent.class);
    this.associations = associations;
  }

  @Transactional
  public RiskEventResponse create(CreateRiskEventRequest request) {
    var event =
        new RiskEvent(
            request.eventType(),
            request.severity(),
            request.title(),
            request.description(),
            request.startDate());
    event.reschedule(request.startDate(), request.resolutionDate());
    event.updateAssessment(request.impactAssessment(), request.mitigationPlan());
    if (request.status() != null) {
      event.changeStatus(request.status());
    }
    event = riskEvents.create(event);

    log.info(
        "Created risk event: id={}, type={}, severity={}",
        event.getId(),
        event.getEventType(),
        event.getSeverity());
    return withLinks(List.of(event)).get(0);
  }

  @Transactional(readOnly = true)
  public RiskEventResponse findById(UUID id) {
    return withLinks(List.of(riskEvents.getById(id))).get(0);
  }

  @Transactional(readOnly = true)
  public List<RiskEventResponse> findAll(Specification<RiskEvent> filter) {
    return withLinks(riskEvents.findAll(filter, Sort.by(Sort.Direction.DESC, "startDate")));
  }

  /** Number of matching events per severity; severities with no events map to zero. */
  @Transactional(readOnly = true)
  public Map<RiskSeverity, Long> countBySeverity(Specification<RiskEvent> filter) {
    Map<RiskSeverity, Long> counts = new EnumMap<>(RiskSeverity.class);
    for (RiskSeverity severity : RiskSeverity.values()) {
      counts.put(severity, 0L);
    }
    counts.putAll(riskEvents.countBy("severity", RiskSeverity.class, filter));
    return counts;
  }

  @Transactional
  public RiskEventResponse update(UUID id, UpdateRiskEventRequest request) {
    var event =
        riskEvents.update(
            id,
            e -> {
              e.updateDetails(
                  request.eventType(), request.severity(), request.title(), request.description());
              e.reschedule(request.startDate(), request.resolutionDate());
              e.updateAssessment(request.impactAssessment(), request.mitigationPlan());
              e.changeStatus(request.status());
            });

    log.info("Updated risk event: id={}, status={}", event.getId(), event.getStatus());
    return withLinks(List.of(event)).get(0);
  }

  /** Removes the event; its links to suppliers, products, locations and routes go with it. */
  @Transactional
  public void delete(UUID id) {
    riskEvents.deleteById(id);
    log.info("Deleted risk event: id={}", id);
  }

  private List<RiskEventResponse> withLinks(List<RiskEvent> events) {
    List<UUID> ids = events.stream().map(RiskEvent::getId).toList();
    var suppliers = associations.linkedIdsByRiskEvent(RiskEventLinkType.SUPPLIER, ids);
    var products = associations.linkedIdsByRiskEvent(RiskEventLinkType.PRODUCT, ids);
    var locations = associations.linkedIdsByRiskEvent(RiskEventLinkType.LOCATION, ids);
    var routes = associations.linkedIdsByRiskEvent(RiskEventLinkType.ROUTE, ids);
    return events.stream()
        .map(
            e ->
                RiskEventResponse.from(
                    e,
                    suppliers.getOrDefault(e.getId(), List.of()),
                    products.getOrDefault(e.getId(), List.of()),
                    locations.getOrDefault(e.getId(), List.of()),
                    routes.getOrDefault(e.getId(), List.of())))
        .toList();
  }
}

package io.supplyrisk.backend.riskevent;

import io.supplyrisk.backend.exception.ResourceNotFoundException;
import io.supplyrisk.backend.riskevent.dto.CreateRiskEventRequest;
import io.supplyrisk.backend.riskevent.dto.RiskEventLinkResponse;
import io.supplyrisk.backend.riskevent.dto.RiskEventResponse;
import io.supplyrisk.backend.riskevent.dto.UpdateRiskEventRequest;
import jakarta.validation.Valid;
import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/risk-events")
public class RiskEventController {

  private final RiskEventService riskEventService;
  private final RiskEventAssociationService associationService;

  public RiskEventController(
      RiskEventService riskEventService, RiskEventAssociationService associationService) {
    this.riskEventService = riskEventService;
    this.associationService = associationService;
  }

  @GetMapping
  public ResponseEntity<List<RiskEventResponse>> list(
      @RequestParam(required = false) EventType eventType,
      @RequestParam(required = false) RiskSeverity severity,
      @RequestParam(required = false) RiskStatus status,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant startedAfter,
      @RequestParam(defaultValue = "false") boolean unresolved) {
    var filter = filter(eventType, severity, status);
    if (startedAfter != null) {
      filter = and(filter, RiskEventSpecifications.startedAfter(startedAfter));
    }
    if (unresolved) {
      filter = and(filter, RiskEventSpecifications.unresolved());
    }
    return ResponseEntity.ok(riskEventService.findAll(filter));
  }

  @GetMapping("/severity-counts")
  public ResponseEntity<Map<RiskSeverity, Long>> severityCounts(
      @RequestParam(required = false) EventType eventType,
      @RequestParam(required = false) RiskStatus status) {
    return ResponseEntity.ok(riskEventService.countBySeverity(filter(eventType, null, status)));
  }

  @GetMapping("/{id}")
  public ResponseEntity<RiskEventResponse> get(@PathVariable UUID id) {
    return ResponseEntity.ok(riskEventService.findById(id));
  }

  @PostMapping
  public ResponseEntity<RiskEventResponse> create(
      @Valid @RequestBody CreateRiskEventRequest request) {
    var response = riskEventService.create(request);
    return ResponseEntity.created(URI.create("/api/risk-events/" + response.id())).body(response);
  }

  @PutMapping("/{id}")
  public ResponseEntity<RiskEventResponse> update(
      @PathVariable UUID id, @Valid @RequestBody UpdateRiskEventRequest request) {
    return ResponseEntity.ok(riskEventService.update(id, request));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(@PathVariable UUID id) {
    riskEventService.delete(id);
    return ResponseEntity.noContent().build();
  }

  // --- Links to suppliers, products, locations and routes ---

  @GetMapping("/{id}/{linkType}")
  public ResponseEntity<List<UUID>> linked(
      @PathVariable UUID id, @PathVariable String linkType) {
    return ResponseEntity.ok(associationService.linkedIds(resolve(linkType), id));
  }

  @PostMapping("/{id}/{linkType}/{linkedId}")
  public ResponseEntity<RiskEventLinkResponse> link(
      @PathVariable UUID id, @PathVariable String linkType, @PathVariable UUID linkedId) {
    var response = associationService.addAssociation(resolve(linkType), id, linkedId);
    return ResponseEntity.created(
            URI.create("/api/risk-events/" + id + "/" + linkType + "/" + linkedId))
        .body(response);
  }

  @DeleteMapping("/{id}/{linkType}/{linkedId}")
  public ResponseEntity<Void> unlink(
      @PathVariable UUID id, @PathVariable String linkType, @PathVariable UUID linkedId) {
    associationService.removeAssociation(resolve(linkType), id, linkedId);
    return ResponseEntity.noContent().build();
  }

  private static RiskEventLinkType<?> resolve(String linkType) {
    return RiskEventLinkType.fromPathSegment(linkType)
        .orElseThrow(
            () ->
                ResourceNotFoundException.withDetail(
                    "Unknown link type", "No risk event link of type " + linkType));
  }

  private static Specification<RiskEvent> filter(
      EventType eventType, RiskSeverity severity, RiskStatus status) {
    List<Specification<RiskEvent>> filters = new ArrayList<>();
    if (eventType != null) {
      filters.add(RiskEventSpecifications.ofType(eventType));
    }
    if (severity != null) {
      filters.add(RiskEventSpecifications.withSeverity(severity));
    }
    if (status != null) {
      filters.add(RiskEventSpecifications.withStatus(status));
    }
    return filters.stream().reduce(Specification::and).orElse(null);
  }

  private static Specification<RiskEvent> and(
      Specification<RiskEvent> filter, Specification<RiskEvent> extra) {
    return filter == null ? extra : filter.and(extra);
  }
}

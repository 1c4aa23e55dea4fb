package io.supplyrisk.backend.riskevent;

import io.supplyrisk.backend.multitenancy.EntityStore;
import io.supplyrisk.backend.multitenancy.EntityStores;
import io.supplyrisk.backend.riskevent.dto.RiskEventLinkResponse;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Adds and removes links between a risk event and the suppliers, products, locations and routes it
 * affects. Both sides must resolve in the active tenant, so a link can never point across tenants.
 * A second link for the same pair fails with {@code ResourceConflictException}.
 */
@Service
public class RiskEventAssociationService {

  private static final Logger log = LoggerFactory.getLogger(RiskEventAssociationService.class);

  private final EntityStores stores;
  private final EntityStore<RiskEvent> riskEvents;

  public RiskEventAssociationService(EntityStores stores) {
    this.stores = stores;
    this.riskEvents = stores.forEntity(RiskEvent.class);
  }

  @Transactional
  public <L extends RiskEventLink> RiskEventLinkResponse addAssociation(
      RiskEventLinkType<L> type, UUID riskEventId, UUID linkedId) {
    riskEvents.getById(riskEventId);
    stores.forEntity(type.targetType()).getById(linkedId);

    L link = stores.forEntity(type.linkType()).create(type.newLink(riskEventId, linkedId));

    log.info("Linked risk event {} to {} {}", riskEventId, type.pathSegment(), linkedId);
    return RiskEventLinkResponse.from(type, link);
  }

  /** Removes the link between the pair and returns how many rows went; zero when none existed. */
  @Transactional
  public <L extends RiskEventLink> int removeAssociation(
      RiskEventLinkType<L> type, UUID riskEventId, UUID linkedId) {
    int removed =
        stores
            .forEntity(type.linkType())
            .deleteAll(RiskEventLinkSpecifications.linking(type, riskEventId, linkedId));
    log.info(
        "Unlinked risk event {} from {} {} (rows={})",
        riskEventId,
        type.pathSegment(),
        linkedId,
        removed);
    return removed;
  }

  @Transactional(readOnly = true)
  public <L extends RiskEventLink> List<UUID> linkedIds(
      RiskEventLinkType<L> type, UUID riskEventId) {
    riskEvents.getById(riskEventId);
    return stores
        .forEntity(type.linkType())
        .findAll(RiskEventLinkSpecifications.<L>forRiskEvent(riskEventId), Sort.by("createdAt"))
        .stream()
        .map(RiskEventLink::getLinkedId)
        .toList();
  }

  /**
   * Linked ids of one junction for a batch of risk events, keyed by risk event id. Events without
   * links are absent from the result.
   */
  @Transactional(readOnly = true)
  public <L extends RiskEventLink> Map<UUID, List<UUID>> linkedIdsByRiskEvent(
      RiskEventLinkType<L> type, Collection<UUID> riskEventIds) {
    Map<UUID, List<UUID>> byEvent = new LinkedHashMap<>();
    if (riskEventIds.isEmpty()) {
      return byEvent;
    }
    stores
        .forEntity(type.linkType())
        .findAll(RiskEventLinkSpecifications.<L>forRiskEvents(riskEventIds), Sort.by("createdAt"))
        .forEach(
            link ->
                byEvent
                    .computeIfAbsent(link.getRiskEventId(), id -> new ArrayList<>())
                    .add(link.getLinkedId()));
    return byEvent;
  }
}

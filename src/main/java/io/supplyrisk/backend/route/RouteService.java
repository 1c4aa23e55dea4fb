package io.supplyrisk.backend.route;

import io.supplyrisk.backend.location.Location;
import io.supplyrisk.backend.location.LocationSpecifications;
import io.supplyrisk.backend.location.dto.LocationResponse;
import io.supplyrisk.backend.multitenancy.EntityStore;
import io.supplyrisk.backend.multitenancy.EntityStores;
import io.supplyrisk.backend.route.dto.CreateRouteRequest;
import io.supplyrisk.backend.route.dto.RouteResponse;
import io.supplyrisk.backend.route.dto.UpdateRouteRequest;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class RouteService {

  private static final Logger log = LoggerFactory.getLogger(RouteService.class);

  private final EntityStore<ShipmentRoute> routes;
  private final EntityStore<Location> locations;

  public RouteService(EntityStores stores) {
    this.routes = stores.forEntity(ShipmentRoute.class);
    this.locations = stores.forEntity(Location.class);
  }

  @Transactional
  public RouteResponse create(CreateRouteRequest request) {
    var origin = locations.getById(request.originLocationId());
    var destination = locations.getById(request.destinationLocationId());

    var route =
        new ShipmentRoute(
            origin.getId(),
            destination.getId(),
            request.transitTimeDays(),
            request.transportMode());
    route.updateLogistics(request.transitTimeDays(), request.distance(), request.cost());
    route = routes.create(route);

    log.info(
        "Created route: id={}, origin={}, destination={}, mode={}",
        route.getId(),
        origin.getCode(),
        destination.getCode(),
        route.getTransportMode());
    return RouteResponse.from(
        route, LocationResponse.from(origin), LocationResponse.from(destination));
  }

  @Transactional(readOnly = true)
  public RouteResponse findById(UUID id) {
    var route = routes.getById(id);
    return withLocations(List.of(route)).get(0);
  }

  @Transactional(readOnly = true)
  public List<RouteResponse> findAll(Specification<ShipmentRoute> filter) {
    return withLocations(routes.findAll(filter, Sort.by("createdAt")));
  }

  @Transactional
  public RouteResponse update(UUID id, UpdateRouteRequest request) {
    locations.getById(request.originLocationId());
    locations.getById(request.destinationLocationId());

    var route =
        routes.update(
            id,
            r -> {
              r.reroute(
                  request.originLocationId(),
                  request.destinationLocationId(),
                  request.transportMode());
              r.updateLogistics(request.transitTimeDays(), request.distance(), request.cost());
            });

    log.info("Updated route: id={}", route.getId());
    return withLocations(List.of(route)).get(0);
  }

  /** Removes the route together with its risk links. */
  @Transactional
  public void delete(UUID id) {
    routes.deleteById(id);
    log.info("Deleted route: id={}", id);
  }

  private List<RouteResponse> withLocations(List<ShipmentRoute> found) {
    Set<UUID> locationIds = new HashSet<>();
    for (var route : found) {
      locationIds.add(route.getOriginLocationId());
      locationIds.add(route.getDestinationLocationId());
    }
    Map<UUID, LocationResponse> byId =
        locationIds.isEmpty()
            ? Map.of()
            : locations.findAll(LocationSpecifications.idIn(locationIds)).stream()
                .map(LocationResponse::from)
                .collect(Collectors.toMap(LocationResponse::id, Function.identity()));
    return found.stream()
        .map(
            r ->
                RouteResponse.from(
                    r, byId.get(r.getOriginLocationId()), byId.get(r.getDestinationLocationId())))
        .toList();
  }
}

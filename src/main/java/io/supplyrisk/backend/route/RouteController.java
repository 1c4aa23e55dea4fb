package io.supplyrisk.backend.route;

import io.supplyrisk.backend.route.dto.CreateRouteRequest;
import io.supplyrisk.backend.route.dto.RouteResponse;
import io.supplyrisk.backend.route.dto.UpdateRouteRequest;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.domain.Specification;
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
@RequestMapping("/api/routes")
public class RouteController {

  private final RouteService routeService;

  public RouteController(RouteService routeService) {
    this.routeService = routeService;
  }

  @GetMapping
  public ResponseEntity<List<RouteResponse>> list(
      @RequestParam(required = false) UUID originLocationId,
      @RequestParam(required = false) UUID destinationLocationId,
      @RequestParam(required = false) TransportMode transportMode) {
    List<Specification<ShipmentRoute>> filters = new ArrayList<>();
    if (originLocationId != null) {
      filters.add(RouteSpecifications.from(originLocationId));
    }
    if (destinationLocationId != null) {
      filters.add(RouteSpecifications.to(destinationLocationId));
    }
    if (transportMode != null) {
      filters.add(RouteSpecifications.byMode(transportMode));
    }
    return ResponseEntity.ok(
        routeService.findAll(filters.stream().reduce(Specification::and).orElse(null)));
  }

  @GetMapping("/{id}")
  public ResponseEntity<RouteResponse> get(@PathVariable UUID id) {
    return ResponseEntity.ok(routeService.findById(id));
  }

  @PostMapping
  public ResponseEntity<RouteResponse> create(@Valid @RequestBody CreateRouteRequest request) {
    var response = routeService.create(request);
    return ResponseEntity.created(URI.create("/api/routes/" + response.id())).body(response);
  }

  @PutMapping("/{id}")
  public ResponseEntity<RouteResponse> update(
      @PathVariable UUID id, @Valid @RequestBody UpdateRouteRequest request) {
    return ResponseEntity.ok(routeService.update(id, request));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(@PathVariable UUID id) {
    routeService.delete(id);
    return ResponseEntity.noContent().build();
  }
}

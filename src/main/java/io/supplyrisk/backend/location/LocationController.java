package io.supplyrisk.backend.location;

import io.supplyrisk.backend.location.dto.CreateLocationRequest;
import io.supplyrisk.backend.location.dto.LocationResponse;
import io.supplyrisk.backend.location.dto.UpdateLocationRequest;
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
@RequestMapping("/api/locations")
public class LocationController {

  private final LocationService locationService;

  public LocationController(LocationService locationService) {
    this.locationService = locationService;
  }

  @GetMapping
  public ResponseEntity<List<LocationResponse>> list(
      @RequestParam(required = false) LocationType type,
      @RequestParam(required = false) LocationStatus status,
      @RequestParam(required = false) String country) {
    List<Specification<Location>> filters = new ArrayList<>();
    if (type != null) {
      filters.add(LocationSpecifications.ofType(type));
    }
    if (status != null) {
      filters.add(LocationSpecifications.withStatus(status));
    }
    if (country != null && !country.isBlank()) {
      filters.add(LocationSpecifications.inCountry(country));
    }
    return ResponseEntity.ok(
        locationService.findAll(filters.stream().reduce(Specification::and).orElse(null)));
  }

  @GetMapping("/{id}")
  public ResponseEntity<LocationResponse> get(@PathVariable UUID id) {
    return ResponseEntity.ok(locationService.findById(id));
  }

  @PostMapping
  public ResponseEntity<LocationResponse> create(
      @Valid @RequestBody CreateLocationRequest request) {
    var response = locationService.create(request);
    return ResponseEntity.created(URI.create("/api/locations/" + response.id())).body(response);
  }

  @PutMapping("/{id}")
  public ResponseEntity<LocationResponse> update(
      @PathVariable UUID id, @Valid @RequestBody UpdateLocationRequest request) {
    return ResponseEntity.ok(locationService.update(id, request));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(@PathVariable UUID id) {
    locationService.delete(id);
    return ResponseEntity.noContent().build();
  }
}

package io.supplyrisk.backend.location;

import io.supplyrisk.backend.location.dto.CreateLocationRequest;
import io.supplyrisk.backend.location.dto.LocationResponse;
import io.supplyrisk.backend.location.dto.UpdateLocationRequest;
import io.supplyrisk.backend.multitenancy.EntityStore;
import io.supplyrisk.backend.multitenancy.EntityStores;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class LocationService {

  private static final Logger log = LoggerFactory.getLogger(LocationService.class);

  private final EntityStore<Location> locations;

  public LocationService(EntityStores stores) {
    this.locations = stores.forEntity(Location.class);
  }

  @Transactional
  public LocationResponse create(CreateLocationRequest request) {
    var location =
        new Location(request.code(), request.name(), request.type(), request.country());
    location.updateDetails(request.name(), request.type(), request.capacity());
    location.updateAddress(
        request.address(),
        request.city(),
        request.state(),
        request.country(),
        request.postalCode());
    location.updateCoordinates(request.latitude(), request.longitude());
    location = locations.create(location);

    log.info("Created location: id={}, code={}", location.getId(), location.getCode());
    return LocationResponse.from(location);
  }

  @Transactional(readOnly = true)
  public LocationResponse findById(UUID id) {
    return LocationResponse.from(locations.getById(id));
  }

  @Transactional(readOnly = true)
  public List<LocationResponse> findAll(Specification<Location> filter) {
    return locations.findAll(filter, Sort.by("code")).stream().map(LocationResponse::from).toList();
  }

  @Transactional
  public LocationResponse update(UUID id, UpdateLocationRequest request) {
    var location =
        locations.update(
            id,
            l -> {
              l.updateDetails(request.name(), request.type(), request.capacity());
              l.updateAddress(
                  request.address(),
                  request.city(),
                  request.state(),
                  request.country(),
                  request.postalCode());
              l.updateCoordinates(request.latitude(), request.longitude());
              l.changeStatus(request.status());
            });

    log.info("Updated location: id={}", location.getId());
    return LocationResponse.from(location);
  }

  /**
   * Rejected with a conflict while shipment routes start or end here. Inventory rows and risk links
   * at this location are removed with it.
   */
  @Transactional
  public void delete(UUID id) {
    locations.deleteById(id);
    log.info("Deleted location: id={}", id);
  }
}

package io.supplyrisk.backend.route;

import java.util.UUID;
import org.springframework.data.jpa.domain.Specification;

public final class RouteSpecifications {

  private RouteSpecifications() {}

  public static Specification<ShipmentRoute> from(UUID originLocationId) {
    return (root, query, cb) -> cb.equal(root.get("originLocationId"), originLocationId);
  }

  public static Specification<ShipmentRoute> to(UUID destinationLocationId) {
    return (root, query, cb) -> cb.equal(root.get("destinationLocationId"), destinationLocationId);
  }

  public static Specification<ShipmentRoute> byMode(TransportMode mode) {
    return (root, query, cb) -> cb.equal(root.get("transportMode"), mode);
  }
}

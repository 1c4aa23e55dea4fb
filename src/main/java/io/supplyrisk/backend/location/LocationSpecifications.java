package io.supplyrisk.backend.location;

import java.util.Collection;
import java.util.UUID;
import org.springframework.data.jpa.domain.Specification;

public final class LocationSpecifications {

  private LocationSpecifications() {}

  public static Specification<Location> hasCode(String code) {
    return (root, query, cb) -> cb.equal(root.get("code"), code);
  }

  public static Specification<Location> idIn(Collection<UUID> ids) {
    return (root, query, cb) -> root.get("id").in(ids);
  }

  public static Specification<Location> ofType(LocationType type) {
    return (root, query, cb) -> cb.equal(root.get("type"), type);
  }

  public static Specification<Location> withStatus(LocationStatus status) {
    return (root, query, cb) -> cb.equal(root.get("status"), status);
  }

  public static Specification<Location> inCountry(String country) {
    return (root, query, cb) -> cb.equal(root.get("country"), country);
  }
}

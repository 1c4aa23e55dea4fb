package io.supplyrisk.backend.inventory;

import java.util.UUID;
import org.springframework.data.jpa.domain.Specification;

public final class InventorySpecifications {

  private InventorySpecifications() {}

  public static Specification<Inventory> forProduct(UUID productId) {
    return (root, query, cb) -> cb.equal(root.get("productId"), productId);
  }

  public static Specification<Inventory> atLocation(UUID locationId) {
    return (root, query, cb) -> cb.equal(root.get("locationId"), locationId);
  }

  public static Specification<Inventory> forProductAtLocation(UUID productId, UUID locationId) {
    return forProduct(productId).and(atLocation(locationId));
  }

  /** Rows at or below their reorder point. */
  public static Specification<Inventory> belowReorderPoint() {
    return (root, query, cb) ->
        cb.lessThanOrEqualTo(
            root.<Integer>get("quantityOnHand"), root.<Integer>get("reorderPoint"));
  }
}

package io.supplyrisk.backend.inventory.dto;

import io.supplyrisk.backend.inventory.Inventory;
import java.time.Instant;
import java.util.UUID;

public record InventoryResponse(
    UUID id,
    UUID productId,
    UUID locationId,
    int quantityOnHand,
    int quantityReserved,
    int reorderPoint,
    Instant lastCountDate,
    Instant createdAt,
    Instant updatedAt) {

  public static InventoryResponse from(Inventory inventory) {
    return new InventoryResponse(
        inventory.getId(),
        inventory.getProductId(),
        inventory.getLocationId(),
        inventory.getQuantityOnHand(),
        inventory.getQuantityReserved(),
        inventory.getReorderPoint(),
        inventory.getLastCountDate(),
        inventory.getCreatedAt(),
        inventory.getUpdatedAt());
  }
}

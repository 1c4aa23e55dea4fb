package io.supplyrisk.backend.inventory.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.UUID;

/** Quantities left null default to zero. */
public record CreateInventoryRequest(
    @NotNull UUID productId,
    @NotNull UUID locationId,
    @Min(0) Integer quantityOnHand,
    @Min(0) Integer quantityReserved,
    @Min(0) Integer reorderPoint,
    Instant lastCountDate) {}

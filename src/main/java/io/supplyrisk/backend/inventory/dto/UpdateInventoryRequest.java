package io.supplyrisk.backend.inventory.dto;

import jakarta.validation.constraints.Min;
import java.time.Instant;

/** Null fields keep their current value. */
public record UpdateInventoryRequest(
    @Min(0) Integer quantityOnHand,
    @Min(0) Integer quantityReserved,
    @Min(0) Integer reorderPoint,
    Instant lastCountDate) {}

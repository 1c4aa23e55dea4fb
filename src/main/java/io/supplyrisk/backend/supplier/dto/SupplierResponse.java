package io.supplyrisk.backend.supplier.dto;

import io.supplyrisk.backend.supplier.Supplier;
import java.time.Instant;
import java.util.UUID;

public record SupplierResponse(
    UUID id,
    String code,
    String name,
    String country,
    String contactEmail,
    String contactPhone,
    String address,
    int rating,
    String notes,
    Instant createdAt,
    Instant updatedAt) {

  public static SupplierResponse from(Supplier supplier) {
    return new SupplierResponse(
        supplier.getId(),
        supplier.getCode(),
        supplier.getName(),
        supplier.getCountry(),
        supplier.getContactEmail(),
        supplier.getContactPhone(),
        supplier.getAddress(),
        supplier.getRating(),
        supplier.getNotes(),
        supplier.getCreatedAt(),
        supplier.getUpdatedAt());
  }
}

package io.supplyrisk.backend.product.dto;

import io.supplyrisk.backend.product.Product;
import io.supplyrisk.backend.supplier.dto.SupplierResponse;
import java.time.Instant;
import java.util.UUID;

/** A product, with its supplier when the read asked for it. */
public record ProductResponse(
    UUID id,
    String sku,
    String name,
    String description,
    String category,
    String unitOfMeasure,
    int leadTimeDays,
    UUID supplierId,
    SupplierResponse supplier,
    Instant createdAt,
    Instant updatedAt) {

  public static ProductResponse from(Product product) {
    return from(product, null);
  }

  public static ProductResponse from(Product product, SupplierResponse supplier) {
    return new ProductResponse(
        product.getId(),
        product.getSku(),
        product.getName(),
        product.getDescription(),
        product.getCategory(),
        product.getUnitOfMeasure(),
        product.getLeadTimeDays(),
        product.getSupplierId(),
        supplier,
        product.getCreatedAt(),
        product.getUpdatedAt());
  }
}

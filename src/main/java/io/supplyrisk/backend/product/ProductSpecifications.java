package io.supplyrisk.backend.product;

import java.util.UUID;
import org.springframework.data.jpa.domain.Specification;

public final class ProductSpecifications {

  private ProductSpecifications() {}

  public static Specification<Product> hasSku(String sku) {
    return (root, query, cb) -> cb.equal(root.get("sku"), sku);
  }

  public static Specification<Product> inCategory(String category) {
    return (root, query, cb) -> cb.equal(root.get("category"), category);
  }

  public static Specification<Product> suppliedBy(UUID supplierId) {
    return (root, query, cb) -> cb.equal(root.get("supplierId"), supplierId);
  }
}

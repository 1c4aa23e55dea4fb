package io.supplyrisk.backend.supplier;

import org.springframework.data.jpa.domain.Specification;

/** Filters for supplier lookups. Tenant scoping is added by the store, never here. */
public final class SupplierSpecifications {

  private SupplierSpecifications() {}

  public static Specification<Supplier> hasCode(String code) {
    return (root, query, cb) -> cb.equal(root.get("code"), code);
  }

  public static Specification<Supplier> inCountry(String country) {
    return (root, query, cb) -> cb.equal(root.get("country"), country);
  }

  public static Specification<Supplier> ratedAtLeast(int rating) {
    return (root, query, cb) -> cb.greaterThanOrEqualTo(root.<Integer>get("rating"), rating);
  }
}

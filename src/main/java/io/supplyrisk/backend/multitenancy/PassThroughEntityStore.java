package io.supplyrisk.backend.multitenancy;

import jakarta.persistence.EntityManager;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import org.springframework.orm.jpa.vendor.HibernateJpaDialect;

/** Store for entity types that are not partitioned by tenant. Filters and rows pass untouched. */
class PassThroughEntityStore<T> extends JpaEntityStore<T> {

  PassThroughEntityStore(
      EntityManager entityManager, Class<T> entityType, HibernateJpaDialect jpaDialect) {
    super(entityManager, entityType, jpaDialect);
  }

  @Override
  protected String beginOperation(String operation) {
    return null;
  }

  @Override
  protected Predicate scopePredicate(Root<T> root, CriteriaBuilder cb, String scope) {
    return null;
  }

  @Override
  protected void stamp(T entity, String scope) {}
}

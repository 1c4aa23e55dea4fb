package io.supplyrisk.backend.multitenancy;

import jakarta.persistence.EntityManager;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.orm.jpa.vendor.HibernateJpaDialect;

/**
 * Store for {@link TenantAware} entities. Every operation requires an active tenant and fails with
 * {@code MissingTenantContextException} before touching storage when there is none.
 *
 * <ul>
 *   <li>reads, counts, aggregates: {@code tenant_id = :active} is ANDed into the filter
 *   <li>creates: the row is stamped with the active tenant, overriding the caller's value
 *   <li>updates, upserts, deletes: the target is located through the same tenant predicate, so a
 *       row owned by another tenant is simply not found
 * </ul>
 */
class TenantScopedEntityStore<T extends TenantAware> extends JpaEntityStore<T> {

  private static final Logger log = LoggerFactory.getLogger(TenantScopedEntityStore.class);

  static final String TENANT_ATTRIBUTE = "tenantId";

  TenantScopedEntityStore(
      EntityManager entityManager, Class<T> entityType, HibernateJpaDialect jpaDialect) {
    super(entityManager, entityType, jpaDialect);
  }

  @Override
  protected String beginOperation(String operation) {
    String tenantId = TenantContext.requireActiveTenant();
    log.debug("Scoping {}.{} to tenant {}", entityType().getSimpleName(), operation, tenantId);
    return tenantId;
  }

  @Override
  protected Predicate scopePredicate(Root<T> root, CriteriaBuilder cb, String tenantId) {
    return cb.equal(root.get(TENANT_ATTRIBUTE), tenantId);
  }

  @Override
  protected void stamp(T entity, String tenantId) {
    entity.setTenantId(tenantId);
  }
}

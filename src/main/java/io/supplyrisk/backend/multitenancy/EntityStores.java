package io.supplyrisk.backend.multitenancy;

import jakarta.persistence.EntityManager;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.orm.jpa.vendor.HibernateJpaDialect;
import org.springframework.stereotype.Component;

/**
 * Hands out {@link EntityStore}s. This is the only bean holding the {@code EntityManager}: an
 * entity type implementing {@link TenantAware} always gets a tenant-scoped store, any other type a
 * pass-through store.
 */
@Component
public class EntityStores {

  private final EntityManager entityManager;
  private final HibernateJpaDialect jpaDialect = new HibernateJpaDialect();
  private final Map<Class<?>, EntityStore<?>> stores = new ConcurrentHashMap<>();

  public EntityStores(EntityManager entityManager) {
    this.entityManager = entityManager;
  }

  @SuppressWarnings("unchecked")
  public <T> EntityStore<T> forEntity(Class<T> entityType) {
    return (EntityStore<T>) stores.computeIfAbsent(entityType, this::createStore);
  }

  public static boolean isTenantScoped(Class<?> entityType) {
    return TenantAware.class.isAssignableFrom(entityType);
  }

  private EntityStore<?> createStore(Class<?> entityType) {
    if (isTenantScoped(entityType)) {
      return tenantScoped(entityType.asSubclass(TenantAware.class));
    }
    return new PassThroughEntityStore<>(entityManager, entityType, jpaDialect);
  }

  private <T extends TenantAware> EntityStore<T> tenantScoped(Class<T> entityType) {
    return new TenantScopedEntityStore<>(entityManager, entityType, jpaDialect);
  }
}

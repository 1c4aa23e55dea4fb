package io.supplyrisk.backend.multitenancy;

/**
 * Marker interface for entities partitioned by tenant. Every implementing entity has a non-null
 * {@code tenant_id} column, populated by {@link TenantAwareEntityListener} on persist and matched
 * against the active tenant by {@link TenantScopedEntityStore} on every read, update and delete.
 */
public interface TenantAware {

  String getTenantId();

  void setTenantId(String tenantId);
}

package io.supplyrisk.backend.multitenancy;

import io.supplyrisk.backend.exception.ResourceNotFoundException;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreRemove;
import jakarta.persistence.PreUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JPA entity listener that stamps {@code tenant_id} on new {@link TenantAware} entities and refuses
 * to flush changes to rows owned by another tenant.
 *
 * <p>The stamp always wins over whatever tenant id the caller put on the entity. Update and remove
 * checks report a foreign row as not found, the same answer a scoped lookup would give.
 */
public class TenantAwareEntityListener {

  private static final Logger log = LoggerFactory.getLogger(TenantAwareEntityListener.class);

  @PrePersist
  public void stampTenant(Object entity) {
    if (entity instanceof TenantAware tenantAware) {
      String tenantId = TenantContext.requireActiveTenant();
      if (tenantAware.getTenantId() != null && !tenantId.equals(tenantAware.getTenantId())) {
        log.debug(
            "Overriding caller-supplied tenant {} with active tenant {} on {}",
            tenantAware.getTenantId(),
            tenantId,
            entity.getClass().getSimpleName());
      }
      tenantAware.setTenantId(tenantId);
    }
  }

  @PreUpdate
  @PreRemove
  public void verifyOwnership(Object entity) {
    if (entity instanceof TenantAware tenantAware) {
      String tenantId = TenantContext.requireActiveTenant();
      if (!tenantId.equals(tenantAware.getTenantId())) {
        log.warn(
            "Blocked write to {} owned by another tenant (active tenant {})",
            entity.getClass().getSimpleName(),
            tenantId);
        throw ResourceNotFoundException.withDetail(
            entity.getClass().getSimpleName() + " not found",
            "No matching " + entity.getClass().getSimpleName() + " in the active tenant");
      }
    }
  }
}

package io.supplyrisk.backend.provisioning;

import io.supplyrisk.backend.multitenancy.EntityStore;
import io.supplyrisk.backend.multitenancy.EntityStores;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class TenantProvisioningService {

  private static final Logger log = LoggerFactory.getLogger(TenantProvisioningService.class);

  static final Pattern TENANT_ID_PATTERN = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_-]{0,63}$");

  private final EntityStore<Tenant> tenants;

  public TenantProvisioningService(EntityStores stores) {
    this.tenants = stores.forEntity(Tenant.class);
  }

  /** Registers {@code externalId}. Calling it again for a known tenant returns the existing row. */
  @Transactional
  public ProvisioningResult provision(String externalId, String name) {
    validateTenantId(externalId);
    var existing = tenants.findFirst(hasExternalId(externalId));
    if (existing.isPresent()) {
      log.info("Tenant already provisioned: {}", externalId);
      return new ProvisioningResult(existing.get(), true);
    }
    var tenant = tenants.create(new Tenant(externalId, name));
    log.info("Provisioned tenant: id={}, externalId={}", tenant.getId(), externalId);
    return new ProvisioningResult(tenant, false);
  }

  @Transactional(readOnly = true)
  public Optional<Tenant> findByExternalId(String externalId) {
    return tenants.findFirst(hasExternalId(externalId));
  }

  @Transactional(readOnly = true)
  public List<Tenant> listAll() {
    return tenants.findAll(null, Sort.by("externalId"));
  }

  public record ProvisioningResult(Tenant tenant, boolean alreadyProvisioned) {}

  static void validateTenantId(String externalId) {
    if (externalId == null || !TENANT_ID_PATTERN.matcher(externalId).matches()) {
      throw new IllegalArgumentException("Invalid tenant id: " + externalId);
    }
  }

  private static Specification<Tenant> hasExternalId(String externalId) {
    return (root, query, cb) -> cb.equal(root.get("externalId"), externalId);
  }
}

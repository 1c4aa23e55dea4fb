package io.supplyrisk.backend.multitenancy;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.supplyrisk.backend.config.TenancyProperties;
import io.supplyrisk.backend.provisioning.Tenant;
import io.supplyrisk.backend.provisioning.TenantProvisioningService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds the tenant named by the tenant header for the duration of the request. The id itself is
 * issued and authenticated by the upstream layer.
 *
 * <p>The 403 for an id missing from the tenant registry is an operational guard against requests
 * for tenants that were never provisioned. It does not validate the caller's identity or its right
 * to act for that tenant.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class TenantFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(TenantFilter.class);

  private final TenantProvisioningService provisioningService;
  private final String headerName;
  private final Cache<String, String> tenantCache;

  public TenantFilter(
      TenantProvisioningService provisioningService, TenancyProperties tenancyProperties) {
    this.provisioningService = provisioningService;
    this.headerName = tenancyProperties.header();
    this.tenantCache =
        Caffeine.newBuilder()
            .maximumSize(tenancyProperties.cacheSize())
            .expireAfterWrite(tenancyProperties.cacheTtl())
            .build();
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    String requested = request.getHeader(headerName);

    if (requested == null || requested.isBlank()) {
      // Continue unbound: tenant-scoped operations downstream answer 428.
      filterChain.doFilter(request, response);
      return;
    }

    String tenantId = resolveTenant(requested.trim());
    if (tenantId == null) {
      log.warn("Rejected request for unprovisioned tenant {}", requested);
      response.sendError(HttpServletResponse.SC_FORBIDDEN, "Tenant not provisioned");
      return;
    }

    try (var scope = TenantContext.open(tenantId)) {
      filterChain.doFilter(request, response);
    }
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    String path = request.getRequestURI();
    return path.startsWith("/internal/") || path.startsWith("/actuator/");
  }

  private String resolveTenant(String tenantId) {
    // Caffeine's get(key, loader) rejects null values; unknown tenants are not cached.
    String cached = tenantCache.getIfPresent(tenantId);
    if (cached != null) {
      return cached;
    }
    String resolved =
        provisioningService.findByExternalId(tenantId).map(Tenant::getExternalId).orElse(null);
    if (resolved != null) {
      tenantCache.put(tenantId, resolved);
    }
    return resolved;
  }
}

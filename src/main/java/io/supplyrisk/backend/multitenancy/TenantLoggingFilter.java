package io.supplyrisk.backend.multitenancy;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/** Adds request and tenant ids to the logging MDC. Runs after {@link TenantFilter}. */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 20)
public class TenantLoggingFilter extends OncePerRequestFilter {

  static final String MDC_TENANT_ID = "tenantId";
  static final String MDC_REQUEST_ID = "requestId";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      MDC.put(MDC_REQUEST_ID, UUID.randomUUID().toString());
      TenantContext.getActiveTenant().ifPresent(tenantId -> MDC.put(MDC_TENANT_ID, tenantId));
      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_TENANT_ID);
      MDC.remove(MDC_REQUEST_ID);
    }
  }
}

package io.supplyrisk.backend.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Tenant resolution settings.
 *
 * @param header request header carrying the opaque tenant id issued upstream
 * @param cacheTtl how long a resolved tenant stays cached
 * @param cacheSize maximum number of cached tenants
 */
@ConfigurationProperties("supplyrisk.tenancy")
public record TenancyProperties(
    @DefaultValue("X-Tenant-Id") String header,
    @DefaultValue("1h") Duration cacheTtl,
    @DefaultValue("10000") long cacheSize) {}

package io.supplyrisk.backend.admin;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

/**
 * Operator tooling that counts a tenant's rows in every tenant-partitioned table with plain SQL.
 * This path bypasses the tenant-scoped entity stores and takes the tenant as an argument instead
 * of from the request; it never serves business operations.
 */
@Service
public class TenantRowCountService {

  private static final Logger log = LoggerFactory.getLogger(TenantRowCountService.class);

  /** Fixed table names; never taken from input. */
  static final List<String> TENANT_TABLES =
      List.of(
          "suppliers",
          "products",
          "locations",
          "shipment_routes",
          "risk_events",
          "inventory",
          "users",
          "risk_event_suppliers",
          "risk_event_products",
          "risk_event_locations",
          "risk_event_routes");

  private final JdbcTemplate jdbcTemplate;

  public TenantRowCountService(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  public Map<String, Long> countRows(String tenantId) {
    Map<String, Long> counts = new LinkedHashMap<>();
    for (String table : TENANT_TABLES) {
      Long count =
          jdbcTemplate.queryForObject(
              "SELECT COUNT(*) FROM " + table + " WHERE tenant_id = ?", Long.class, tenantId);
      counts.put(table, count != null ? count : 0L);
    }
    log.info("Counted rows for tenant {} across {} tables", tenantId, counts.size());
    return counts;
  }
}

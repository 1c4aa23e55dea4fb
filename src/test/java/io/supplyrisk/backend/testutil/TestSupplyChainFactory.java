package io.supplyrisk.backend.testutil;

import io.supplyrisk.backend.location.LocationType;
import io.supplyrisk.backend.location.dto.CreateLocationRequest;
import io.supplyrisk.backend.product.dto.CreateProductRequest;
import io.supplyrisk.backend.riskevent.EventType;
import io.supplyrisk.backend.riskevent.RiskSeverity;
import io.supplyrisk.backend.riskevent.dto.CreateRiskEventRequest;
import io.supplyrisk.backend.route.TransportMode;
import io.supplyrisk.backend.route.dto.CreateRouteRequest;
import io.supplyrisk.backend.supplier.dto.CreateSupplierRequest;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/** Request builders with plausible defaults for integration tests. */
public final class TestSupplyChainFactory {

  private TestSupplyChainFactory() {}

  public static CreateSupplierRequest supplier(String code) {
    return new CreateSupplierRequest(
        code, "Supplier " + code, "DE", "ops@" + code.toLowerCase() + ".test", null, null, 4, null);
  }

  public static CreateProductRequest product(String sku, UUID supplierId) {
    return new CreateProductRequest(
        sku, "Product " + sku, null, "components", null, 14, supplierId);
  }

  public static CreateLocationRequest location(String code) {
    return new CreateLocationRequest(
        code,
        "Location " + code,
        LocationType.WAREHOUSE,
        null,
        "Hamburg",
        null,
        "DE",
        null,
        new BigDecimal("53.5511000"),
        new BigDecimal("9.9937000"),
        5000);
  }

  public static CreateRouteRequest route(UUID origin, UUID destination, TransportMode mode) {
    return new CreateRouteRequest(
        origin, destination, 3, mode, new BigDecimal("780.00"), new BigDecimal("1200.50"));
  }

  public static CreateRiskEventRequest riskEvent(String title, RiskSeverity severity) {
    return new CreateRiskEventRequest(
        EventType.WEATHER,
        severity,
        null,
        Instant.parse("2025-01-10T00:00:00Z"),
        null,
        title,
        "Storm front over the North Sea",
        null,
        null);
  }
}

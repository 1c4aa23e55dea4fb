package io.supplyrisk.backend.riskevent;

import static org.assertj.core.api.Assertions.assertThat;

import io.supplyrisk.backend.route.ShipmentRoute;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class RiskEventLinkTypeTest {

  @Test
  void fromPathSegment_resolvesEveryJunction() {
    assertThat(RiskEventLinkType.fromPathSegment("suppliers")).contains(RiskEventLinkType.SUPPLIER);
    assertThat(RiskEventLinkType.fromPathSegment("products")).contains(RiskEventLinkType.PRODUCT);
    assertThat(RiskEventLinkType.fromPathSegment("locations")).contains(RiskEventLinkType.LOCATION);
    assertThat(RiskEventLinkType.fromPathSegment("routes")).contains(RiskEventLinkType.ROUTE);
  }

  @Test
  void fromPathSegment_isEmptyForUnknownSegment() {
    assertThat(RiskEventLinkType.fromPathSegment("customers")).isEmpty();
  }

  @Test
  void newLink_carriesBothSides() {
    var eventId = UUID.randomUUID();
    var routeId = UUID.randomUUID();

    var link = RiskEventLinkType.ROUTE.newLink(eventId, routeId);

    assertThat(link.getRiskEventId()).isEqualTo(eventId);
    assertThat(link.getLinkedId()).isEqualTo(routeId);
    assertThat(RiskEventLinkType.ROUTE.targetType()).isEqualTo(ShipmentRoute.class);
  }
}

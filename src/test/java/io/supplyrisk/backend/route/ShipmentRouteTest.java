package io.supplyrisk.backend.route;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.supplyrisk.backend.exception.InvalidStateException;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class ShipmentRouteTest {

  @Test
  void constructor_rejectsIdenticalOriginAndDestination() {
    var location = UUID.randomUUID();

    assertThatThrownBy(() -> new ShipmentRoute(location, location, 2, TransportMode.TRUCK))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void reroute_rejectsIdenticalEndsAndKeepsPreviousLane() {
    var origin = UUID.randomUUID();
    var destination = UUID.randomUUID();
    var route = new ShipmentRoute(origin, destination, 2, TransportMode.TRUCK);

    assertThatThrownBy(() -> route.reroute(destination, destination, TransportMode.AIR))
        .isInstanceOf(InvalidStateException.class);
    assertThat(route.getOriginLocationId()).isEqualTo(origin);
    assertThat(route.getTransportMode()).isEqualTo(TransportMode.TRUCK);
  }
}

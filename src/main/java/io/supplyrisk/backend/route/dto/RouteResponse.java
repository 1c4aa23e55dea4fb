package io.supplyrisk.backend.route.dto;

import io.supplyrisk.backend.location.dto.LocationResponse;
import io.supplyrisk.backend.route.ShipmentRoute;
import io.supplyrisk.backend.route.TransportMode;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/** A route, with origin and destination locations included on reads. */
public record RouteResponse(
    UUID id,
    UUID originLocationId,
    UUID destinationLocationId,
    LocationResponse originLocation,
    LocationResponse destinationLocation,
    int transitTimeDays,
    TransportMode transportMode,
    BigDecimal distance,
    BigDecimal cost,
    Instant createdAt,
    Instant updatedAt) {

  public static RouteResponse from(
      ShipmentRoute route, LocationResponse origin, LocationResponse destination) {
    return new RouteResponse(
        route.getId(),
        route.getOriginLocationId(),
        route.getDestinationLocationId(),
        origin,
        destination,
        route.getTransitTimeDays(),
        route.getTransportMode(),
        route.getDistance(),
        route.getCost(),
        route.getCreatedAt(),
        route.getUpdatedAt());
  }
}

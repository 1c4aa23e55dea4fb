package io.supplyrisk.backend.location.dto;

import io.supplyrisk.backend.location.Location;
import io.supplyrisk.backend.location.LocationStatus;
import io.supplyrisk.backend.location.LocationType;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record LocationResponse(
    UUID id,
    String code,
    String name,
    LocationType type,
    LocationStatus status,
    String address,
    String city,
    String state,
    String country,
    String postalCode,
    BigDecimal latitude,
    BigDecimal longitude,
    Integer capacity,
    Instant createdAt,
    Instant updatedAt) {

  public static LocationResponse from(Location location) {
    return new LocationResponse(
        location.getId(),
        location.getCode(),
        location.getName(),
        location.getType(),
        location.getStatus(),
        location.getAddress(),
        location.getCity(),
        location.getState(),
        location.getCountry(),
        location.getPostalCode(),
        location.getLatitude(),
        location.getLongitude(),
        location.getCapacity(),
        location.getCreatedAt(),
        location.getUpdatedAt());
  }
}

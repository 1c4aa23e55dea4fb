package io.supplyrisk.backend.route;

public enum TransportMode {
  AIR,
  SEA,
  RAIL,
  TRUCK,
  MULTIMODAL
}

package io.supplyrisk.backend.location;

public enum LocationStatus {
  ACTIVE,
  INACTIVE,
  MAINTENANCE
}

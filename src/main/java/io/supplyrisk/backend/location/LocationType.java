package io.supplyrisk.backend.location;

public enum LocationType {
  WAREHOUSE,
  FACTORY,
  DISTRIBUTION_CENTER,
  PORT,
  SUPPLIER_SITE
}

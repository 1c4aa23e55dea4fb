package io.supplyrisk.backend.riskevent;

public enum RiskStatus {
  ACTIVE,
  MONITORING,
  MITIGATED,
  RESOLVED
}

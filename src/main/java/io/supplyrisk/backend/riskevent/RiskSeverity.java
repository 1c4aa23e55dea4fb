package io.supplyrisk.backend.riskevent;

public enum RiskSeverity {
  LOW,
  MEDIUM,
  HIGH,
  CRITICAL
}

package io.supplyrisk.backend.riskevent;

public enum EventType {
  WEATHER,
  POLITICAL,
  SUPPLIER_FAILURE,
  DEMAND_SURGE,
  TRANSPORTATION_DISRUPTION,
  QUALITY_ISSUE,
  REGULATORY_CHANGE,
  NATURAL_DISASTER,
  LABOR_STRIKE,
  CYBER_ATTACK
}

package io.supplyrisk.backend.user;

public enum UserRole {
  ADMIN,
  ANALYST,
  VIEWER,
  PLANNER
}

package io.supplyrisk.backend.user;

public enum UserStatus {
  ACTIVE,
  INACTIVE,
  SUSPENDED
}

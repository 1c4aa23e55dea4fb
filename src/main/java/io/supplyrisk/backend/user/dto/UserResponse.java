package io.supplyrisk.backend.user.dto;

import io.supplyrisk.backend.user.User;
import io.supplyrisk.backend.user.UserRole;
import io.supplyrisk.backend.user.UserStatus;
import java.time.Instant;
import java.util.UUID;

public record UserResponse(
    UUID id,
    String email,
    String name,
    UserRole role,
    UserStatus status,
    Instant lastLoginAt,
    Instant createdAt,
    Instant updatedAt) {

  public static UserResponse from(User user) {
    return new UserResponse(
        user.getId(),
        user.getEmail(),
        user.getName(),
        user.getRole(),
        user.getStatus(),
        user.getLastLoginAt(),
        user.getCreatedAt(),
        user.getUpdatedAt());
  }
}

package io.supplyrisk.backend.user.dto;

import io.supplyrisk.backend.user.UserRole;
import io.supplyrisk.backend.user.UserStatus;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record UpdateUserRequest(
    @NotBlank @Email @Size(max = 255) String email,
    @NotBlank @Size(max = 255) String name,
    @NotNull UserRole role,
    @NotNull UserStatus status) {}

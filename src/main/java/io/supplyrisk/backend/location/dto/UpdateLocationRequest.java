package io.supplyrisk.backend.location.dto;

import io.supplyrisk.backend.location.LocationStatus;
import io.supplyrisk.backend.location.LocationType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;

public record UpdateLocationRequest(
    @NotBlank @Size(max = 255) String name,
    @NotNull LocationType type,
    @NotNull LocationStatus status,
    String address,
    String city,
    String state,
    @NotBlank @Size(max = 100) String country,
    @Size(max = 20) String postalCode,
    @DecimalMin("-90") @DecimalMax("90") BigDecimal latitude,
    @DecimalMin("-180") @DecimalMax("180") BigDecimal longitude,
    @Min(0) Integer capacity) {}

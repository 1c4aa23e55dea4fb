package io.supplyrisk.backend.route.dto;

import io.supplyrisk.backend.route.TransportMode;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.util.UUID;

public record CreateRouteRequest(
    @NotNull UUID originLocationId,
    @NotNull UUID destinationLocationId,
    @Min(1) int transitTimeDays,
    @NotNull TransportMode transportMode,
    @DecimalMin("0") BigDecimal distance,
    @DecimalMin("0") BigDecimal cost) {}

package io.supplyrisk.backend.product.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.UUID;

public record UpdateProductRequest(
    @NotBlank @Size(max = 255) String name,
    String description,
    @NotBlank @Size(max = 100) String category,
    @Size(max = 20) String unitOfMeasure,
    @Min(1) int leadTimeDays,
    @NotNull UUID supplierId) {}

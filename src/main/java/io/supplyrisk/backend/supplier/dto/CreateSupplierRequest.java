package io.supplyrisk.backend.supplier.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateSupplierRequest(
    @NotBlank @Size(max = 50) String code,
    @NotBlank @Size(max = 255) String name,
    @NotBlank @Size(max = 100) String country,
    @Email String contactEmail,
    @Size(max = 50) String contactPhone,
    String address,
    @Min(1) @Max(5) Integer rating,
    String notes) {}

package com.flagship.bookkeeping.asset.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

/**
 * Request DTO for registering or updating a fixed asset.
 */
@Value
@Builder
@Jacksonized
public class FixedAssetRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 200, message = "Name must be at most 200 characters")
    String name;

    @NotNull(message = "Acquisition date is required")
    LocalDate acquisitionDate;

    @NotNull(message = "Useful life is required")
    @Min(value = 1, message = "Useful life must be at least 1 year")
    Integer usefulLife;

    @NotNull(message = "Acquisition cost is required")
    @Min(value = 1, message = "Acquisition cost must be at least 1")
    Long acquisitionCost;

    String notes;
}

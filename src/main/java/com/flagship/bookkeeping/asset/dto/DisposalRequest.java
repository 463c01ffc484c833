package com.flagship.bookkeeping.asset.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.flagship.bookkeeping.asset.DisposalType;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

/**
 * Request DTO for recording a retirement or sale. Proceeds are required for a sale only.
 */
@Value
@Builder
@Jacksonized
public class DisposalRequest {

    @NotNull(message = "Disposal type is required")
    @JsonAlias("type")
    DisposalType disposalType;

    @NotNull(message = "Disposal date is required")
    @JsonAlias("date")
    LocalDate disposalDate;

    @JsonAlias("proceeds")
    Long disposalProceeds;
}

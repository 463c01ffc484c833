package com.flagship.bookkeeping.ledger.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Request DTO for creating or replacing a counterparty.
 */
@Value
@Builder
@Jacksonized
public class CounterpartyRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 200, message = "Name must be at most 200 characters")
    String name;

    @Size(max = 50, message = "Code must be at most 50 characters")
    String code;

    String contactInfo;

    String notes;
}

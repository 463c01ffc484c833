package com.flagship.bookkeeping.ledger.dto;

import com.flagship.bookkeeping.ledger.AccountCategory;
import com.flagship.bookkeeping.ledger.TaxClassification;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Request DTO for creating an account.
 */
@Value
@Builder
@Jacksonized
public class CreateAccountRequest {

    @NotBlank(message = "Code is required")
    @Size(max = 20, message = "Code must be at most 20 characters")
    String code;

    @NotBlank(message = "Name is required")
    @Size(max = 100, message = "Name must be at most 100 characters")
    String name;

    @NotNull(message = "Category is required")
    AccountCategory category;

    TaxClassification taxDefault;
}

package com.flagship.bookkeeping.ledger.dto;

import com.flagship.bookkeeping.ledger.AccountCategory;
import com.flagship.bookkeeping.ledger.TaxClassification;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Request DTO for updating an account. Absent fields keep their current value.
 */
@Value
@Builder
@Jacksonized
public class UpdateAccountRequest {

    @Size(max = 100, message = "Name must be at most 100 characters")
    String name;

    AccountCategory category;

    TaxClassification taxDefault;

    Integer displayOrder;
}

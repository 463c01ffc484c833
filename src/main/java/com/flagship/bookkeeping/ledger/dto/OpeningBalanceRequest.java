package com.flagship.bookkeeping.ledger.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One row of an opening-balance save.
 */
@Value
@Builder
@Jacksonized
public class OpeningBalanceRequest {

    @NotNull(message = "Account ID is required")
    Long accountId;

    long amount;

    String note;
}

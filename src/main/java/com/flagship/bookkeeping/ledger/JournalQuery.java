package com.flagship.bookkeeping.ledger;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Filters and paging for journal listing. Every filter is optional.
 */
@Value
@Builder
public class JournalQuery {
    LocalDate startDate;
    LocalDate endDate;
    Long accountId;
    String counterparty;
    String memo;
    Integer page;
    Integer perPage;
}

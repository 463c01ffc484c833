package com.flagship.bookkeeping.ledger;

import lombok.Value;

import java.util.List;

/**
 * One page of journal entries, newest first.
 */
@Value
public class JournalPage {
    List<JournalEntry> entries;
    long total;
    int page;
    int perPage;
}

package com.flagship.bookkeeping.ledger;

import lombok.Value;

import java.util.List;

/**
 * Per-item results of a batch create, in input order.
 *
 * A batch is fail-soft: rejected items do not undo the items committed before or after them,
 * so callers can report "N of M entries created".
 */
@Value
public class BatchResult {
    List<EntryResult> results;

    public int getCreated() {
        return (int) results.stream().filter(EntryResult::isSuccess).count();
    }

    public int getFailed() {
        return results.size() - getCreated();
    }

    public List<Long> getCreatedIds() {
        return results.stream()
            .filter(EntryResult::isSuccess)
            .map(EntryResult::getEntryId)
            .toList();
    }
}

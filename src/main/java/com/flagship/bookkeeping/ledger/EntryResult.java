package com.flagship.bookkeeping.ledger;

import lombok.Value;

/**
 * Outcome of one item of a batch create: the created entry id, or the reason it was rejected.
 */
@Value
public class EntryResult {
    int index;
    Long entryId;
    String error;

    public static EntryResult success(int index, long entryId) {
        return new EntryResult(index, entryId, null);
    }

    public static EntryResult failure(int index, String error) {
        return new EntryResult(index, null, error);
    }

    public boolean isSuccess() {
        return entryId != null;
    }
}

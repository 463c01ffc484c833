package com.flagship.bookkeeping.common.exception;

/**
 * Thrown when an entity id does not resolve.
 */
public class NotFoundException extends BookkeepingException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException account(long accountId) {
        return new NotFoundException("Account not found: " + accountId);
    }

    public static NotFoundException journalEntry(long entryId) {
        return new NotFoundException("Journal entry not found: " + entryId);
    }

    public static NotFoundException fixedAsset(long assetId) {
        return new NotFoundException("Fixed asset not found: " + assetId);
    }

    public static NotFoundException counterparty(long counterpartyId) {
        return new NotFoundException("Counterparty not found: " + counterpartyId);
    }
}

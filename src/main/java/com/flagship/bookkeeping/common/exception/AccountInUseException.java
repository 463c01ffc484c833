package com.flagship.bookkeeping.common.exception;

/**
 * Thrown when an account cannot be deactivated because live journal entries reference it.
 */
public class AccountInUseException extends BookkeepingException {

    private final long referenceCount;

    public AccountInUseException(long accountId, long referenceCount) {
        super(String.format("Account %d is referenced by %d journal entries and cannot be deactivated",
            accountId, referenceCount));
        this.referenceCount = referenceCount;
    }

    public long getReferenceCount() {
        return referenceCount;
    }
}

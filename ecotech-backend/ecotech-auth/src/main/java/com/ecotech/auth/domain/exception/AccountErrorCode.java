package com.ecotech.auth.domain.exception;

/**
 * Machine-readable kind of an {@link AccountException}.
 * Callers branch on the code, never on the exception class.
 */
public enum AccountErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR"),
    DUPLICATE_ACCOUNT("DUPLICATE_ACCOUNT"),
    ACCOUNT_NOT_FOUND("ACCOUNT_NOT_FOUND"),
    INVALID_CREDENTIALS("INVALID_CREDENTIALS"),
    ACCOUNT_LOCKED("ACCOUNT_LOCKED"),
    SELF_DELETION("SELF_DELETION"),
    STORAGE_FAILURE("STORAGE_FAILURE");

    private final String value;

    AccountErrorCode(String value) {
        this.value = value;
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}

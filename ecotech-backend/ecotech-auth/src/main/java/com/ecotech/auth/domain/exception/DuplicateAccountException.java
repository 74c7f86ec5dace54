package com.ecotech.auth.domain.exception;

/**
 * Thrown when the username or email is already taken by another account.
 * Raised from the storage unique constraint, never from an in-memory check.
 */
public class DuplicateAccountException extends AccountException {

    public DuplicateAccountException(String message, Throwable cause) {
        super(AccountErrorCode.DUPLICATE_ACCOUNT, message, cause);
    }
}

package com.ecotech.auth.domain.exception;

/**
 * Thrown when the logged-in account tries to delete itself.
 */
public class SelfDeletionException extends AccountException {

    public SelfDeletionException(String message) {
        super(AccountErrorCode.SELF_DELETION, message);
    }
}

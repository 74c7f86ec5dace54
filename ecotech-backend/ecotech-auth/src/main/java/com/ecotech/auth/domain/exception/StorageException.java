package com.ecotech.auth.domain.exception;

/**
 * Thrown when the account store cannot complete an operation.
 * The driver error stays in the cause and is never part of the message.
 */
public class StorageException extends AccountException {

    public StorageException(String message, Throwable cause) {
        super(AccountErrorCode.STORAGE_FAILURE, message, cause);
    }
}

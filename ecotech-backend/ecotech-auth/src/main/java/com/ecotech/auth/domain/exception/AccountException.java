package com.ecotech.auth.domain.exception;

/**
 * Base class of every account and login failure.
 * The message is safe to show to the user; the cause is for logs only.
 */
public abstract class AccountException extends RuntimeException {

    private final AccountErrorCode errorCode;

    protected AccountException(AccountErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected AccountException(AccountErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public AccountErrorCode getErrorCode() {
        return errorCode;
    }
}

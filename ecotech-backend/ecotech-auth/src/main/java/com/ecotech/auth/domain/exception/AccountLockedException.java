package com.ecotech.auth.domain.exception;

/**
 * Thrown when a login session has used up its attempts.
 * {@link #PERMANENT} as retry-after means the session never unlocks.
 */
public class AccountLockedException extends AccountException {

    public static final int PERMANENT = -1;

    private final int retryAfterSeconds;

    public AccountLockedException(String message, int retryAfterSeconds) {
        super(AccountErrorCode.ACCOUNT_LOCKED, message);
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public int getRetryAfterSeconds() {
        return retryAfterSeconds;
    }

    public boolean isPermanent() {
        return retryAfterSeconds == PERMANENT;
    }
}

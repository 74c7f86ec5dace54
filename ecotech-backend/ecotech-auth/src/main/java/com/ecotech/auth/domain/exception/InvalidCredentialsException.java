package com.ecotech.auth.domain.exception;

/**
 * Thrown when login credentials are invalid.
 * Unknown username and wrong password share the same message.
 */
public class InvalidCredentialsException extends AccountException {

    public InvalidCredentialsException(String message) {
        super(AccountErrorCode.INVALID_CREDENTIALS, message);
    }
}

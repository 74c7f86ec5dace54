package com.ecotech.auth.domain.exception;

/**
 * Thrown when account input is missing or malformed.
 * Rendered as a re-prompt by ConsoleExceptionHandler.
 */
public class ValidationException extends AccountException {

    public ValidationException(String message) {
        super(AccountErrorCode.VALIDATION_ERROR, message);
    }
}

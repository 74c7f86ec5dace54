package com.ecotech.auth.domain.exception;

/**
 * Thrown by PasswordHasher when a password is empty or too short to hash.
 */
public class InvalidInputException extends ValidationException {

    public InvalidInputException(String message) {
        super(message);
    }
}

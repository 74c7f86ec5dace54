package com.ecotech.auth.domain.constants;

public final class AuthConstants {

    // Private constructor prevents instantiation
    private AuthConstants() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }

    public static final int BCRYPT_COST_FACTOR = 12;
    public static final int MIN_PASSWORD_LENGTH = 6;
    public static final int MAX_USERNAME_LENGTH = 64;
    public static final int MAX_EMAIL_LENGTH = 255;
    public static final int MAX_PASSWORD_HASH_LENGTH = 255;
    public static final int MAX_LOGIN_ATTEMPTS = 3;

    // Shared by unknown-user and wrong-password failures
    public static final String INVALID_CREDENTIALS_MESSAGE = "Invalid username or password";
    public static final String SESSION_LOCKED_MESSAGE = "Too many failed login attempts";
    public static final String STORAGE_FAILURE_MESSAGE = "The account store is unavailable. Please try again later.";

}

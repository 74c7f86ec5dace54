package com.ecotech.auth.api.console;

import com.ecotech.airquality.client.AirQualityException;
import com.ecotech.auth.domain.exception.AccountException;
import com.ecotech.auth.domain.exception.AccountLockedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns exceptions into the single line the console shows the user.
 * Account errors are told apart by their error code; anything unexpected is logged
 * in full and shown as a generic message.
 */
@Component
@Slf4j
public class ConsoleExceptionHandler {

    static final String GENERIC_MESSAGE = "Something went wrong. Please try again later.";

    public String describe(RuntimeException ex) {
        if (ex instanceof AccountException) {
            return describeAccountError((AccountException) ex);
        }
        if (ex instanceof AirQualityException) {
            return "Air quality query failed: " + ex.getMessage();
        }

        log.error("[UNEXPECTED_ERROR] Unhandled console error | type={}", ex.getClass().getName(), ex);
        return GENERIC_MESSAGE;
    }

    private String describeAccountError(AccountException ex) {
        switch (ex.getErrorCode()) {
            case VALIDATION_ERROR:
                return "Invalid input: " + ex.getMessage();
            case DUPLICATE_ACCOUNT:
                return "Already registered: " + ex.getMessage();
            case ACCOUNT_NOT_FOUND:
                return "Not found: " + ex.getMessage();
            case INVALID_CREDENTIALS:
                return "Login failed: " + ex.getMessage();
            case ACCOUNT_LOCKED:
                return describeLock((AccountLockedException) ex);
            case SELF_DELETION:
                return "Refused: " + ex.getMessage();
            case STORAGE_FAILURE:
                return "Storage error: " + ex.getMessage();
            default:
                return GENERIC_MESSAGE;
        }
    }

    private String describeLock(AccountLockedException ex) {
        if (ex.isPermanent()) {
            return "Access denied: " + ex.getMessage();
        }
        return "Access denied: " + ex.getMessage() + ". Try again in " + ex.getRetryAfterSeconds() + "s";
    }
}

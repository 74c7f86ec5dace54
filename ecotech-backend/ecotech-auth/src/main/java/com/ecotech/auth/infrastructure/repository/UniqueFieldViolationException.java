package com.ecotech.auth.infrastructure.repository;

import org.springframework.dao.DuplicateKeyException;

/**
 * A write rejected by the unique constraint on one account field.
 */
public class UniqueFieldViolationException extends DuplicateKeyException {

    public static final String USERNAME = "username";
    public static final String EMAIL = "email";

    private final String field;

    public UniqueFieldViolationException(String field, Throwable cause) {
        super("Unique constraint violated on " + field, cause);
        this.field = field;
    }

    /**
     * {@link #USERNAME} or {@link #EMAIL}
     */
    public String getField() {
        return field;
    }
}

package com.ecotech.auth.domain.model;

import java.util.Locale;

public enum Role {
    USER("user"),
    ADMIN("admin");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }

    /**
     * Parses a role typed at the console. Accepts the wire value in any case and
     * the legacy Spanish names. Returns null for anything else.
     */
    public static Role fromValue(String val) {
        if (val == null) {
            return null;
        }
        String normalized = val.trim().toLowerCase(Locale.ROOT);
        for (Role role : Role.values()) {
            if (role.value.equals(normalized)) {
                return role;
            }
        }
        switch (normalized) {
            case "usuario":
                return USER;
            case "administrador":
                return ADMIN;
            default:
                return null;
        }
    }
}

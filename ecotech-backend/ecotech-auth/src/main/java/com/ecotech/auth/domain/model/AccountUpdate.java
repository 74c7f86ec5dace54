package com.ecotech.auth.domain.model;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * Partial change to a stored account. Null fields are left untouched.
 * The password is already hashed at this point.
 */
@Value
@Builder
public class AccountUpdate {

    String email;

    Role role;

    @ToString.Exclude
    String passwordHash;

    public boolean isEmpty() {
        return email == null && role == null && passwordHash == null;
    }
}

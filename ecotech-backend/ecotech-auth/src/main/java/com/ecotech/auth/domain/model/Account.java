package com.ecotech.auth.domain.model;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * A stored user account. The id is null only before the first insert.
 */
@Value
@Builder(toBuilder = true)
public class Account {

    Long id;

    String username;

    String email;

    @ToString.Exclude
    String passwordHash;

    Role role;
}

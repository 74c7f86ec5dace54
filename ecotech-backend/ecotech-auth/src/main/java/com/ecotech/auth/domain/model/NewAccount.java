package com.ecotech.auth.domain.model;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import static com.ecotech.auth.domain.constants.AuthConstants.MAX_EMAIL_LENGTH;
import static com.ecotech.auth.domain.constants.AuthConstants.MAX_USERNAME_LENGTH;

/**
 * Input of an account creation, validated before anything is hashed or stored.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NewAccount {

    @NotBlank(message = "Username is required")
    @Size(max = MAX_USERNAME_LENGTH, message = "Username must be at most " + MAX_USERNAME_LENGTH + " characters")
    private String username;

    @NotBlank(message = "Email is required")
    @Email(message = "Email must be a valid email address")
    @Size(max = MAX_EMAIL_LENGTH, message = "Email must be at most " + MAX_EMAIL_LENGTH + " characters")
    private String email;

    @NotBlank(message = "Password is required")
    @ToString.Exclude
    private String password;

    private Role role;
}

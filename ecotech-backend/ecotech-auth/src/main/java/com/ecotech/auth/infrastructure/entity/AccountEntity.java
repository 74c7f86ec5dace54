package com.ecotech.auth.infrastructure.entity;

import com.ecotech.auth.domain.model.Role;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.DynamicUpdate;

import static com.ecotech.auth.domain.constants.AuthConstants.MAX_EMAIL_LENGTH;
import static com.ecotech.auth.domain.constants.AuthConstants.MAX_PASSWORD_HASH_LENGTH;
import static com.ecotech.auth.domain.constants.AuthConstants.MAX_USERNAME_LENGTH;

@Entity
@Table(name = "accounts", uniqueConstraints = {
        @UniqueConstraint(name = AccountEntity.UK_USERNAME, columnNames = "username"),
        @UniqueConstraint(name = AccountEntity.UK_EMAIL, columnNames = "email")
})
@DynamicUpdate
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AccountEntity {

    public static final String UK_USERNAME = "uk_accounts_username";
    public static final String UK_EMAIL = "uk_accounts_email";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = MAX_USERNAME_LENGTH)
    private String username;

    @Column(nullable = false, length = MAX_EMAIL_LENGTH)
    private String email;

    @Column(name = "password_hash", nullable = false, length = MAX_PASSWORD_HASH_LENGTH)
    private String passwordHash;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Role role;

}

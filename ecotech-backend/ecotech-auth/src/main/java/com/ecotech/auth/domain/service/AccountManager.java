package com.ecotech.auth.domain.service;

import com.ecotech.auth.domain.exception.AccountNotFoundException;
import com.ecotech.auth.domain.exception.DuplicateAccountException;
import com.ecotech.auth.domain.exception.InvalidCredentialsException;
import com.ecotech.auth.domain.exception.SelfDeletionException;
import com.ecotech.auth.domain.exception.StorageException;
import com.ecotech.auth.domain.exception.ValidationException;
import com.ecotech.auth.domain.model.Account;
import com.ecotech.auth.domain.model.AccountUpdate;
import com.ecotech.auth.domain.model.NewAccount;
import com.ecotech.auth.domain.model.Role;
import com.ecotech.auth.infrastructure.repository.AccountStore;
import com.ecotech.auth.infrastructure.repository.UniqueFieldViolationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

import static com.ecotech.auth.domain.constants.AuthConstants.INVALID_CREDENTIALS_MESSAGE;
import static com.ecotech.auth.domain.constants.AuthConstants.STORAGE_FAILURE_MESSAGE;

/**
 * Account Service - All account operations behind the login
 * Validates input, hashes passwords, and turns storage errors into account errors.
 * <p>
 * Usernames and emails are compared case-insensitively: both are trimmed and
 * lower-cased before they reach the store, so the store's unique constraints
 * enforce that policy whatever the database collation is.
 */
@Service
@Slf4j
public class AccountManager {

    private final AccountStore accountStore;
    private final PasswordHasher passwordHasher;
    private final Validator validator;

    public AccountManager(AccountStore accountStore, PasswordHasher passwordHasher, Validator validator) {
        this.accountStore = accountStore;
        this.passwordHasher = passwordHasher;
        this.validator = validator;
    }

    /**
     * Create new account with hashed password
     *
     * @param role null means {@link Role#USER}
     * @throws ValidationException if a field is missing or malformed
     * @throws DuplicateAccountException if the username or email is taken
     */
    public Account create(String username, String email, String password, Role role) {
        NewAccount request = new NewAccount(canonical(username), canonical(email), password,
                role != null ? role : Role.USER);
        log.info("[ACCOUNT_CREATE_START] Creating account | username={}", request.getUsername());

        validate(request);
        String passwordHash = passwordHasher.hash(request.getPassword());

        Account account = Account.builder()
                .username(request.getUsername())
                .email(request.getEmail())
                .passwordHash(passwordHash)
                .role(request.getRole())
                .build();

        long id;
        try {
            id = accountStore.insert(account);
        } catch (DuplicateKeyException e) {
            log.warn("[ACCOUNT_EXISTS] Create rejected by unique constraint | username={} | email={}",
                    request.getUsername(), request.getEmail());
            throw duplicate(e, request.getUsername(), request.getEmail());
        } catch (DataAccessException e) {
            throw storageFailure("create", e);
        }

        Account created = account.toBuilder().id(id).build();
        log.info("[ACCOUNT_CREATED] Account created | id={} | username={} | role={}",
                id, created.getUsername(), created.getRole());
        return created;
    }

    /**
     * Find account by username
     *
     * @throws AccountNotFoundException if no account has this username
     */
    public Account findByUsername(String username) {
        String key = canonical(username);
        log.debug("[ACCOUNT_FIND] Finding account by username | username={}", key);
        return fromStore("find", () -> accountStore.findByUsername(key == null ? "" : key))
                .orElseThrow(() -> new AccountNotFoundException("Account '" + username + "' not found"));
    }

    /**
     * Find account by id
     *
     * @throws AccountNotFoundException if no account has this id
     */
    public Account findById(long id) {
        log.debug("[ACCOUNT_FIND] Finding account by id | id={}", id);
        return fromStore("find", () -> accountStore.findById(id))
                .orElseThrow(() -> new AccountNotFoundException("Account with id " + id + " not found"));
    }

    public List<Account> listAll() {
        return fromStore("list", accountStore::listAll);
    }

    /**
     * Check a username and password.
     * A missing account and a wrong password fail with the same exception and message.
     *
     * @throws InvalidCredentialsException if the credentials do not match an account
     */
    public Account authenticate(String username, String password) {
        String key = canonical(username);
        Optional<Account> account = key == null || key.isEmpty()
                ? Optional.empty()
                : fromStore("authenticate", () -> accountStore.findByUsername(key));

        if (account.isEmpty()) {
            passwordHasher.verifyAgainstDummy(password);
            log.warn("[LOGIN_FAILED] Unknown username (timing protected) | username={}", key);
            throw new InvalidCredentialsException(INVALID_CREDENTIALS_MESSAGE);
        }

        if (!passwordHasher.verify(password, account.get().getPasswordHash())) {
            log.warn("[LOGIN_FAILED] Invalid credentials | username={}", key);
            throw new InvalidCredentialsException(INVALID_CREDENTIALS_MESSAGE);
        }

        log.info("[LOGIN_SUCCESS] Account authenticated | id={} | username={}", account.get().getId(), key);
        return account.get();
    }

    /**
     * Update any subset of email, role and password. Null arguments are left untouched;
     * a new password is re-hashed before it is stored.
     *
     * @throws ValidationException if nothing is supplied or a supplied value is malformed
     * @throws AccountNotFoundException if no account has this id
     * @throws DuplicateAccountException if the new email belongs to another account
     */
    public Account update(long id, String newEmail, Role newRole, String newPassword) {
        log.info("[ACCOUNT_UPDATE_START] Updating account | id={}", id);

        String email = canonical(newEmail);
        if (email != null && email.isEmpty()) {
            email = null;
        }
        if (newPassword != null && newPassword.isEmpty()) {
            newPassword = null;
        }
        if (email == null && newRole == null && newPassword == null) {
            throw new ValidationException("No fields to update");
        }
        if (email != null) {
            reject(validator.validateValue(NewAccount.class, "email", email));
        }

        AccountUpdate changes = AccountUpdate.builder()
                .email(email)
                .role(newRole)
                .passwordHash(newPassword != null ? passwordHasher.hash(newPassword) : null)
                .build();

        Optional<Account> updated;
        try {
            updated = accountStore.update(id, changes);
        } catch (DuplicateKeyException e) {
            log.warn("[ACCOUNT_EXISTS] Update rejected by unique constraint | id={} | email={}", id, email);
            throw duplicate(e, null, email);
        } catch (DataAccessException e) {
            throw storageFailure("update", e);
        }

        Account account = updated.orElseThrow(
                () -> new AccountNotFoundException("Account with id " + id + " not found"));
        log.info("[ACCOUNT_UPDATED] Account updated | id={} | emailChanged={} | roleChanged={} | passwordChanged={}",
                id, email != null, newRole != null, newPassword != null);
        return account;
    }

    /**
     * Hard delete an account
     *
     * @param requestingAccountId the account currently logged in
     * @throws SelfDeletionException if the logged-in account targets itself
     * @throws AccountNotFoundException if no account has this id
     */
    public void delete(long id, long requestingAccountId) {
        if (id == requestingAccountId) {
            log.warn("[ACCOUNT_DELETE_REFUSED] Self deletion attempt | id={}", id);
            throw new SelfDeletionException("You cannot delete the account you are logged in with");
        }

        boolean deleted = fromStore("delete", () -> accountStore.delete(id));
        if (!deleted) {
            throw new AccountNotFoundException("Account with id " + id + " not found");
        }
        log.info("[ACCOUNT_DELETED] Account deleted | id={} | deletedBy={}", id, requestingAccountId);
    }

    /**
     * Cheap round trip to the store, used as a startup connectivity check
     */
    public long countAccounts() {
        return fromStore("count", accountStore::count);
    }

    private void validate(NewAccount request) {
        reject(validator.validate(request));
        log.debug("[VALIDATION_PASSED] Account input valid | username={}", request.getUsername());
    }

    private <T> void reject(Set<ConstraintViolation<T>> violations) {
        violations.stream()
                .min(Comparator.comparing(v -> v.getPropertyPath().toString()))
                .ifPresent(v -> {
                    log.warn("[VALIDATION_FAILED] {} | {}", v.getPropertyPath(), v.getMessage());
                    throw new ValidationException(v.getMessage());
                });
    }

    private <T> T fromStore(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            throw storageFailure(operation, e);
        }
    }

    // username is null on updates, where only the email can collide
    private static DuplicateAccountException duplicate(DuplicateKeyException e, String username, String email) {
        String field = e instanceof UniqueFieldViolationException
                ? ((UniqueFieldViolationException) e).getField()
                : null;
        if (UniqueFieldViolationException.USERNAME.equals(field)) {
            return new DuplicateAccountException("Username '" + username + "' is already registered", e);
        }
        if (UniqueFieldViolationException.EMAIL.equals(field) || username == null) {
            return new DuplicateAccountException("Email '" + email + "' is already registered", e);
        }
        return new DuplicateAccountException(
                "Username '" + username + "' or email '" + email + "' is already registered", e);
    }

    private StorageException storageFailure(String operation, DataAccessException e) {
        log.error("[STORAGE_FAILURE] Account store failed | operation={} | error={}", operation, e.getMessage(), e);
        return new StorageException(STORAGE_FAILURE_MESSAGE, e);
    }

    private static String canonical(String value) {
        return value == null ? null : value.trim().toLowerCase(Locale.ROOT);
    }
}

package com.ecotech.auth.domain.service;

import com.ecotech.auth.domain.exception.AccountErrorCode;
import com.ecotech.auth.domain.exception.AccountException;
import com.ecotech.auth.domain.exception.AccountNotFoundException;
import com.ecotech.auth.domain.exception.DuplicateAccountException;
import com.ecotech.auth.domain.exception.InvalidCredentialsException;
import com.ecotech.auth.domain.exception.SelfDeletionException;
import com.ecotech.auth.domain.exception.StorageException;
import com.ecotech.auth.domain.exception.ValidationException;
import com.ecotech.auth.domain.model.Account;
import com.ecotech.auth.domain.model.Role;
import com.ecotech.auth.infrastructure.repository.AccountStore;
import com.ecotech.auth.support.InMemoryAccountStore;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;

import java.security.SecureRandom;

import static com.ecotech.auth.domain.constants.AuthConstants.INVALID_CREDENTIALS_MESSAGE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AccountManagerTest {

    // Well-formed (64-char local part, 63-char labels) but longer than the email column
    static final String OVERLONG_EMAIL = "a".repeat(60) + "@" + ("b".repeat(60) + ".").repeat(4) + "com";

    private static ValidatorFactory validatorFactory;
    private static Validator validator;

    private final PasswordHasher hasher = new PasswordHasher(4, 6, new SecureRandom());
    private InMemoryAccountStore store;
    private AccountManager manager;

    @BeforeAll
    static void initValidator() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        validator = validatorFactory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        validatorFactory.close();
    }

    @BeforeEach
    void setUp() {
        store = new InMemoryAccountStore();
        manager = new AccountManager(store, hasher, validator);
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        @DisplayName("Stores a hashed password and returns the new id")
        void createsAccount() {
            Account created = manager.create("admin", "admin@ecotech.com", "admin123", Role.ADMIN);

            assertThat(created.getId()).isEqualTo(1L);
            assertThat(created.getRole()).isEqualTo(Role.ADMIN);
            assertThat(created.getPasswordHash()).isNotEqualTo("admin123");
            assertThat(hasher.verify("admin123", created.getPasswordHash())).isTrue();
            assertThat(store.findById(1L)).contains(created);
        }

        @Test
        @DisplayName("Null role defaults to user")
        void defaultsRole() {
            assertThat(manager.create("maria", "maria@ecotech.com", "secret123", null).getRole())
                    .isEqualTo(Role.USER);
        }

        @Test
        @DisplayName("Username and email are trimmed and lower-cased")
        void canonicalises() {
            Account created = manager.create("  Maria ", "Maria@EcoTech.com ", "secret123", Role.USER);

            assertThat(created.getUsername()).isEqualTo("maria");
            assertThat(created.getEmail()).isEqualTo("maria@ecotech.com");
        }

        @Test
        @DisplayName("Missing fields and malformed emails are validation errors; nothing is stored")
        void rejectsInvalidInput() {
            assertThatThrownBy(() -> manager.create("", "x@ecotech.com", "secret123", Role.USER))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("Username is required");
            assertThatThrownBy(() -> manager.create("maria", "not-an-email", "secret123", Role.USER))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("Email must be a valid email address");
            assertThatThrownBy(() -> manager.create("maria", "maria@ecotech.com", "", Role.USER))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("Password is required");
            assertThatThrownBy(() -> manager.create("maria", "maria@ecotech.com", "abc", Role.USER))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("Password must be at least 6 characters");
            assertThatThrownBy(() -> manager.create("m".repeat(65), "maria@ecotech.com", "secret123", Role.USER))
                    .isInstanceOf(ValidationException.class);

            assertThat(store.count()).isZero();
        }

        @Test
        @DisplayName("Duplicate username or email is rejected, also when only the case differs")
        void rejectsDuplicates() {
            manager.create("maria", "maria@ecotech.com", "secret123", Role.USER);

            assertThatThrownBy(() -> manager.create("maria", "other@ecotech.com", "secret123", Role.USER))
                    .isInstanceOf(DuplicateAccountException.class)
                    .extracting("errorCode").isEqualTo(AccountErrorCode.DUPLICATE_ACCOUNT);
            assertThatThrownBy(() -> manager.create("MARIA", "other@ecotech.com", "secret123", Role.USER))
                    .isInstanceOf(DuplicateAccountException.class)
                    .hasMessage("Username 'maria' is already registered");
            assertThatThrownBy(() -> manager.create("pedro", "MARIA@ecotech.com", "secret123", Role.USER))
                    .isInstanceOf(DuplicateAccountException.class)
                    .hasMessage("Email 'maria@ecotech.com' is already registered");
            assertThat(store.count()).isEqualTo(1);
        }

        @Test
        @DisplayName("An email longer than the column is a validation error, not a duplicate")
        void rejectsOverlongEmail() {
            assertThatThrownBy(() -> manager.create("longmail", OVERLONG_EMAIL, "secret123", Role.USER))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("Email must be at most 255 characters");
            assertThat(store.count()).isZero();
        }
    }

    @Nested
    @DisplayName("authenticate")
    class Authenticate {

        @BeforeEach
        void seed() {
            manager.create("admin", "admin@ecotech.com", "admin123", Role.ADMIN);
        }

        @Test
        @DisplayName("Correct credentials return the account")
        void succeeds() {
            Account account = manager.authenticate("admin", "admin123");

            assertThat(account.getId()).isEqualTo(1L);
            assertThat(account.getRole()).isEqualTo(Role.ADMIN);
        }

        @Test
        @DisplayName("Username lookup ignores case")
        void ignoresUsernameCase() {
            assertThat(manager.authenticate("ADMIN", "admin123").getUsername()).isEqualTo("admin");
        }

        @Test
        @DisplayName("Unknown user and wrong password fail identically")
        void identicalFailures() {
            InvalidCredentialsException unknown = catchThrowableOfType(
                    () -> manager.authenticate("ghost", "admin123"), InvalidCredentialsException.class);
            InvalidCredentialsException wrong = catchThrowableOfType(
                    () -> manager.authenticate("admin", "wrong-password"), InvalidCredentialsException.class);

            assertThat(unknown).isNotNull();
            assertThat(wrong).isNotNull();
            assertThat(unknown.getMessage()).isEqualTo(wrong.getMessage()).isEqualTo(INVALID_CREDENTIALS_MESSAGE);
            assertThat(unknown.getErrorCode()).isEqualTo(wrong.getErrorCode());
        }

        @Test
        @DisplayName("Blank username fails as invalid credentials")
        void blankUsername() {
            assertThatThrownBy(() -> manager.authenticate("  ", "admin123"))
                    .isInstanceOf(InvalidCredentialsException.class);
        }
    }

    @Nested
    @DisplayName("find and list")
    class FindAndList {

        @Test
        @DisplayName("Missing accounts raise not-found")
        void notFound() {
            assertThatThrownBy(() -> manager.findByUsername("ghost"))
                    .isInstanceOf(AccountNotFoundException.class);
            assertThatThrownBy(() -> manager.findById(42))
                    .isInstanceOf(AccountNotFoundException.class);
        }

        @Test
        @DisplayName("List returns every account ordered by id")
        void listsAll() {
            manager.create("admin", "admin@ecotech.com", "admin123", Role.ADMIN);
            manager.create("maria", "maria@ecotech.com", "secret123", Role.USER);

            assertThat(manager.listAll()).extracting(Account::getUsername).containsExactly("admin", "maria");
            assertThat(manager.findByUsername("Maria").getId()).isEqualTo(2L);
            assertThat(manager.countAccounts()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("update")
    class Update {

        private Account maria;

        @BeforeEach
        void seed() {
            manager.create("admin", "admin@ecotech.com", "admin123", Role.ADMIN);
            maria = manager.create("maria", "maria@ecotech.com", "secret123", Role.USER);
        }

        @Test
        @DisplayName("Only supplied fields change")
        void partialUpdate() {
            Account updated = manager.update(maria.getId(), null, Role.ADMIN, null);

            assertThat(updated.getRole()).isEqualTo(Role.ADMIN);
            assertThat(updated.getEmail()).isEqualTo("maria@ecotech.com");
            assertThat(updated.getPasswordHash()).isEqualTo(maria.getPasswordHash());
        }

        @Test
        @DisplayName("A new password is re-hashed and the old one stops working")
        void changesPassword() {
            manager.update(maria.getId(), "", null, "newSecret1");

            assertThat(manager.authenticate("maria", "newSecret1").getId()).isEqualTo(maria.getId());
            assertThatThrownBy(() -> manager.authenticate("maria", "secret123"))
                    .isInstanceOf(InvalidCredentialsException.class);
        }

        @Test
        @DisplayName("Nothing to update is a validation error")
        void nothingToUpdate() {
            assertThatThrownBy(() -> manager.update(maria.getId(), "", null, ""))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("No fields to update");
        }

        @Test
        @DisplayName("Malformed email, short password, taken email and unknown id are rejected")
        void rejectsBadUpdates() {
            assertThatThrownBy(() -> manager.update(maria.getId(), "broken", null, null))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> manager.update(maria.getId(), null, null, "abc"))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> manager.update(maria.getId(), "ADMIN@ecotech.com", null, null))
                    .isInstanceOf(DuplicateAccountException.class)
                    .hasMessage("Email 'admin@ecotech.com' is already registered");
            assertThatThrownBy(() -> manager.update(maria.getId(), OVERLONG_EMAIL, null, null))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("Email must be at most 255 characters");
            assertThatThrownBy(() -> manager.update(99, null, Role.USER, null))
                    .isInstanceOf(AccountNotFoundException.class);

            assertThat(manager.findById(maria.getId())).isEqualTo(maria);
        }
    }

    @Nested
    @DisplayName("delete")
    class Delete {

        @Test
        @DisplayName("Removes another account")
        void deletesOther() {
            Account admin = manager.create("admin", "admin@ecotech.com", "admin123", Role.ADMIN);
            Account maria = manager.create("maria", "maria@ecotech.com", "secret123", Role.USER);

            manager.delete(maria.getId(), admin.getId());

            assertThat(manager.listAll()).containsExactly(admin);
            assertThatThrownBy(() -> manager.delete(maria.getId(), admin.getId()))
                    .isInstanceOf(AccountNotFoundException.class);
        }

        @Test
        @DisplayName("Refuses to delete the requesting account")
        void refusesSelfDeletion() {
            Account admin = manager.create("admin", "admin@ecotech.com", "admin123", Role.ADMIN);

            assertThatThrownBy(() -> manager.delete(admin.getId(), admin.getId()))
                    .isInstanceOf(SelfDeletionException.class)
                    .extracting("errorCode").isEqualTo(AccountErrorCode.SELF_DELETION);
            assertThat(manager.countAccounts()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("Integrity failures other than a unique key are storage errors")
    void nonUniqueIntegrityFailure() {
        AccountStore failing = mock(AccountStore.class);
        when(failing.insert(any())).thenThrow(new DataIntegrityViolationException("Value too long for column EMAIL"));
        AccountManager broken = new AccountManager(failing, hasher, validator);

        assertThatThrownBy(() -> broken.create("maria", "maria@ecotech.com", "secret123", Role.USER))
                .isInstanceOf(StorageException.class)
                .isNotInstanceOf(DuplicateAccountException.class);
    }

    @Test
    @DisplayName("Storage failures surface as a storage error without driver details")
    void storageFailure() {
        AccountStore failing = mock(AccountStore.class);
        DataAccessResourceFailureException cause =
                new DataAccessResourceFailureException("Communications link failure to 10.0.0.5:3306");
        when(failing.insert(any())).thenThrow(cause);
        when(failing.count()).thenThrow(cause);
        AccountManager broken = new AccountManager(failing, hasher, validator);

        AccountException error = catchThrowableOfType(
                () -> broken.create("maria", "maria@ecotech.com", "secret123", Role.USER), StorageException.class);
        assertThat(error.getErrorCode()).isEqualTo(AccountErrorCode.STORAGE_FAILURE);
        assertThat(error.getMessage()).doesNotContain("3306");
        assertThat(error).hasCause(cause);

        assertThatThrownBy(broken::countAccounts).isInstanceOf(StorageException.class);
    }
}

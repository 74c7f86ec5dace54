package com.ecotech.auth.infrastructure.repository;

import com.ecotech.auth.domain.model.Account;
import com.ecotech.auth.domain.model.AccountUpdate;
import com.ecotech.auth.infrastructure.entity.AccountEntity;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Account store backed by Spring Data JPA.
 * Each operation is its own transaction; a rejected write leaves nothing behind.
 */
@Component
@Slf4j
public class JpaAccountStore implements AccountStore {

    private final AccountRepository accountRepository;

    public JpaAccountStore(AccountRepository accountRepository) {
        this.accountRepository = accountRepository;
    }

    @Override
    @Transactional
    public long insert(Account account) {
        AccountEntity entity = new AccountEntity();
        entity.setUsername(account.getUsername());
        entity.setEmail(account.getEmail());
        entity.setPasswordHash(account.getPasswordHash());
        entity.setRole(account.getRole());

        try {
            AccountEntity saved = accountRepository.saveAndFlush(entity);
            log.debug("[ACCOUNT_INSERTED] Row inserted | id={} | username={}", saved.getId(), saved.getUsername());
            return saved.getId();
        } catch (DataIntegrityViolationException e) {
            log.debug("[ACCOUNT_INSERT_REJECTED] Integrity check rejected insert | username={}", account.getUsername());
            throw translate(e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Account> findByUsername(String username) {
        return accountRepository.findByUsername(username).map(JpaAccountStore::toAccount);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Account> findById(long id) {
        return accountRepository.findById(id).map(JpaAccountStore::toAccount);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Account> listAll() {
        return accountRepository.findAllOrderedById().stream()
                .map(JpaAccountStore::toAccount)
                .collect(Collectors.toList());
    }

    @Override
    @Transactional
    public Optional<Account> update(long id, AccountUpdate changes) {
        Optional<AccountEntity> found = accountRepository.findById(id);
        if (found.isEmpty()) {
            return Optional.empty();
        }

        AccountEntity entity = found.get();
        if (changes.isEmpty()) {
            return Optional.of(toAccount(entity));
        }
        if (changes.getEmail() != null) {
            entity.setEmail(changes.getEmail());
        }
        if (changes.getRole() != null) {
            entity.setRole(changes.getRole());
        }
        if (changes.getPasswordHash() != null) {
            entity.setPasswordHash(changes.getPasswordHash());
        }

        try {
            AccountEntity saved = accountRepository.saveAndFlush(entity);
            log.debug("[ACCOUNT_UPDATED] Row updated | id={}", id);
            return Optional.of(toAccount(saved));
        } catch (DataIntegrityViolationException e) {
            log.debug("[ACCOUNT_UPDATE_REJECTED] Integrity check rejected update | id={}", id);
            throw translate(e);
        }
    }

    @Override
    @Transactional
    public boolean delete(long id) {
        if (!accountRepository.existsById(id)) {
            return false;
        }
        accountRepository.deleteById(id);
        log.debug("[ACCOUNT_DELETED] Row deleted | id={}", id);
        return true;
    }

    @Override
    @Transactional(readOnly = true)
    public long count() {
        return accountRepository.count();
    }

    /**
     * Unique-key violations on username or email become {@link UniqueFieldViolationException};
     * any other integrity failure (value too long, not null) is returned unchanged.
     */
    static DataIntegrityViolationException translate(DataIntegrityViolationException e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause() == cause ? null : cause.getCause()) {
            String field = uniqueField(cause);
            if (field != null) {
                return new UniqueFieldViolationException(field, e);
            }
        }
        return e;
    }

    private static String uniqueField(Throwable cause) {
        String violated = cause instanceof ConstraintViolationException
                ? ((ConstraintViolationException) cause).getConstraintName()
                : null;
        // H2 and MySQL both name the violated key in the driver message
        if (violated == null) {
            violated = cause.getMessage();
        }
        if (violated == null) {
            return null;
        }
        String normalized = violated.toLowerCase(Locale.ROOT);
        if (normalized.contains(AccountEntity.UK_USERNAME)) {
            return UniqueFieldViolationException.USERNAME;
        }
        if (normalized.contains(AccountEntity.UK_EMAIL)) {
            return UniqueFieldViolationException.EMAIL;
        }
        return null;
    }

    private static Account toAccount(AccountEntity entity) {
        return Account.builder()
                .id(entity.getId())
                .username(entity.getUsername())
                .email(entity.getEmail())
                .passwordHash(entity.getPasswordHash())
                .role(entity.getRole())
                .build();
    }
}

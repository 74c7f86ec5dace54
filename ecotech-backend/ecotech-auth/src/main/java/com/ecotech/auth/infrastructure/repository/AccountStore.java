package com.ecotech.auth.infrastructure.repository;

import com.ecotech.auth.domain.model.Account;
import com.ecotech.auth.domain.model.AccountUpdate;

import java.util.List;
import java.util.Optional;

/**
 * Persistence of accounts. No business validation happens here.
 * <p>
 * Implementations bind every value as a statement parameter and report unique
 * constraint violations as {@link UniqueFieldViolationException} naming the field.
 * Any other storage failure surfaces as a {@link org.springframework.dao.DataAccessException}.
 */
public interface AccountStore {

    /**
     * Inserts a new account and returns the id assigned by storage.
     */
    long insert(Account account);

    Optional<Account> findByUsername(String username);

    Optional<Account> findById(long id);

    /**
     * All accounts, ordered by id ascending.
     */
    List<Account> listAll();

    /**
     * Applies the non-null fields of {@code changes}. Empty when no account has this id.
     */
    Optional<Account> update(long id, AccountUpdate changes);

    /**
     * Hard delete. Returns false when no account has this id.
     */
    boolean delete(long id);

    long count();
}

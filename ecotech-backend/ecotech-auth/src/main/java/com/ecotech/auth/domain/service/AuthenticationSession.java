package com.ecotech.auth.domain.service;

import com.ecotech.auth.domain.exception.AccountLockedException;
import com.ecotech.auth.domain.exception.InvalidCredentialsException;
import com.ecotech.auth.domain.exception.ValidationException;
import com.ecotech.auth.domain.model.Account;
import com.ecotech.auth.domain.model.SessionState;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static com.ecotech.auth.domain.constants.AuthConstants.SESSION_LOCKED_MESSAGE;

/**
 * Login state machine for one client.
 * <pre>
 *   UNAUTHENTICATED --attempt ok--------------------&gt; AUTHENTICATED
 *   UNAUTHENTICATED --last attempt fails------------&gt; LOCKED
 *   AUTHENTICATED   --logout------------------------&gt; UNAUTHENTICATED
 *   LOCKED          --lockout elapsed, next attempt-&gt; UNAUTHENTICATED
 * </pre>
 * A zero lockout duration keeps a locked session locked for good.
 * Not thread-safe; create one per client with {@link AuthenticationSessionFactory}.
 */
@Slf4j
public class AuthenticationSession {

    private final AccountManager accountManager;
    private final int maxAttempts;
    private final Duration lockoutDuration;
    private final Clock clock;

    private SessionState state = SessionState.UNAUTHENTICATED;
    private int attemptsRemaining;
    private Account currentAccount;
    private Instant lockedUntil;

    public AuthenticationSession(AccountManager accountManager, int maxAttempts, Duration lockoutDuration, Clock clock) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        if (lockoutDuration == null || lockoutDuration.isNegative()) {
            throw new IllegalArgumentException("lockoutDuration must be zero or positive");
        }
        this.accountManager = accountManager;
        this.maxAttempts = maxAttempts;
        this.lockoutDuration = lockoutDuration;
        this.clock = clock;
        this.attemptsRemaining = maxAttempts;
    }

    /**
     * Try to log in.
     *
     * @return the authenticated account
     * @throws ValidationException if username or password is blank; no attempt is consumed
     * @throws InvalidCredentialsException if the credentials are wrong; one attempt is consumed
     * @throws AccountLockedException if the session is locked; nothing is consumed or looked up
     * @throws IllegalStateException if the session is already authenticated
     */
    public Account attempt(String username, String password) {
        if (state == SessionState.LOCKED) {
            if (!lockoutElapsed()) {
                int retryAfter = retryAfterSeconds();
                log.warn("[LOGIN_BLOCKED] Attempt on locked session | retryAfter={}s", retryAfter);
                throw new AccountLockedException(SESSION_LOCKED_MESSAGE, retryAfter);
            }
            log.info("[LOCKOUT_EXPIRED] Lockout elapsed, starting a fresh login cycle");
            reset();
        }
        if (state == SessionState.AUTHENTICATED) {
            throw new IllegalStateException("Session is already authenticated as " + currentAccount.getUsername());
        }
        if (isBlank(username) || isBlank(password)) {
            throw new ValidationException("Username and password are required");
        }

        try {
            Account account = accountManager.authenticate(username, password);
            state = SessionState.AUTHENTICATED;
            currentAccount = account;
            log.info("[SESSION_AUTHENTICATED] Session authenticated | id={} | username={}",
                    account.getId(), account.getUsername());
            return account;
        } catch (InvalidCredentialsException e) {
            attemptsRemaining--;
            log.warn("[LOGIN_ATTEMPT_FAILED] Failed login attempt | attempts={}/{}",
                    maxAttempts - attemptsRemaining, maxAttempts);
            if (attemptsRemaining == 0) {
                lock();
            }
            throw e;
        }
    }

    /**
     * End the authenticated session and start a fresh login cycle.
     *
     * @throws IllegalStateException if nobody is logged in
     */
    public void logout() {
        if (state != SessionState.AUTHENTICATED) {
            throw new IllegalStateException("Cannot log out from state " + state);
        }
        log.info("[LOGOUT_SUCCESS] Session closed | username={}", currentAccount.getUsername());
        reset();
    }

    public SessionState getState() {
        return state;
    }

    public int getAttemptsRemaining() {
        return attemptsRemaining;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Optional<Account> getCurrentAccount() {
        return Optional.ofNullable(currentAccount);
    }

    public boolean isAuthenticated() {
        return state == SessionState.AUTHENTICATED;
    }

    public boolean isLocked() {
        return state == SessionState.LOCKED;
    }

    /**
     * Instant the lockout ends, empty when the session is not locked or locked for good.
     */
    public Optional<Instant> getLockedUntil() {
        return Optional.ofNullable(lockedUntil);
    }

    private void lock() {
        state = SessionState.LOCKED;
        lockedUntil = lockoutDuration.isZero() ? null : clock.instant().plus(lockoutDuration);
        log.warn("[SESSION_LOCKED] Login blocked - too many failed attempts | maxAttempts={} | lockedUntil={}",
                maxAttempts, lockedUntil != null ? lockedUntil : "permanent");
    }

    private void reset() {
        state = SessionState.UNAUTHENTICATED;
        currentAccount = null;
        lockedUntil = null;
        attemptsRemaining = maxAttempts;
    }

    private boolean lockoutElapsed() {
        return lockedUntil != null && !clock.instant().isBefore(lockedUntil);
    }

    private int retryAfterSeconds() {
        if (lockedUntil == null) {
            return AccountLockedException.PERMANENT;
        }
        long millis = Duration.between(clock.instant(), lockedUntil).toMillis();
        return (int) Math.max(1, (millis + 999) / 1000);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

package com.ecotech.auth.domain.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

import static com.ecotech.auth.domain.constants.AuthConstants.MAX_LOGIN_ATTEMPTS;

/**
 * Hands out a fresh {@link AuthenticationSession} per client so no login state is shared.
 */
@Component
@Slf4j
public class AuthenticationSessionFactory {

    private final AccountManager accountManager;
    private final Clock clock;

    @Value("${ecotech.auth.max-login-attempts:" + MAX_LOGIN_ATTEMPTS + "}")
    private int maxLoginAttempts;

    @Value("${ecotech.auth.lockout-duration:0s}") // zero = locked until restart
    private Duration lockoutDuration;

    public AuthenticationSessionFactory(AccountManager accountManager, Clock clock) {
        this.accountManager = accountManager;
        this.clock = clock;
    }

    public AuthenticationSession newSession() {
        log.debug("[SESSION_CREATED] New login session | maxAttempts={} | lockout={}", maxLoginAttempts, lockoutDuration);
        return new AuthenticationSession(accountManager, maxLoginAttempts, lockoutDuration, clock);
    }
}

package com.ecotech.auth.domain.service;

import com.ecotech.auth.domain.exception.InvalidInputException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.Base64;

import static com.ecotech.auth.domain.constants.AuthConstants.BCRYPT_COST_FACTOR;
import static com.ecotech.auth.domain.constants.AuthConstants.MIN_PASSWORD_LENGTH;

/**
 * Password Service - One-way salted hashing with BCrypt
 * Every hash embeds its own random salt and the cost factor it was made with,
 * so hashing the same password twice gives two different strings.
 */
@Service
@Slf4j
public class PasswordHasher {

    private static final int MIN_BCRYPT_COST = 4;
    private static final int MAX_BCRYPT_COST = 31;

    private final BCryptPasswordEncoder passwordEncoder;
    private final int costFactor;
    private final int minPasswordLength;
    private final String dummyHash;

    public PasswordHasher(@Value("${ecotech.auth.bcrypt-cost:" + BCRYPT_COST_FACTOR + "}") int costFactor,
                          @Value("${ecotech.auth.min-password-length:" + MIN_PASSWORD_LENGTH + "}") int minPasswordLength,
                          SecureRandom secureRandom) {
        if (costFactor < MIN_BCRYPT_COST || costFactor > MAX_BCRYPT_COST) {
            throw new IllegalArgumentException("BCrypt cost factor must be between "
                    + MIN_BCRYPT_COST + " and " + MAX_BCRYPT_COST + ", got " + costFactor);
        }
        if (minPasswordLength < 1) {
            throw new IllegalArgumentException("Minimum password length must be positive, got " + minPasswordLength);
        }
        this.costFactor = costFactor;
        this.minPasswordLength = minPasswordLength;
        this.passwordEncoder = new BCryptPasswordEncoder(costFactor, secureRandom);

        // Same cost as real hashes so a miss on username takes as long as a wrong password
        byte[] filler = new byte[16];
        secureRandom.nextBytes(filler);
        this.dummyHash = passwordEncoder.encode(Base64.getEncoder().encodeToString(filler));

        log.info("[PASSWORD_HASHER_INIT] BCrypt hasher ready | cost={} | minLength={}", costFactor, minPasswordLength);
    }

    /**
     * Hash a password for storage
     *
     * @throws InvalidInputException if the password is empty or shorter than the minimum length
     */
    public String hash(String password) {
        if (password == null || password.isEmpty()) {
            throw new InvalidInputException("Password is required");
        }
        if (password.length() < minPasswordLength) {
            throw new InvalidInputException("Password must be at least " + minPasswordLength + " characters");
        }
        String encoded = passwordEncoder.encode(password);
        log.debug("[PASSWORD_HASHED] Password hashed with BCrypt | cost={}", costFactor);
        return encoded;
    }

    /**
     * Verify password matches stored hash.
     * Malformed or foreign hashes are a plain mismatch, never an error.
     */
    public boolean verify(String password, String passwordHash) {
        if (password == null || passwordHash == null || passwordHash.isEmpty()) {
            return false;
        }
        try {
            boolean matches = passwordEncoder.matches(password, passwordHash);
            log.debug("[PASSWORD_VERIFY] Password verification result | matches={}", matches);
            return matches;
        } catch (IllegalArgumentException e) {
            log.warn("[PASSWORD_VERIFY_MALFORMED] Stored hash could not be parsed | reason={}", e.getMessage());
            return false;
        }
    }

    /**
     * Burn one full verification against a throwaway hash. Always false.
     */
    public boolean verifyAgainstDummy(String password) {
        verify(password == null ? "" : password, dummyHash);
        return false;
    }

    public int getCostFactor() {
        return costFactor;
    }

    public int getMinPasswordLength() {
        return minPasswordLength;
    }
}

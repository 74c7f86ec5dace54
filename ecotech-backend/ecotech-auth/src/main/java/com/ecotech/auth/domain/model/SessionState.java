package com.ecotech.auth.domain.model;

public enum SessionState {
    UNAUTHENTICATED,
    AUTHENTICATED,
    LOCKED
}

package com.ecotech.auth.domain.exception;

public class AccountNotFoundException extends AccountException {

    public AccountNotFoundException(String message) {
        super(AccountErrorCode.ACCOUNT_NOT_FOUND, message);
    }
}

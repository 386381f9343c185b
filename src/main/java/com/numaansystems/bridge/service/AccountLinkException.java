package com.numaansystems.bridge.service;

/**
 * The federated account could not be linked to the local user.
 */
public class AccountLinkException extends RuntimeException {

    private final String errorCode;

    public AccountLinkException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public AccountLinkException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}

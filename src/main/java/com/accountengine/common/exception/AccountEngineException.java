package com.accountengine.common.exception;

/**
 * Base exception for all account engine exceptions.
 */
public class AccountEngineException extends RuntimeException {

    public AccountEngineException(String message) {
        super(message);
    }

    public AccountEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}

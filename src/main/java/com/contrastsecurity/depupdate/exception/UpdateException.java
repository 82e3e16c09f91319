package com.contrastsecurity.depupdate.exception;

/**
 * Base exception for all depupdate errors.
 */
public class UpdateException extends Exception {

    public UpdateException(String message) {
        super(message);
    }

    public UpdateException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.contrastsecurity.depupdate.exception;

/**
 * Exception thrown when registry metadata cannot be fetched, or a requested
 * package is unknown to the registry.
 */
public class RegistryException extends UpdateException {

    public RegistryException(String message) {
        super(message);
    }

    public RegistryException(String message, Throwable cause) {
        super(message, cause);
    }
}

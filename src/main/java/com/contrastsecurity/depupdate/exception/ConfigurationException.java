package com.contrastsecurity.depupdate.exception;

/**
 * Exception thrown when command line options are invalid or inconsistent.
 */
public class ConfigurationException extends UpdateException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.contrastsecurity.depupdate.exception;

/**
 * Exception thrown when package.json cannot be found or parsed.
 */
public class ManifestException extends UpdateException {

    public ManifestException(String message) {
        super(message);
    }

    public ManifestException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.hellokaton.lumen.exception;

/**
 * Raised when the application is assembled with conflicting or invalid options.
 * <p>
 * Always fatal: the application never starts.
 */
public class ImproperlyConfiguredException extends LumenException {

    public ImproperlyConfiguredException(String message) {
        super(message);
    }

    public ImproperlyConfiguredException(String message, Throwable cause) {
        super(message, cause);
    }

}

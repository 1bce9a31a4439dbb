package com.hellokaton.lumen.exception;

/**
 * Base unchecked exception of the framework.
 *
 * @author <a href="mailto:hellokaton@gmail.com" target="_blank">hellokaton</a>
 */
public class LumenException extends RuntimeException {

    public LumenException(String message) {
        super(message);
    }

    public LumenException(String message, Throwable cause) {
        super(message, cause);
    }

}

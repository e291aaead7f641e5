package org.pragmatica.scripter.error;

/**
 * Base exception for the library.
 */
public abstract class ScripterException extends RuntimeException {
    protected ScripterException(String message) {
        super(message);
    }

    protected ScripterException(String message, Throwable cause) {
        super(message, cause);
    }
}

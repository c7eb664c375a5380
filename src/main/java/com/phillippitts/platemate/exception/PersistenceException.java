package com.phillippitts.platemate.exception;

/**
 * Thrown when assistant state cannot be read from or written to storage.
 */
public class PersistenceException extends PlateMateException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}

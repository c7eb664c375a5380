package com.phillippitts.platemate.exception;

/**
 * Base exception for all PlateMate application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class PlateMateException extends RuntimeException {

    public PlateMateException(String message) {
        super(message);
    }

    public PlateMateException(String message, Throwable cause) {
        super(message, cause);
    }

    public PlateMateException(Throwable cause) {
        super(cause);
    }
}

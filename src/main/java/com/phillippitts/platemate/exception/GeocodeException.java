package com.phillippitts.platemate.exception;

/**
 * Thrown when a reverse-geocode lookup fails. Callers keep the previous place name.
 */
public class GeocodeException extends PlateMateException {

    public GeocodeException(String message) {
        super(message);
    }

    public GeocodeException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.phillippitts.platemate.exception;

/**
 * Thrown when the user denied (or policy restricts) access to a resource such as
 * the microphone or the device location. Terminal for that resource; never retried automatically.
 */
public class PermissionDeniedException extends PlateMateException {

    private final String resource;

    public PermissionDeniedException(String resource) {
        super("Permission denied for " + resource);
        this.resource = resource;
    }

    public String getResource() {
        return resource;
    }
}

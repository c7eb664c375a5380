package com.phillippitts.platemate.service.permission;

/**
 * Authorization state of a guarded resource (location or microphone).
 */
public enum PermissionStatus {
    NOT_DETERMINED,
    DENIED,
    RESTRICTED,
    AUTHORIZED_WHEN_IN_USE,
    AUTHORIZED_ALWAYS;

    public boolean isAuthorized() {
        return this == AUTHORIZED_WHEN_IN_USE || this == AUTHORIZED_ALWAYS;
    }

    /** Terminal refusal: no further requests will change the answer. */
    public boolean isBlocked() {
        return this == DENIED || this == RESTRICTED;
    }
}

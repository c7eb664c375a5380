package com.phillippitts.platemate.service.session;

/**
 * Outcome of {@link SessionController#submitUserText(String)}.
 */
public enum SubmitResult {
    ACCEPTED,
    REJECTED_NOT_CONNECTED,
    REJECTED_EMPTY,
    /** A previous query is still being answered. */
    REJECTED_BUSY
}

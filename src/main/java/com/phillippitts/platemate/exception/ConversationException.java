package com.phillippitts.platemate.exception;

import java.util.UUID;

/**
 * Failure of a conversation exchange with the generative chat API.
 *
 * <p>Carries the session token that was current when the request was issued so callers can
 * discard failures that belong to a session which has since been torn down.
 */
public abstract class ConversationException extends PlateMateException {

    private final UUID sessionToken;

    protected ConversationException(String message, UUID sessionToken) {
        super(message);
        this.sessionToken = sessionToken;
    }

    protected ConversationException(String message, UUID sessionToken, Throwable cause) {
        super(message, cause);
        this.sessionToken = sessionToken;
    }

    /** Session token valid at call time; may be {@code null} when no session was open. */
    public UUID getSessionToken() {
        return sessionToken;
    }
}

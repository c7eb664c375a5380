package com.phillippitts.platemate.exception;

import java.util.UUID;

/**
 * Thrown when the chat API call itself fails (network error, HTTP error status, malformed payload)
 * or when priming the conversation did not complete.
 *
 * <p>Never retried automatically; the user resends.
 */
public class TransientApiException extends ConversationException {

    public TransientApiException(String message, UUID sessionToken) {
        super(message, sessionToken);
    }

    public TransientApiException(String message, UUID sessionToken, Throwable cause) {
        super(message, sessionToken, cause);
    }
}

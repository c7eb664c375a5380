package com.phillippitts.platemate.exception;

import java.util.UUID;

/**
 * Thrown when the chat API call succeeded but produced no usable text
 * (blank text, no candidates, or a safety block).
 */
public class EmptyOrUnsafeResponseException extends ConversationException {

    public EmptyOrUnsafeResponseException(String message, UUID sessionToken) {
        super(message, sessionToken);
    }
}

package com.phillippitts.platemate.service.conversation;

import com.phillippitts.platemate.exception.EmptyOrUnsafeResponseException;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Failure classes of a chat exchange, each with the single message shown to the user.
 */
public enum ConversationFailure {

    TRANSIENT("transient", "Sorry, I encountered an error. Please try again."),
    EMPTY_OR_UNSAFE("empty_or_unsafe", "I couldn't find that information. Can you try asking in a different way?");

    private final String tag;
    private final String fallbackMessage;

    ConversationFailure(String tag, String fallbackMessage) {
        this.tag = tag;
        this.fallbackMessage = fallbackMessage;
    }

    public String tag() {
        return tag;
    }

    public String fallbackMessage() {
        return fallbackMessage;
    }

    /** Anything other than an empty/unsafe response is treated as transient. */
    public static ConversationFailure classify(Throwable error) {
        return unwrap(error) instanceof EmptyOrUnsafeResponseException ? EMPTY_OR_UNSAFE : TRANSIENT;
    }

    public static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}

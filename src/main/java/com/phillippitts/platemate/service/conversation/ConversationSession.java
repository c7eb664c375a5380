package com.phillippitts.platemate.service.conversation;

import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * State of one chat session: priming flag, in-flight guard and the token that identifies it.
 */
final class ConversationSession {

    private final UUID token;
    private final ChatSessionHandle handle;
    private final AtomicBoolean inFlight = new AtomicBoolean(false);
    private volatile boolean primed;

    ConversationSession(UUID token, ChatSessionHandle handle) {
        this.token = Objects.requireNonNull(token, "token");
        this.handle = Objects.requireNonNull(handle, "handle");
    }

    UUID token() {
        return token;
    }

    ChatSessionHandle handle() {
        return handle;
    }

    boolean isPrimed() {
        return primed;
    }

    /** Flips once; the system prompt exchange has succeeded. */
    void markPrimed() {
        primed = true;
    }

    boolean tryBeginRequest() {
        return inFlight.compareAndSet(false, true);
    }

    void endRequest() {
        inFlight.set(false);
    }

    boolean isInFlight() {
        return inFlight.get();
    }
}

package com.phillippitts.platemate.service.session.event;

import com.phillippitts.platemate.domain.ChatMessage;

import java.util.Objects;

/**
 * Published after a message has been appended to the conversation history.
 */
public record ChatMessageAppendedEvent(ChatMessage message) {

    public ChatMessageAppendedEvent {
        Objects.requireNonNull(message, "message");
    }
}

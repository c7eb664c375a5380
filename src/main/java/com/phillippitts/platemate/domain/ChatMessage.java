package com.phillippitts.platemate.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable entry of the conversation history.
 *
 * @param id        unique message identifier
 * @param text      message text as shown to the user
 * @param sender    who produced the message
 * @param timestamp creation time
 * @param kind      presentation hint
 * @param entities  restaurants extracted from the message, in display order (empty for most kinds)
 */
public record ChatMessage(
        UUID id,
        String text,
        Sender sender,
        Instant timestamp,
        MessageKind kind,
        List<RestaurantRecord> entities
) {

    public ChatMessage {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(sender, "sender must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        entities = entities == null ? List.of() : List.copyOf(entities);
    }

    public static ChatMessage user(String text) {
        return new ChatMessage(UUID.randomUUID(), text, Sender.USER, Instant.now(), MessageKind.TEXT, List.of());
    }

    public static ChatMessage assistant(String text, MessageKind kind) {
        return new ChatMessage(UUID.randomUUID(), text, Sender.ASSISTANT, Instant.now(), kind, List.of());
    }

    public static ChatMessage assistant(String text, List<RestaurantRecord> entities) {
        MessageKind kind = entities.isEmpty() ? MessageKind.TEXT : MessageKind.RESTAURANT_LIST;
        return new ChatMessage(UUID.randomUUID(), text, Sender.ASSISTANT, Instant.now(), kind, entities);
    }

    public boolean containsRestaurants() {
        return !entities.isEmpty();
    }
}

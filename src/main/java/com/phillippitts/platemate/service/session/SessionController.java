package com.phillippitts.platemate.service.session;

import com.phillippitts.platemate.config.properties.GeminiProperties;
import com.phillippitts.platemate.domain.ChatMessage;
import com.phillippitts.platemate.domain.Coordinate;
import com.phillippitts.platemate.domain.LocationFix;
import com.phillippitts.platemate.domain.MessageKind;
import com.phillippitts.platemate.domain.RestaurantRecord;
import com.phillippitts.platemate.domain.UserPreferences;
import com.phillippitts.platemate.exception.ConversationBusyException;
import com.phillippitts.platemate.service.conversation.ChatSessionConfig;
import com.phillippitts.platemate.service.conversation.ConversationClient;
import com.phillippitts.platemate.service.conversation.ConversationFailure;
import com.phillippitts.platemate.service.conversation.ConversationReply;
import com.phillippitts.platemate.service.extraction.EntityExtractor;
import com.phillippitts.platemate.service.extraction.ExtractionResult;
import com.phillippitts.platemate.service.location.LocationResolver;
import com.phillippitts.platemate.service.location.event.LocationUpdatedEvent;
import com.phillippitts.platemate.service.persistence.AssistantDataStore;
import com.phillippitts.platemate.service.session.event.ChatMessageAppendedEvent;
import com.phillippitts.platemate.service.session.event.LocationPermissionRequestEvent;
import com.phillippitts.platemate.service.session.event.SessionConnectFailedEvent;
import com.phillippitts.platemate.service.speech.SpeechCaptureService;
import com.phillippitts.platemate.service.speech.event.TranscriptFinalizedEvent;
import com.phillippitts.platemate.util.GeoDistance;
import com.phillippitts.platemate.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Top-level orchestrator of the assistant.
 *
 * <p>Owns the conversation history (the only writer), routes typed text and finalized voice
 * transcripts to the {@link ConversationClient}, adds location context to each query, and turns
 * replies into history entries through the {@link EntityExtractor}. Every append is announced with
 * a {@link ChatMessageAppendedEvent}.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * DISCONNECTED → CONNECTING (connect)
 * CONNECTING → CONNECTED | DISCONNECTED (session opened or failed)
 * CONNECTED → DISCONNECTED (disconnect)
 * </pre>
 *
 * <p>Each API failure appends exactly one ERROR message. Replies that arrive after a disconnect
 * carry a stale session token and are dropped without touching history.
 *
 * <p><b>Thread Safety:</b> state and history writes are guarded by a {@link ReentrantLock}.
 */
@Service
public class SessionController {

    private static final Logger LOG = LogManager.getLogger(SessionController.class);

    static final String WELCOME_MESSAGE = "Hello! I'm your restaurant assistant. I can help you find great "
            + "places to eat. What type of food are you looking for today?";

    private final ConversationClient conversation;
    private final EntityExtractor extractor;
    private final LocationResolver location;
    private final SpeechCaptureService speech;
    private final AssistantDataStore dataStore;
    private final ApplicationEventPublisher publisher;
    private final ChatSessionConfig sessionConfig;

    private final Lock lock = new ReentrantLock();
    // @GuardedBy("lock")
    private ConnectionState state = ConnectionState.DISCONNECTED;
    // @GuardedBy("lock")
    private boolean processing;
    // @GuardedBy("lock")
    private boolean locationRequestPending;
    // @GuardedBy("lock")
    private List<RestaurantRecord> displayed = List.of();

    public SessionController(ConversationClient conversation,
                             EntityExtractor extractor,
                             LocationResolver location,
                             SpeechCaptureService speech,
                             AssistantDataStore dataStore,
                             ApplicationEventPublisher publisher,
                             GeminiProperties geminiProperties) {
        this.conversation = Objects.requireNonNull(conversation, "conversation");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.location = Objects.requireNonNull(location, "location");
        this.speech = Objects.requireNonNull(speech, "speech");
        this.dataStore = Objects.requireNonNull(dataStore, "dataStore");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.sessionConfig = ChatSessionConfig.from(geminiProperties);
    }

    /**
     * Opens a chat session. No-op unless DISCONNECTED. A failure returns to DISCONNECTED and
     * publishes {@link SessionConnectFailedEvent}; it is not retried.
     *
     * @return state after the call
     */
    public ConnectionState connect() {
        lock.lock();
        try {
            if (state != ConnectionState.DISCONNECTED) {
                return state;
            }
            state = ConnectionState.CONNECTING;
        } finally {
            lock.unlock();
        }

        try {
            conversation.startSession(sessionConfig);
        } catch (RuntimeException e) {
            LOG.warn("Failed to open chat session: {}", e.getMessage());
            lock.lock();
            try {
                state = ConnectionState.DISCONNECTED;
            } finally {
                lock.unlock();
            }
            publisher.publishEvent(new SessionConnectFailedEvent(e.getMessage(), Instant.now()));
            return ConnectionState.DISCONNECTED;
        }

        lock.lock();
        try {
            state = ConnectionState.CONNECTED;
            if (dataStore.history().isEmpty()) {
                append(ChatMessage.assistant(WELCOME_MESSAGE, MessageKind.WELCOME));
            }
            LOG.info("Session connected");
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancels voice capture, invalidates the chat session and returns to DISCONNECTED.
     * History is kept.
     */
    public void disconnect() {
        speech.cancel();
        conversation.close();
        lock.lock();
        try {
            processing = false;
            if (state != ConnectionState.DISCONNECTED) {
                LOG.info("Session disconnected");
            }
            state = ConnectionState.DISCONNECTED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Submits a user query.
     *
     * @param text query as typed or transcribed
     * @return {@link SubmitResult#ACCEPTED} if the query was appended and sent
     */
    public SubmitResult submitUserText(String text) {
        String trimmed = text == null ? "" : text.trim();
        UUID token;
        CompletableFuture<ConversationReply> future;

        lock.lock();
        try {
            if (state != ConnectionState.CONNECTED) {
                return SubmitResult.REJECTED_NOT_CONNECTED;
            }
            if (trimmed.isEmpty()) {
                return SubmitResult.REJECTED_EMPTY;
            }
            if (processing || conversation.isInFlight()) {
                return SubmitResult.REJECTED_BUSY;
            }
            Optional<UUID> current = conversation.currentToken();
            if (current.isEmpty()) {
                return SubmitResult.REJECTED_NOT_CONNECTED;
            }
            token = current.get();

            dataStore.addRecentSearch(trimmed);
            append(ChatMessage.user(trimmed));
            processing = true;

            Optional<LocationFix> fix = location.currentFix();
            if (fix.isEmpty() && location.permissionStatus().isBlocked()) {
                locationRequestPending = true;
                publisher.publishEvent(new LocationPermissionRequestEvent(Instant.now()));
            }
            String prompt = PromptBuilder.augment(trimmed, fix);
            LOG.info("Submitting query: '{}' (location={})", LogSanitizer.preview(trimmed), fix.isPresent());
            try {
                future = conversation.send(prompt);
            } catch (ConversationBusyException e) {
                processing = false;
                return SubmitResult.REJECTED_BUSY;
            }
        } finally {
            lock.unlock();
        }

        future.whenComplete((reply, error) -> onResponse(token, reply, error));
        return SubmitResult.ACCEPTED;
    }

    void onResponse(UUID token, ConversationReply reply, Throwable error) {
        lock.lock();
        try {
            if (state != ConnectionState.CONNECTED || !conversation.isCurrent(token)) {
                LOG.debug("Discarding result for stale session {}", token);
                return;
            }
            processing = false;
            if (error == null) {
                ExtractionResult result = extractor.extract(reply.text(), location.currentFix());
                append(ChatMessage.assistant(result.passthroughText(), result.entities()));
                if (result.hasEntities()) {
                    displayed = result.entities();
                }
                LOG.info("Reply received: {} chars, {} restaurant(s)",
                        reply.text().length(), result.entities().size());
            } else {
                ConversationFailure failure = ConversationFailure.classify(error);
                LOG.warn("Query failed ({}): {}", failure, ConversationFailure.unwrap(error).getMessage());
                append(ChatMessage.assistant(failure.fallbackMessage(), MessageKind.ERROR));
            }
        } finally {
            lock.unlock();
        }
    }

    /** Refreshes distances of every known restaurant against the new fix and saves them. */
    @EventListener
    public void onLocationUpdated(LocationUpdatedEvent event) {
        Coordinate origin = event.fix().coordinate();
        lock.lock();
        try {
            int updated = 0;
            for (ChatMessage m : dataStore.history()) {
                updated += refreshDistances(m.entities(), origin);
            }
            updated += refreshDistances(displayed, origin);
            updated += refreshDistances(dataStore.favorites(), origin);
            if (updated > 0) {
                dataStore.restaurantsUpdated();
            }
            LOG.debug("Recomputed {} restaurant distance(s)", updated);
        } finally {
            lock.unlock();
        }
    }

    private static int refreshDistances(List<RestaurantRecord> restaurants, Coordinate origin) {
        for (RestaurantRecord r : restaurants) {
            r.updateDistance(GeoDistance.meters(origin, r.getCoordinates()));
        }
        return restaurants.size();
    }

    /** A finished voice query is handled exactly like typed input. */
    @EventListener
    public void onTranscriptFinalized(TranscriptFinalizedEvent event) {
        SubmitResult result = submitUserText(event.text());
        if (result != SubmitResult.ACCEPTED) {
            LOG.info("Voice query not submitted: {}", result);
        }
    }

    public List<ChatMessage> history() {
        return dataStore.history();
    }

    /** Clears the conversation history. The chat session itself keeps its context. */
    public void clearHistory() {
        lock.lock();
        try {
            dataStore.clearChatHistory();
        } finally {
            lock.unlock();
        }
    }

    public ConnectionState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public boolean isProcessing() {
        lock.lock();
        try {
            return processing;
        } finally {
            lock.unlock();
        }
    }

    public List<RestaurantRecord> displayedRestaurants() {
        lock.lock();
        try {
            return displayed;
        } finally {
            lock.unlock();
        }
    }

    /** Displayed restaurants, filtered and sorted. */
    public List<RestaurantRecord> filterRestaurants(RestaurantFilter filter) {
        return filter.apply(displayedRestaurants());
    }

    /** Sort order from the saved user preferences. */
    public UserPreferences.SortOption defaultSort() {
        return dataStore.preferences().sortPreference();
    }

    public boolean isLocationRequestPending() {
        lock.lock();
        try {
            return locationRequestPending;
        } finally {
            lock.unlock();
        }
    }

    public void acknowledgeLocationRequest() {
        lock.lock();
        try {
            locationRequestPending = false;
        } finally {
            lock.unlock();
        }
    }

    public List<String> suggestedQueries() {
        return Suggestions.suggestedQueries(dataStore.recentSearches());
    }

    public List<String> availableCuisines() {
        return Suggestions.AVAILABLE_CUISINES;
    }

    /**
     * Toggles a restaurant in favorites. The restaurant is looked up among displayed restaurants,
     * history and existing favorites.
     *
     * @return whether it is a favorite afterwards; empty if no such restaurant is known
     */
    public Optional<Boolean> toggleFavorite(String restaurantId) {
        return findRestaurant(restaurantId).map(dataStore::toggleFavorite);
    }

    public List<RestaurantRecord> favorites() {
        return dataStore.favorites();
    }

    private Optional<RestaurantRecord> findRestaurant(String id) {
        Optional<RestaurantRecord> favorite = dataStore.favorite(id);
        if (favorite.isPresent()) {
            return favorite;
        }
        Optional<RestaurantRecord> shown = displayedRestaurants().stream()
                .filter(r -> r.getId().equals(id)).findFirst();
        if (shown.isPresent()) {
            return shown;
        }
        return dataStore.history().stream()
                .flatMap(m -> m.entities().stream())
                .filter(r -> r.getId().equals(id))
                .findFirst();
    }

    private void append(ChatMessage message) {
        // Caller holds the lock
        dataStore.addMessage(message);
        publisher.publishEvent(new ChatMessageAppendedEvent(message));
    }
}

package com.phillippitts.platemate.service.session;

import com.phillippitts.platemate.config.properties.GeminiProperties;
import com.phillippitts.platemate.config.properties.LocationProperties;
import com.phillippitts.platemate.config.properties.PersistenceProperties;
import com.phillippitts.platemate.config.properties.SpeechProperties;
import com.phillippitts.platemate.domain.ChatMessage;
import com.phillippitts.platemate.domain.LocationFix;
import com.phillippitts.platemate.domain.MessageKind;
import com.phillippitts.platemate.domain.RestaurantRecord;
import com.phillippitts.platemate.domain.Sender;
import com.phillippitts.platemate.service.conversation.ConversationClient;
import com.phillippitts.platemate.service.conversation.ConversationFailure;
import com.phillippitts.platemate.service.conversation.ConversationReply;
import com.phillippitts.platemate.service.extraction.EntityExtractor;
import com.phillippitts.platemate.service.location.LocationResolver;
import com.phillippitts.platemate.service.location.Placemark;
import com.phillippitts.platemate.service.location.event.LocationUpdatedEvent;
import com.phillippitts.platemate.service.metrics.ConversationMetrics;
import com.phillippitts.platemate.service.persistence.AssistantDataStore;
import com.phillippitts.platemate.service.session.event.ChatMessageAppendedEvent;
import com.phillippitts.platemate.service.session.event.LocationPermissionRequestEvent;
import com.phillippitts.platemate.service.session.event.SessionConnectFailedEvent;
import com.phillippitts.platemate.service.speech.SpeechCaptureService;
import com.phillippitts.platemate.service.speech.event.TranscriptFinalizedEvent;
import com.phillippitts.platemate.testutil.EventCapturingPublisher;
import com.phillippitts.platemate.testutil.FakeAudioTap;
import com.phillippitts.platemate.testutil.FakeGenerativeChatApi;
import com.phillippitts.platemate.testutil.FakeLocationProvider;
import com.phillippitts.platemate.testutil.FakePermissionProvider;
import com.phillippitts.platemate.testutil.FakeRecognitionProvider;
import com.phillippitts.platemate.testutil.InMemoryPersistenceStore;
import com.phillippitts.platemate.testutil.ManualDelayScheduler;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;

class SessionControllerTest {

    private static final String VENUE_REPLY = "Try the Thai restaurant on 5th or a Mexican grill nearby.";

    private FakeGenerativeChatApi api;
    private HeldExecutor executor;
    private FakePermissionProvider locationPermission;
    private EventCapturingPublisher publisher;
    private InMemoryPersistenceStore store;
    private AssistantDataStore dataStore;
    private LocationResolver location;
    private SessionController controller;

    @BeforeEach
    void setUp() {
        api = new FakeGenerativeChatApi();
        executor = new HeldExecutor();
        locationPermission = FakePermissionProvider.granting();
        publisher = new EventCapturingPublisher();
        store = new InMemoryPersistenceStore();
        dataStore = new AssistantDataStore(store, new PersistenceProperties("unused", 50, 10));
        controller = newController();
    }

    private SessionController newController() {
        ConversationClient client = new ConversationClient(api, executor,
                new ConversationMetrics(new SimpleMeterRegistry()));
        location = new LocationResolver(new LocationProperties(), locationPermission, new FakeLocationProvider(),
                coordinate -> CompletableFuture.completedFuture(new Placemark(null, null)),
                new ManualDelayScheduler(), publisher);
        SpeechCaptureService speech = new SpeechCaptureService(
                new SpeechProperties(false, null, null, null, null),
                FakePermissionProvider.granting(), new FakeRecognitionProvider(), new FakeAudioTap(), publisher);
        GeminiProperties gemini = new GeminiProperties("test-key", "https://gemini.example/v1beta", "test-model",
                0.7, 0.95, 64, 2048, Duration.ofSeconds(5), Duration.ofSeconds(60));
        return new SessionController(client, new EntityExtractor(new Random(1)), location, speech,
                dataStore, publisher, gemini);
    }

    private List<ChatMessage> assistantMessages() {
        return controller.history().stream().filter(m -> m.sender() == Sender.ASSISTANT).toList();
    }

    @Test
    void shouldRejectTextWhenNotConnected() {
        SubmitResult result = controller.submitUserText("pizza");

        assertThat(result).isEqualTo(SubmitResult.REJECTED_NOT_CONNECTED);
        assertThat(controller.history()).isEmpty();
        assertThat(api.sent).isEmpty();
    }

    @Test
    void shouldGreetOnFirstConnect() {
        ConnectionState state = controller.connect();

        assertThat(state).isEqualTo(ConnectionState.CONNECTED);
        assertThat(controller.history()).singleElement().satisfies(m -> {
            assertThat(m.kind()).isEqualTo(MessageKind.WELCOME);
            assertThat(m.text()).isEqualTo(SessionController.WELCOME_MESSAGE);
        });
        assertThat(publisher.eventsOf(ChatMessageAppendedEvent.class)).hasSize(1);
    }

    @Test
    void shouldNotGreetAgainWhenHistoryExists() {
        controller.connect();
        controller.disconnect();

        controller.connect();

        assertThat(controller.history()).hasSize(1);
    }

    @Test
    void shouldReportConnectFailure() {
        api.startFailure = new IllegalStateException("no API key");

        ConnectionState state = controller.connect();

        assertThat(state).isEqualTo(ConnectionState.DISCONNECTED);
        assertThat(controller.state()).isEqualTo(ConnectionState.DISCONNECTED);
        assertThat(publisher.eventsOf(SessionConnectFailedEvent.class))
                .extracting(SessionConnectFailedEvent::reason)
                .containsExactly("no API key");
        assertThat(controller.history()).isEmpty();
    }

    @Test
    void shouldAppendReplyWithExtractedRestaurants() {
        // Arrange
        controller.connect();
        api.defaultReply = text -> VENUE_REPLY;

        // Act
        SubmitResult result = controller.submitUserText("  cheap eats  ");
        executor.runAll();

        // Assert
        assertThat(result).isEqualTo(SubmitResult.ACCEPTED);
        assertThat(api.sent).last().isEqualTo("I am looking for restaurants nearby. cheap eats");
        List<ChatMessage> history = controller.history();
        assertThat(history).extracting(ChatMessage::sender)
                .containsExactly(Sender.ASSISTANT, Sender.USER, Sender.ASSISTANT);
        assertThat(history.get(1).text()).isEqualTo("cheap eats");
        ChatMessage reply = history.get(2);
        assertThat(reply.text()).isEqualTo(VENUE_REPLY);
        assertThat(reply.kind()).isEqualTo(MessageKind.RESTAURANT_LIST);
        assertThat(reply.entities()).extracting(r -> r.getCuisines().iterator().next())
                .containsExactly("Thai", "Mexican");
        assertThat(controller.displayedRestaurants()).isEqualTo(reply.entities());
        assertThat(controller.isProcessing()).isFalse();
        assertThat(dataStore.recentSearches()).containsExactly("cheap eats");
    }

    @Test
    void shouldAppendSingleFallbackOnTransientFailure() {
        controller.connect();
        api.thenReply("Ready").thenFail(new IllegalStateException("503 from upstream"));

        controller.submitUserText("sushi");
        executor.runAll();

        List<ChatMessage> replies = assistantMessages();
        assertThat(replies).hasSize(2);
        assertThat(replies.get(1).kind()).isEqualTo(MessageKind.ERROR);
        assertThat(replies.get(1).text()).isEqualTo(ConversationFailure.TRANSIENT.fallbackMessage());
        assertThat(controller.isProcessing()).isFalse();
    }

    @Test
    void shouldAppendSingleFallbackOnEmptyReply() {
        controller.connect();
        api.thenReply("Ready").thenReply("   ");

        controller.submitUserText("sushi");
        executor.runAll();

        List<ChatMessage> replies = assistantMessages();
        assertThat(replies).hasSize(2);
        assertThat(replies.get(1).text()).isEqualTo(ConversationFailure.EMPTY_OR_UNSAFE.fallbackMessage());
    }

    @Test
    void shouldRejectSecondQueryWhileFirstInFlight() {
        controller.connect();

        SubmitResult first = controller.submitUserText("pizza");
        SubmitResult second = controller.submitUserText("tacos");

        assertThat(first).isEqualTo(SubmitResult.ACCEPTED);
        assertThat(second).isEqualTo(SubmitResult.REJECTED_BUSY);
        assertThat(controller.isProcessing()).isTrue();

        executor.runAll();

        assertThat(controller.isProcessing()).isFalse();
        assertThat(controller.submitUserText("tacos")).isEqualTo(SubmitResult.ACCEPTED);
    }

    @Test
    void shouldRejectBlankText() {
        controller.connect();

        assertThat(controller.submitUserText("   ")).isEqualTo(SubmitResult.REJECTED_EMPTY);
        assertThat(controller.submitUserText(null)).isEqualTo(SubmitResult.REJECTED_EMPTY);
        assertThat(controller.history()).hasSize(1);
    }

    @Test
    void shouldDropReplyArrivingAfterDisconnect() {
        controller.connect();
        controller.submitUserText("pizza");

        controller.disconnect();
        executor.runAll();

        assertThat(controller.history()).extracting(ChatMessage::sender)
                .containsExactly(Sender.ASSISTANT, Sender.USER);
        assertThat(controller.state()).isEqualTo(ConnectionState.DISCONNECTED);
        assertThat(controller.isProcessing()).isFalse();
    }

    @Test
    void shouldIgnoreReplyForUnknownToken() {
        controller.connect();
        int before = controller.history().size();

        controller.onResponse(UUID.randomUUID(), new ConversationReply(UUID.randomUUID(), VENUE_REPLY), null);

        assertThat(controller.history()).hasSize(before);
    }

    @Test
    void shouldRequestLocationWhenPermissionBlocked() {
        locationPermission = FakePermissionProvider.denying();
        controller = newController();
        location.start();
        controller.connect();

        controller.submitUserText("burgers");

        assertThat(publisher.eventsOf(LocationPermissionRequestEvent.class)).hasSize(1);
        assertThat(controller.isLocationRequestPending()).isTrue();

        controller.acknowledgeLocationRequest();
        assertThat(controller.isLocationRequestPending()).isFalse();
    }

    @Test
    void shouldNotRequestLocationWhenPermissionUndecided() {
        controller.connect();

        controller.submitUserText("burgers");

        assertThat(publisher.eventsOf(LocationPermissionRequestEvent.class)).isEmpty();
        assertThat(controller.isLocationRequestPending()).isFalse();
    }

    @Test
    void shouldRecomputeDistancesOnLocationUpdate() {
        controller.connect();
        api.defaultReply = text -> VENUE_REPLY;
        controller.submitUserText("dinner");
        executor.runAll();
        assertThat(controller.displayedRestaurants()).allSatisfy(r -> assertThat(r.getDistanceMeters()).isNull());

        controller.onLocationUpdated(new LocationUpdatedEvent(LocationFix.of(40.7128, -74.0060, 10.0)));

        assertThat(controller.displayedRestaurants())
                .allSatisfy(r -> assertThat(r.getDistanceMeters()).isNotNull().isPositive());
    }

    @Test
    void shouldSaveRecomputedDistances() {
        controller.connect();
        api.defaultReply = text -> VENUE_REPLY;
        controller.submitUserText("dinner");
        executor.runAll();
        int savesBefore = store.saves;
        assertThat(store.json()).doesNotContain("distanceMeters");

        controller.onLocationUpdated(new LocationUpdatedEvent(LocationFix.of(40.7128, -74.0060, 10.0)));

        assertThat(store.saves).isEqualTo(savesBefore + 1);
        assertThat(store.json()).contains("distanceMeters");
    }

    @Test
    void shouldToggleFavoriteForKnownRestaurant() {
        controller.connect();
        api.defaultReply = text -> VENUE_REPLY;
        controller.submitUserText("dinner");
        executor.runAll();
        RestaurantRecord first = controller.displayedRestaurants().get(0);

        assertThat(controller.toggleFavorite(first.getId())).contains(true);
        assertThat(controller.favorites()).containsExactly(first);
        assertThat(controller.toggleFavorite(first.getId())).contains(false);
        assertThat(controller.favorites()).isEmpty();
        assertThat(controller.toggleFavorite("rest_missing")).isEmpty();
    }

    @Test
    void shouldSubmitFinalizedTranscript() {
        controller.connect();

        controller.onTranscriptFinalized(new TranscriptFinalizedEvent("ramen please", Instant.now()));

        assertThat(controller.history()).extracting(ChatMessage::text).contains("ramen please");
    }

    @Test
    void shouldClearHistoryButStayConnected() {
        controller.connect();

        controller.clearHistory();

        assertThat(controller.history()).isEmpty();
        assertThat(controller.state()).isEqualTo(ConnectionState.CONNECTED);
    }

    /** Holds submitted tasks until the test releases them. */
    private static final class HeldExecutor implements Executor {
        private final Deque<Runnable> pending = new ArrayDeque<>();

        @Override
        public void execute(Runnable command) {
            pending.add(command);
        }

        void runAll() {
            Runnable next;
            while ((next = pending.poll()) != null) {
                next.run();
            }
        }
    }
}

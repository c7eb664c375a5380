package com.phillippitts.platemate.service.conversation;

import com.phillippitts.platemate.exception.ConversationBusyException;
import com.phillippitts.platemate.exception.EmptyOrUnsafeResponseException;
import com.phillippitts.platemate.exception.TransientApiException;
import com.phillippitts.platemate.service.metrics.ConversationMetrics;
import com.phillippitts.platemate.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Wraps one remote chat session and enforces its protocol.
 *
 * <ul>
 *   <li>At most one request in flight; a second {@link #send} is rejected with
 *       {@link ConversationBusyException}, never queued or dropped.</li>
 *   <li>The system prompt is sent once per session, before the first user turn. The session counts
 *       as primed only after that exchange succeeds; a failed priming is retried on the next send.</li>
 *   <li>Replies and failures carry the session token valid at call time so callers can discard
 *       results that arrive after {@link #close()}.</li>
 * </ul>
 *
 * <p>API calls run on the {@code chatExecutor}.
 */
@Service
public class ConversationClient {

    private static final Logger LOG = LogManager.getLogger(ConversationClient.class);

    public static final String MDC_SESSION_TOKEN = "sessionToken";
    private static final String EXCHANGE_PRIMING = "priming";
    private static final String EXCHANGE_QUERY = "query";

    private final GenerativeChatApi api;
    private final Executor executor;
    private final ConversationMetrics metrics;

    private volatile ConversationSession session;

    public ConversationClient(GenerativeChatApi api,
                              @Qualifier("chatExecutor") Executor executor,
                              ConversationMetrics metrics) {
        this.api = Objects.requireNonNull(api, "api");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Opens a fresh session, replacing any previous one.
     *
     * @return token of the new session
     * @throws RuntimeException if the API refuses to open a session
     */
    public synchronized UUID startSession(ChatSessionConfig config) {
        ChatSessionHandle handle = api.startSession(Objects.requireNonNull(config, "config"));
        ConversationSession fresh = new ConversationSession(UUID.randomUUID(), handle);
        session = fresh;
        LOG.info("Chat session started: model={}, token={}", config.model(), fresh.token());
        return fresh.token();
    }

    /**
     * Sends a user turn, priming the session first if needed.
     *
     * @param text prompt to send
     * @return future completing with the reply, or exceptionally with {@link TransientApiException}
     *         or {@link EmptyOrUnsafeResponseException}
     * @throws ConversationBusyException if a request is already in flight
     * @throws IllegalStateException if no session is open
     */
    public CompletableFuture<ConversationReply> send(String text) {
        Objects.requireNonNull(text, "text");
        ConversationSession s = session;
        if (s == null) {
            throw new IllegalStateException("No chat session; call startSession first");
        }
        if (!s.tryBeginRequest()) {
            metrics.incrementRejectedBusy();
            throw new ConversationBusyException();
        }
        try {
            return CompletableFuture
                    .supplyAsync(() -> exchange(s, text), executor)
                    .whenComplete((reply, error) -> s.endRequest());
        } catch (RejectedExecutionException e) {
            s.endRequest();
            throw new TransientApiException("Chat executor rejected the request", s.token(), e);
        }
    }

    /** Whether {@code token} still identifies the open session. */
    public boolean isCurrent(UUID token) {
        ConversationSession s = session;
        return s != null && token != null && s.token().equals(token);
    }

    /** Invalidates the current token and drops the session. */
    public synchronized void close() {
        ConversationSession s = session;
        session = null;
        if (s != null) {
            LOG.info("Chat session closed: token={}", s.token());
        }
    }

    /** Token of the open session, empty when none is open. */
    public Optional<UUID> currentToken() {
        ConversationSession s = session;
        return s == null ? Optional.empty() : Optional.of(s.token());
    }

    public boolean hasSession() {
        return session != null;
    }

    public boolean isPrimed() {
        ConversationSession s = session;
        return s != null && s.isPrimed();
    }

    public boolean isInFlight() {
        ConversationSession s = session;
        return s != null && s.isInFlight();
    }

    private ConversationReply exchange(ConversationSession s, String text) {
        UUID token = s.token();
        ThreadContext.put(MDC_SESSION_TOKEN, token.toString());
        try {
            if (!s.isPrimed()) {
                prime(s);
            }
            LOG.debug("Sending query: '{}'", LogSanitizer.preview(text));
            String reply = call(s, text, EXCHANGE_QUERY);
            if (reply == null || reply.isBlank()) {
                metrics.incrementFailure(EXCHANGE_QUERY, ConversationFailure.EMPTY_OR_UNSAFE.tag());
                throw new EmptyOrUnsafeResponseException("Model returned no usable text", token);
            }
            metrics.incrementSuccess(EXCHANGE_QUERY);
            return new ConversationReply(token, reply);
        } finally {
            ThreadContext.remove(MDC_SESSION_TOKEN);
        }
    }

    private void prime(ConversationSession s) {
        LOG.debug("Priming chat session with system prompt");
        call(s, SystemPrompt.TEXT, EXCHANGE_PRIMING);
        s.markPrimed();
        metrics.incrementSuccess(EXCHANGE_PRIMING);
    }

    private String call(ConversationSession s, String text, String exchange) {
        long start = System.nanoTime();
        try {
            return api.sendMessage(s.handle(), text);
        } catch (RuntimeException e) {
            metrics.incrementFailure(exchange, ConversationFailure.TRANSIENT.tag());
            LOG.warn("Chat {} exchange failed: {}", exchange, e.getMessage());
            throw new TransientApiException("Chat " + exchange + " exchange failed: " + e.getMessage(), s.token(), e);
        } finally {
            metrics.recordLatency(exchange, System.nanoTime() - start);
        }
    }
}

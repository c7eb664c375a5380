package com.phillippitts.platemate.testutil;

import com.phillippitts.platemate.service.conversation.ChatSessionConfig;
import com.phillippitts.platemate.service.conversation.ChatSessionHandle;
import com.phillippitts.platemate.service.conversation.GenerativeChatApi;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Scripted GenerativeChatApi.
 *
 * <p>Each {@code sendMessage} consumes the next scripted step: a reply string, or a
 * RuntimeException which is thrown. With no script left, {@link #defaultReply} answers.
 * Every sent text is recorded in {@link #sent}.
 */
public class FakeGenerativeChatApi implements GenerativeChatApi {

    public final List<String> sent = new CopyOnWriteArrayList<>();
    public final List<ChatSessionConfig> sessionsStarted = new ArrayList<>();
    public Function<String, String> defaultReply = text -> "OK";
    public RuntimeException startFailure;

    private final Deque<Object> script = new ArrayDeque<>();

    public synchronized FakeGenerativeChatApi thenReply(String reply) {
        script.add(reply);
        return this;
    }

    public synchronized FakeGenerativeChatApi thenFail(RuntimeException error) {
        script.add(error);
        return this;
    }

    @Override
    public synchronized ChatSessionHandle startSession(ChatSessionConfig config) {
        if (startFailure != null) {
            throw startFailure;
        }
        sessionsStarted.add(config);
        return () -> config;
    }

    @Override
    public String sendMessage(ChatSessionHandle session, String text) {
        sent.add(text);
        Object step;
        synchronized (this) {
            step = script.poll();
        }
        if (step instanceof RuntimeException e) {
            throw e;
        }
        return step != null ? (String) step : defaultReply.apply(text);
    }
}

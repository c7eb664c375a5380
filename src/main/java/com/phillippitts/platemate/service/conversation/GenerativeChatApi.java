package com.phillippitts.platemate.service.conversation;

/**
 * Remote conversational model keeping multi-turn context per session.
 */
public interface GenerativeChatApi {

    /**
     * Opens a session with empty history.
     *
     * @throws IllegalStateException if the API is not usable (e.g. no credentials)
     */
    ChatSessionHandle startSession(ChatSessionConfig config);

    /**
     * Sends one user turn and returns the model's reply.
     *
     * @return reply text; empty when the model produced nothing usable (no candidates, safety block)
     * @throws RuntimeException on transport or service failure; the turn is not kept in history
     */
    String sendMessage(ChatSessionHandle session, String text);
}

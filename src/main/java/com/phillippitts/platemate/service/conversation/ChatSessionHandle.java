package com.phillippitts.platemate.service.conversation;

/**
 * Opaque multi-turn session obtained from {@link GenerativeChatApi#startSession}.
 */
public interface ChatSessionHandle {

    ChatSessionConfig config();
}

package com.phillippitts.platemate.service.conversation;

import java.util.UUID;

/**
 * Successful reply together with the session token that was current when the request was sent.
 */
public record ConversationReply(UUID sessionToken, String text) {
}

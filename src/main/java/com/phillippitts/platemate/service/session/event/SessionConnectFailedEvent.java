package com.phillippitts.platemate.service.session.event;

import java.time.Instant;

/**
 * Published when {@code connect()} could not open a chat session. Not retried automatically.
 *
 * @param reason failure description
 * @param at     when the attempt failed
 */
public record SessionConnectFailedEvent(String reason, Instant at) {
}

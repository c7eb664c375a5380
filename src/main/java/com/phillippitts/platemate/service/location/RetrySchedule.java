package com.phillippitts.platemate.service.location;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded exponential backoff state for location retries.
 *
 * <p>Immutable: {@link #advance()} returns the schedule after one more attempt. The delay doubles
 * after each attempt and never exceeds {@code cap}. With base 2s, cap 30s and 5 attempts the
 * delays are 2, 4, 8, 16, 30 seconds.
 *
 * @param attempt     attempts already fired
 * @param nextDelay   delay before the next attempt
 * @param maxAttempts attempt ceiling
 * @param cap         maximum single delay
 */
public record RetrySchedule(int attempt, Duration nextDelay, int maxAttempts, Duration cap) {

    public RetrySchedule {
        Objects.requireNonNull(nextDelay, "nextDelay");
        Objects.requireNonNull(cap, "cap");
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (nextDelay.isNegative() || cap.isNegative()) {
            throw new IllegalArgumentException("delays must not be negative");
        }
        if (nextDelay.compareTo(cap) > 0) {
            nextDelay = cap;
        }
    }

    public static RetrySchedule initial(Duration baseDelay, Duration cap, int maxAttempts) {
        return new RetrySchedule(0, baseDelay, maxAttempts, cap);
    }

    public boolean isExhausted() {
        return attempt >= maxAttempts;
    }

    public RetrySchedule advance() {
        Duration doubled = nextDelay.multipliedBy(2);
        return new RetrySchedule(attempt + 1, doubled.compareTo(cap) > 0 ? cap : doubled, maxAttempts, cap);
    }
}

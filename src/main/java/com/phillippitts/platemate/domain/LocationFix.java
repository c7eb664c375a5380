package com.phillippitts.platemate.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Timestamped location reading. Replaced wholesale on each update, never mutated.
 *
 * @param coordinate     reported position
 * @param accuracyMeters horizontal accuracy radius in meters (non-negative)
 * @param timestamp      when the reading was taken
 */
public record LocationFix(Coordinate coordinate, double accuracyMeters, Instant timestamp) {

    public LocationFix {
        Objects.requireNonNull(coordinate, "coordinate must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        if (accuracyMeters < 0.0) {
            throw new IllegalArgumentException("accuracyMeters must be >= 0, got: " + accuracyMeters);
        }
    }

    public static LocationFix of(double latitude, double longitude, double accuracyMeters) {
        return new LocationFix(new Coordinate(latitude, longitude), accuracyMeters, Instant.now());
    }
}

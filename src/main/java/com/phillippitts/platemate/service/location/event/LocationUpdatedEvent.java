package com.phillippitts.platemate.service.location.event;

import com.phillippitts.platemate.domain.LocationFix;

import java.util.Objects;

/**
 * Published on every new location fix.
 *
 * @param fix the fix that replaced the previous one
 */
public record LocationUpdatedEvent(LocationFix fix) {

    public LocationUpdatedEvent {
        Objects.requireNonNull(fix, "fix");
    }
}

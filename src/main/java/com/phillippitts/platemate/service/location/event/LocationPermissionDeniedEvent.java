package com.phillippitts.platemate.service.location.event;

import com.phillippitts.platemate.service.permission.PermissionStatus;

import java.time.Instant;

/**
 * Published once when location access is found denied or restricted. Location retries stop for good.
 *
 * @param status the blocking status
 * @param at     when it was observed
 */
public record LocationPermissionDeniedEvent(PermissionStatus status, Instant at) {
}

package com.phillippitts.platemate.service.session.event;

import java.time.Instant;

/**
 * Published when a query had to go out without coordinates because location access is denied.
 * Asks the presentation layer to prompt the user to enable location.
 */
public record LocationPermissionRequestEvent(Instant at) {
}

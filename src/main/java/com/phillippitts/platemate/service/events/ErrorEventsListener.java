package com.phillippitts.platemate.service.events;

import com.phillippitts.platemate.service.location.event.LocationPermissionDeniedEvent;
import com.phillippitts.platemate.service.session.event.LocationPermissionRequestEvent;
import com.phillippitts.platemate.service.session.event.SessionConnectFailedEvent;
import com.phillippitts.platemate.service.speech.event.CaptureErrorEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for user-facing error signals. Privacy-safe and throttled to avoid log spam.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final Clock clock;

    ErrorEventsListener(Clock clock) {
        this.clock = clock;
    }

    @EventListener
    void onLocationPermissionDenied(LocationPermissionDeniedEvent e) {
        if (shouldLog("location-permission")) {
            LOG.warn("Location permission {}. Queries will use generic 'nearby' phrasing; "
                    + "set location.permission-granted=true to enable location.", e.status());
        }
    }

    @EventListener
    void onLocationPermissionRequest(LocationPermissionRequestEvent e) {
        if (shouldLog("location-request")) {
            LOG.info("Query sent without coordinates; user should enable location access");
        }
    }

    @EventListener
    void onCaptureError(CaptureErrorEvent e) {
        String key = "capture-" + e.reason();
        if (shouldLog(key)) {
            LOG.warn("Capture error: reason={}. Check microphone device, permissions and speech model.", e.reason());
        }
    }

    @EventListener
    void onConnectFailed(SessionConnectFailedEvent e) {
        if (shouldLog("connect-failed")) {
            LOG.warn("Could not connect to the assistant: {}", e.reason());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}

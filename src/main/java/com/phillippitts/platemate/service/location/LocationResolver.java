package com.phillippitts.platemate.service.location;

import com.phillippitts.platemate.config.properties.LocationProperties;
import com.phillippitts.platemate.domain.Coordinate;
import com.phillippitts.platemate.domain.LocationFix;
import com.phillippitts.platemate.service.location.event.LocationPermissionDeniedEvent;
import com.phillippitts.platemate.service.location.event.LocationUpdatedEvent;
import com.phillippitts.platemate.service.permission.PermissionProvider;
import com.phillippitts.platemate.service.permission.PermissionStatus;
import com.phillippitts.platemate.util.GeoDistance;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Acquires and maintains the current location fix.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>asks for location permission and starts updates once authorized</li>
 *   <li>retries with bounded exponential backoff while no fix exists</li>
 *   <li>publishes {@link LocationUpdatedEvent} for every fix</li>
 *   <li>keeps a human-readable place name from reverse geocoding, one lookup at a time</li>
 * </ul>
 *
 * <p>Retrying stops for good on the first fix, when attempts run out, or when permission is
 * denied or restricted. A denial is signalled once through {@link LocationPermissionDeniedEvent}.
 */
@Service
public class LocationResolver {

    private static final Logger LOG = LogManager.getLogger(LocationResolver.class);

    private final LocationProperties props;
    private final PermissionProvider permission;
    private final LocationProvider locationProvider;
    private final ReverseGeocodeProvider geocoder;
    private final DelayScheduler scheduler;
    private final ApplicationEventPublisher publisher;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean updatesStarted = new AtomicBoolean(false);
    private final AtomicBoolean geocodePending = new AtomicBoolean(false);
    private final AtomicBoolean denialSignalled = new AtomicBoolean(false);

    private volatile LocationFix currentFix;
    private volatile String placeName;

    private final Object retryLock = new Object();
    // @GuardedBy("retryLock")
    private RetrySchedule retrySchedule;
    // @GuardedBy("retryLock")
    private DelayScheduler.Handle pendingRetry;
    // @GuardedBy("retryLock")
    private boolean retryHalted;

    public LocationResolver(LocationProperties props,
                            @Qualifier("locationPermission") PermissionProvider permission,
                            LocationProvider locationProvider,
                            ReverseGeocodeProvider geocoder,
                            DelayScheduler scheduler,
                            ApplicationEventPublisher publisher) {
        this.props = Objects.requireNonNull(props, "props");
        this.permission = Objects.requireNonNull(permission, "permission");
        this.locationProvider = Objects.requireNonNull(locationProvider, "locationProvider");
        this.geocoder = Objects.requireNonNull(geocoder, "geocoder");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.placeName = props.getDefaultPlaceName();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        start();
    }

    /**
     * Subscribes to providers, requests permission and arms the retry schedule.
     * Subsequent calls are no-ops.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        permission.addListener(this::onPermissionChanged);
        locationProvider.addListener(this::onFix);

        PermissionStatus before = permission.currentStatus();
        PermissionStatus after = requestPermission();
        if (before == after) {
            // Already decided before we subscribed: no transition will be delivered
            onPermissionChanged(after);
        }
        scheduleNextRetry();
    }

    /** Idempotent request for location access. */
    public PermissionStatus requestPermission() {
        return permission.requestPermission();
    }

    @PreDestroy
    public void stop() {
        haltRetries("shutdown");
        if (updatesStarted.compareAndSet(true, false)) {
            locationProvider.stopUpdates();
        }
    }

    /** Great-circle distance from the current fix, empty when there is none. */
    public OptionalDouble distanceTo(Coordinate coordinate) {
        LocationFix fix = currentFix;
        if (fix == null || coordinate == null) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(GeoDistance.meters(fix.coordinate(), coordinate));
    }

    public Optional<LocationFix> currentFix() {
        return Optional.ofNullable(currentFix);
    }

    public boolean isLocationAvailable() {
        return currentFix != null;
    }

    public PermissionStatus permissionStatus() {
        return permission.currentStatus();
    }

    public String placeName() {
        return placeName;
    }

    /** Active retry schedule; empty once retrying has stopped or before it has begun. */
    public Optional<RetrySchedule> retrySchedule() {
        synchronized (retryLock) {
            return Optional.ofNullable(retrySchedule);
        }
    }

    void onPermissionChanged(PermissionStatus status) {
        if (status.isAuthorized()) {
            issueRequests();
        } else if (status.isBlocked()) {
            haltRetries("permission " + status);
            signalDenied(status);
        }
    }

    void onFix(LocationFix fix) {
        currentFix = fix;
        haltRetries("fix obtained");
        LOG.debug("Location fix: {}, {} (±{} m)",
                fix.coordinate().latitude(), fix.coordinate().longitude(), fix.accuracyMeters());
        publisher.publishEvent(new LocationUpdatedEvent(fix));
        lookupPlaceName(fix.coordinate());
    }

    private void issueRequests() {
        if (updatesStarted.compareAndSet(false, true)) {
            locationProvider.startUpdates();
        }
        locationProvider.requestOnce();
    }

    private void lookupPlaceName(Coordinate coordinate) {
        if (!geocodePending.compareAndSet(false, true)) {
            LOG.debug("Reverse geocode already pending; skipping");
            return;
        }
        try {
            geocoder.resolve(coordinate).whenComplete((placemark, error) -> {
                try {
                    if (error != null) {
                        LOG.debug("Reverse geocode failed: {}", error.getMessage());
                    } else if (placemark != null) {
                        placeName = placemark.displayName().orElse(props.getDefaultPlaceName());
                    }
                } finally {
                    geocodePending.set(false);
                }
            });
        } catch (RuntimeException e) {
            geocodePending.set(false);
            LOG.debug("Reverse geocode could not start: {}", e.getMessage());
        }
    }

    private void scheduleNextRetry() {
        synchronized (retryLock) {
            if (retryHalted || currentFix != null) {
                return;
            }
            if (retrySchedule == null) {
                LocationProperties.Retry cfg = props.getRetry();
                retrySchedule = RetrySchedule.initial(cfg.getBaseDelay(), cfg.getMaxDelay(), cfg.getMaxAttempts());
            }
            if (retrySchedule.isExhausted()) {
                LOG.info("Location unavailable after {} attempts; giving up", retrySchedule.attempt());
                retrySchedule = null;
                retryHalted = true;
                return;
            }
            LOG.debug("Location retry {} in {}", retrySchedule.attempt() + 1, retrySchedule.nextDelay());
            pendingRetry = scheduler.schedule(this::onRetryDue, retrySchedule.nextDelay());
        }
    }

    private void onRetryDue() {
        synchronized (retryLock) {
            pendingRetry = null;
            if (retryHalted || retrySchedule == null) {
                return;
            }
            if (currentFix != null) {
                haltRetries("fix obtained");
                return;
            }
            retrySchedule = retrySchedule.advance();
        }

        PermissionStatus status = permission.currentStatus();
        if (status.isAuthorized()) {
            issueRequests();
        } else if (status == PermissionStatus.NOT_DETERMINED) {
            requestPermission();
        } else {
            haltRetries("permission " + status);
            signalDenied(status);
            return;
        }
        scheduleNextRetry();
    }

    private void haltRetries(String reason) {
        synchronized (retryLock) {
            if (retryHalted) {
                return;
            }
            retryHalted = true;
            retrySchedule = null;
            if (pendingRetry != null) {
                pendingRetry.cancel();
                pendingRetry = null;
            }
            LOG.debug("Location retries halted: {}", reason);
        }
    }

    private void signalDenied(PermissionStatus status) {
        if (denialSignalled.compareAndSet(false, true)) {
            LOG.info("Location permission {}; location features disabled", status);
            publisher.publishEvent(new LocationPermissionDeniedEvent(status, Instant.now()));
        }
    }
}

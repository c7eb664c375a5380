package com.phillippitts.platemate.service.location.impl;

import com.phillippitts.platemate.domain.LocationFix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

/**
 * Coarse location from an IP geolocation service returning {@code {"status","lat","lon"}}
 * (ip-api.com format).
 *
 * <p>Lookups run on the location scheduler: once per {@link #requestOnce()} and periodically
 * while updates are started. A failed lookup is logged and delivers nothing.
 */
public class IpGeolocationLocationProvider extends AbstractLocationProvider {

    private static final Logger LOG = LogManager.getLogger(IpGeolocationLocationProvider.class);

    /** City-level accuracy typical of IP geolocation. */
    static final double IP_ACCURACY_METERS = 5_000.0;

    private final RestClient restClient;
    private final String lookupUrl;
    private final TaskScheduler scheduler;
    private final Duration updateInterval;

    private final Object lock = new Object();
    // @GuardedBy("lock")
    private ScheduledFuture<?> periodic;

    public IpGeolocationLocationProvider(RestClient restClient,
                                         String lookupUrl,
                                         TaskScheduler scheduler,
                                         Duration updateInterval) {
        this.restClient = Objects.requireNonNull(restClient, "restClient");
        this.lookupUrl = Objects.requireNonNull(lookupUrl, "lookupUrl");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.updateInterval = Objects.requireNonNull(updateInterval, "updateInterval");
    }

    @Override
    public void startUpdates() {
        synchronized (lock) {
            if (periodic != null) {
                return;
            }
            periodic = scheduler.scheduleAtFixedRate(this::lookupAndDeliver, updateInterval);
            LOG.info("IP geolocation updates every {}", updateInterval);
        }
    }

    @Override
    public void requestOnce() {
        scheduler.schedule(this::lookupAndDeliver, Instant.now());
    }

    @Override
    public void stopUpdates() {
        synchronized (lock) {
            if (periodic != null) {
                periodic.cancel(false);
                periodic = null;
            }
        }
    }

    private void lookupAndDeliver() {
        lookup().ifPresent(this::deliver);
    }

    Optional<LocationFix> lookup() {
        try {
            String body = restClient.get().uri(lookupUrl).retrieve().body(String.class);
            return parse(body);
        } catch (RestClientException e) {
            LOG.warn("IP geolocation lookup failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    static Optional<LocationFix> parse(String body) {
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        try {
            JSONObject json = new JSONObject(body);
            String status = json.optString("status", "success");
            if (!"success".equalsIgnoreCase(status) || !json.has("lat") || !json.has("lon")) {
                LOG.warn("IP geolocation returned no position (status={}, message={})",
                        status, json.optString("message", ""));
                return Optional.empty();
            }
            return Optional.of(LocationFix.of(json.getDouble("lat"), json.getDouble("lon"), IP_ACCURACY_METERS));
        } catch (JSONException | IllegalArgumentException e) {
            LOG.warn("Unparseable IP geolocation response: {}", e.getMessage());
            return Optional.empty();
        }
    }
}

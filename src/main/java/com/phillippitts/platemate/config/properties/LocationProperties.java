package com.phillippitts.platemate.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for location acquisition (prefix {@code location}).
 */
@ConfigurationProperties(prefix = "location")
@Validated
public class LocationProperties {

    public enum Provider { IP, STATIC }

    /** Which LocationProvider implementation to wire. */
    @NotNull
    private Provider provider = Provider.IP;

    /** Coordinate reported by the static provider. */
    private double staticLatitude = 37.7749;
    private double staticLongitude = -122.4194;

    /** IP geolocation endpoint returning {@code lat}/{@code lon} JSON. */
    @NotBlank
    private String ipLookupUrl = "http://ip-api.com/json";

    /** Period of continuous updates once started. */
    @NotNull
    private Duration updateInterval = Duration.ofMinutes(5);

    /** Nominatim-compatible reverse geocoding endpoint. */
    @NotBlank
    private String reverseGeocodeUrl = "https://nominatim.openstreetmap.org/reverse";

    /** User-Agent sent to public geo services (Nominatim usage policy requires one). */
    @NotBlank
    private String userAgent = "platemate/0.1";

    /** Place name shown until (or unless) reverse geocoding resolves one. */
    @NotBlank
    private String defaultPlaceName = "Current Location";

    /** Answer given by the configured permission provider when asked for location access. */
    private boolean permissionGranted = true;

    @Valid
    private Retry retry = new Retry();

    public Provider getProvider() {
        return provider;
    }

    public void setProvider(Provider provider) {
        this.provider = provider;
    }

    public double getStaticLatitude() {
        return staticLatitude;
    }

    public void setStaticLatitude(double staticLatitude) {
        this.staticLatitude = staticLatitude;
    }

    public double getStaticLongitude() {
        return staticLongitude;
    }

    public void setStaticLongitude(double staticLongitude) {
        this.staticLongitude = staticLongitude;
    }

    public String getIpLookupUrl() {
        return ipLookupUrl;
    }

    public void setIpLookupUrl(String ipLookupUrl) {
        this.ipLookupUrl = ipLookupUrl;
    }

    public Duration getUpdateInterval() {
        return updateInterval;
    }

    public void setUpdateInterval(Duration updateInterval) {
        this.updateInterval = updateInterval;
    }

    public String getReverseGeocodeUrl() {
        return reverseGeocodeUrl;
    }

    public void setReverseGeocodeUrl(String reverseGeocodeUrl) {
        this.reverseGeocodeUrl = reverseGeocodeUrl;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public String getDefaultPlaceName() {
        return defaultPlaceName;
    }

    public void setDefaultPlaceName(String defaultPlaceName) {
        this.defaultPlaceName = defaultPlaceName;
    }

    public boolean isPermissionGranted() {
        return permissionGranted;
    }

    public void setPermissionGranted(boolean permissionGranted) {
        this.permissionGranted = permissionGranted;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    /**
     * Bounded exponential backoff used while no fix is available.
     */
    public static class Retry {

        /** First retry delay; doubled after each attempt. */
        @NotNull
        private Duration baseDelay = Duration.ofSeconds(2);

        /** Upper bound for any single delay. */
        @NotNull
        private Duration maxDelay = Duration.ofSeconds(30);

        /** Attempt ceiling. */
        @Min(1)
        private int maxAttempts = 5;

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }
    }
}

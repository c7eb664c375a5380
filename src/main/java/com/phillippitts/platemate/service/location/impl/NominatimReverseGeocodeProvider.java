package com.phillippitts.platemate.service.location.impl;

import com.phillippitts.platemate.domain.Coordinate;
import com.phillippitts.platemate.exception.GeocodeException;
import com.phillippitts.platemate.service.location.Placemark;
import com.phillippitts.platemate.service.location.ReverseGeocodeProvider;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Reverse geocoding against an OpenStreetMap Nominatim {@code /reverse} endpoint.
 *
 * <p>Sub-locality is taken from {@code suburb}, {@code neighbourhood} or {@code quarter}; locality
 * from {@code city}, {@code town} or {@code village}.
 */
public class NominatimReverseGeocodeProvider implements ReverseGeocodeProvider {

    private static final String[] SUB_LOCALITY_KEYS = {"suburb", "neighbourhood", "quarter"};
    private static final String[] LOCALITY_KEYS = {"city", "town", "village"};

    private final RestClient restClient;
    private final String reverseUrl;
    private final Executor executor;

    public NominatimReverseGeocodeProvider(RestClient restClient, String reverseUrl, Executor executor) {
        this.restClient = Objects.requireNonNull(restClient, "restClient");
        this.reverseUrl = Objects.requireNonNull(reverseUrl, "reverseUrl");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public CompletableFuture<Placemark> resolve(Coordinate coordinate) {
        return CompletableFuture.supplyAsync(() -> lookup(coordinate), executor);
    }

    private Placemark lookup(Coordinate coordinate) {
        String uri = String.format(Locale.ROOT, "%s?format=jsonv2&zoom=14&lat=%.6f&lon=%.6f",
                reverseUrl, coordinate.latitude(), coordinate.longitude());
        try {
            String body = restClient.get().uri(uri).retrieve().body(String.class);
            return parse(body);
        } catch (RestClientException e) {
            throw new GeocodeException("Reverse geocode request failed: " + e.getMessage(), e);
        }
    }

    static Placemark parse(String body) {
        if (body == null || body.isBlank()) {
            throw new GeocodeException("Empty reverse geocode response");
        }
        try {
            JSONObject json = new JSONObject(body);
            if (json.has("error")) {
                throw new GeocodeException("Reverse geocode error: " + json.optString("error"));
            }
            JSONObject address = json.optJSONObject("address");
            if (address == null) {
                return new Placemark(null, null);
            }
            return new Placemark(firstOf(address, SUB_LOCALITY_KEYS), firstOf(address, LOCALITY_KEYS));
        } catch (JSONException e) {
            throw new GeocodeException("Unparseable reverse geocode response", e);
        }
    }

    private static String firstOf(JSONObject address, String[] keys) {
        for (String key : keys) {
            String v = address.optString(key, "");
            if (!v.isBlank()) {
                return v;
            }
        }
        return null;
    }
}

package com.phillippitts.platemate.service.persistence;

import com.phillippitts.platemate.domain.ChatMessage;
import com.phillippitts.platemate.domain.Coordinate;
import com.phillippitts.platemate.domain.MessageKind;
import com.phillippitts.platemate.domain.RestaurantRecord;
import com.phillippitts.platemate.domain.Sender;
import com.phillippitts.platemate.domain.UserPreferences;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * JSON (UTF-8) encoding of {@link AssistantState}.
 *
 * <p>Thread-safe: all methods are static and stateless.
 */
final class AssistantStateCodec {

    static final int FORMAT_VERSION = 1;

    private AssistantStateCodec() {
        // Utility class - prevent instantiation
    }

    static byte[] encode(AssistantState state) {
        JSONArray history = new JSONArray();
        state.history().forEach(m -> history.put(encodeMessage(m)));
        JSONArray favorites = new JSONArray();
        state.favorites().forEach(r -> favorites.put(encodeRestaurant(r)));

        JSONObject root = new JSONObject()
                .put("version", FORMAT_VERSION)
                .put("chatHistory", history)
                .put("userPreferences", encodePreferences(state.preferences()))
                .put("favoriteRestaurants", favorites)
                .put("recentSearches", new JSONArray(state.recentSearches()));
        return root.toString().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * @throws JSONException if the bytes are not a valid state document
     * @throws IllegalArgumentException if a value violates a domain constraint
     */
    static AssistantState decode(byte[] bytes) {
        JSONObject root = new JSONObject(new String(bytes, StandardCharsets.UTF_8));

        List<ChatMessage> history = new ArrayList<>();
        JSONArray messages = root.optJSONArray("chatHistory");
        if (messages != null) {
            for (int i = 0; i < messages.length(); i++) {
                history.add(decodeMessage(messages.getJSONObject(i)));
            }
        }

        JSONObject prefsJson = root.optJSONObject("userPreferences");
        UserPreferences prefs = prefsJson == null ? UserPreferences.defaults() : decodePreferences(prefsJson);

        List<RestaurantRecord> favorites = new ArrayList<>();
        JSONArray favs = root.optJSONArray("favoriteRestaurants");
        if (favs != null) {
            for (int i = 0; i < favs.length(); i++) {
                favorites.add(decodeRestaurant(favs.getJSONObject(i)));
            }
        }

        return new AssistantState(history, prefs, favorites, strings(root.optJSONArray("recentSearches")));
    }

    private static JSONObject encodeMessage(ChatMessage m) {
        JSONArray entities = new JSONArray();
        m.entities().forEach(r -> entities.put(encodeRestaurant(r)));
        return new JSONObject()
                .put("id", m.id().toString())
                .put("text", m.text())
                .put("sender", m.sender().name())
                .put("timestamp", m.timestamp().toString())
                .put("kind", m.kind().name())
                .put("entities", entities);
    }

    private static ChatMessage decodeMessage(JSONObject json) {
        List<RestaurantRecord> entities = new ArrayList<>();
        JSONArray arr = json.optJSONArray("entities");
        if (arr != null) {
            for (int i = 0; i < arr.length(); i++) {
                entities.add(decodeRestaurant(arr.getJSONObject(i)));
            }
        }
        return new ChatMessage(
                UUID.fromString(json.getString("id")),
                json.getString("text"),
                Sender.valueOf(json.getString("sender")),
                Instant.parse(json.getString("timestamp")),
                MessageKind.valueOf(json.getString("kind")),
                entities);
    }

    private static JSONObject encodeRestaurant(RestaurantRecord r) {
        JSONObject json = new JSONObject()
                .put("id", r.getId())
                .put("name", r.getName())
                .put("address", r.getAddress())
                .put("rating", r.getRating())
                .put("priceLevel", r.getPriceLevel())
                .put("cuisines", new JSONArray(r.getCuisines()))
                .put("latitude", r.getCoordinates().latitude())
                .put("longitude", r.getCoordinates().longitude());
        // put(key, null) drops the key, which is how absent optionals are stored
        json.put("phone", r.getPhone());
        json.put("website", r.getWebsite());
        json.put("description", r.getDescription());
        json.put("distanceMeters", r.getDistanceMeters());
        if (r.getHours() != null) {
            json.put("hours", new JSONArray(r.getHours()));
        }
        return json;
    }

    private static RestaurantRecord decodeRestaurant(JSONObject json) {
        Set<String> cuisines = new LinkedHashSet<>(strings(json.optJSONArray("cuisines")));
        JSONArray hours = json.optJSONArray("hours");
        return new RestaurantRecord(
                json.getString("id"),
                json.getString("name"),
                json.getString("address"),
                optString(json, "phone"),
                optString(json, "website"),
                json.getDouble("rating"),
                json.getInt("priceLevel"),
                cuisines,
                new Coordinate(json.getDouble("latitude"), json.getDouble("longitude")),
                hours == null ? null : strings(hours),
                optString(json, "description"),
                json.has("distanceMeters") ? json.getDouble("distanceMeters") : null);
    }

    private static JSONObject encodePreferences(UserPreferences p) {
        JSONObject json = new JSONObject()
                .put("favoriteRestaurants", new JSONArray(p.favoriteRestaurantIds()))
                .put("dietaryPreferences", new JSONArray(p.dietaryPreferences()))
                .put("cuisinePreferences", new JSONArray(p.cuisinePreferences()))
                .put("sortPreference", p.sortPreference().name());
        json.put("pricePreference", p.pricePreference());
        json.put("distancePreference", p.distancePreference());
        return json;
    }

    private static UserPreferences decodePreferences(JSONObject json) {
        return new UserPreferences(
                strings(json.optJSONArray("favoriteRestaurants")),
                strings(json.optJSONArray("dietaryPreferences")),
                json.has("pricePreference") ? json.getInt("pricePreference") : null,
                strings(json.optJSONArray("cuisinePreferences")),
                json.has("distancePreference") ? json.getDouble("distancePreference") : null,
                UserPreferences.SortOption.valueOf(json.optString("sortPreference", "DISTANCE")));
    }

    private static List<String> strings(JSONArray arr) {
        List<String> out = new ArrayList<>();
        if (arr != null) {
            for (int i = 0; i < arr.length(); i++) {
                out.add(arr.getString(i));
            }
        }
        return out;
    }

    private static String optString(JSONObject json, String key) {
        return json.has(key) ? json.getString(key) : null;
    }
}

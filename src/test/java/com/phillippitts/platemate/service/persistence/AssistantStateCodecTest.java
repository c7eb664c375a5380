package com.phillippitts.platemate.service.persistence;

import com.phillippitts.platemate.domain.ChatMessage;
import com.phillippitts.platemate.domain.Coordinate;
import com.phillippitts.platemate.domain.MessageKind;
import com.phillippitts.platemate.domain.RestaurantRecord;
import com.phillippitts.platemate.domain.Sender;
import com.phillippitts.platemate.domain.UserPreferences;
import org.json.JSONException;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AssistantStateCodecTest {

    private static RestaurantRecord sushi() {
        return new RestaurantRecord("r-1", "Sushi Place", "1 Main St", "555-0100", null,
                4.5, 3, Set.of("Japanese"), new Coordinate(37.77, -122.41),
                List.of("Mon-Fri 11-22"), "Omakase", 420.0);
    }

    private static RestaurantRecord taqueria() {
        return new RestaurantRecord("r-2", "Taqueria", "2 Side St", null, null,
                3.9, 1, Set.of("Mexican"), new Coordinate(37.76, -122.42), null, null, null);
    }

    @Test
    void shouldWriteDocumentedKeys() {
        AssistantState state = new AssistantState(
                List.of(ChatMessage.user("sushi nearby")),
                UserPreferences.defaults(),
                List.of(sushi()),
                List.of("sushi nearby"));

        JSONObject json = new JSONObject(new String(AssistantStateCodec.encode(state), StandardCharsets.UTF_8));

        assertThat(json.getInt("version")).isEqualTo(AssistantStateCodec.FORMAT_VERSION);
        assertThat(json.has("chatHistory")).isTrue();
        assertThat(json.has("userPreferences")).isTrue();
        assertThat(json.has("favoriteRestaurants")).isTrue();
        assertThat(json.getJSONArray("recentSearches").getString(0)).isEqualTo("sushi nearby");
        assertThat(json.getJSONObject("userPreferences").getString("sortPreference")).isEqualTo("DISTANCE");
    }

    @Test
    void shouldPreserveMessagesAndEntities() {
        ChatMessage reply = ChatMessage.assistant("Try these", List.of(sushi(), taqueria()));
        AssistantState state = new AssistantState(List.of(ChatMessage.user("food"), reply),
                UserPreferences.defaults(), List.of(), List.of());

        AssistantState decoded = AssistantStateCodec.decode(AssistantStateCodec.encode(state));

        assertThat(decoded.history()).hasSize(2);
        ChatMessage restored = decoded.history().get(1);
        assertThat(restored.id()).isEqualTo(reply.id());
        assertThat(restored.timestamp()).isEqualTo(reply.timestamp());
        assertThat(restored.sender()).isEqualTo(Sender.ASSISTANT);
        assertThat(restored.kind()).isEqualTo(MessageKind.RESTAURANT_LIST);
        assertThat(restored.entities()).extracting(RestaurantRecord::getName)
                .containsExactly("Sushi Place", "Taqueria");
    }

    @Test
    void shouldKeepAbsentOptionalFieldsAbsent() {
        AssistantState state = new AssistantState(List.of(), UserPreferences.defaults(),
                List.of(taqueria(), sushi()), List.of());

        List<RestaurantRecord> favorites = AssistantStateCodec.decode(AssistantStateCodec.encode(state)).favorites();

        RestaurantRecord plain = favorites.get(0);
        assertThat(plain.getPhone()).isNull();
        assertThat(plain.getHours()).isNull();
        assertThat(plain.getDistanceMeters()).isNull();

        RestaurantRecord full = favorites.get(1);
        assertThat(full.getPhone()).isEqualTo("555-0100");
        assertThat(full.getWebsite()).isNull();
        assertThat(full.getHours()).containsExactly("Mon-Fri 11-22");
        assertThat(full.getDistanceMeters()).isEqualTo(420.0);
        assertThat(full.getCuisines()).containsExactly("Japanese");
        assertThat(full.getCoordinates()).isEqualTo(new Coordinate(37.77, -122.41));
    }

    @Test
    void shouldPreservePreferences() {
        UserPreferences prefs = new UserPreferences(List.of("r-1"), List.of("Vegetarian"), 2,
                List.of("Thai"), null, UserPreferences.SortOption.RATING);
        AssistantState state = new AssistantState(List.of(), prefs, List.of(), List.of());

        UserPreferences decoded = AssistantStateCodec.decode(AssistantStateCodec.encode(state)).preferences();

        assertThat(decoded).isEqualTo(prefs);
    }

    @Test
    void shouldTreatMissingSectionsAsEmpty() {
        AssistantState decoded = AssistantStateCodec.decode("{\"version\":1}".getBytes(StandardCharsets.UTF_8));

        assertThat(decoded.history()).isEmpty();
        assertThat(decoded.favorites()).isEmpty();
        assertThat(decoded.recentSearches()).isEmpty();
        assertThat(decoded.preferences()).isEqualTo(UserPreferences.defaults());
    }

    @Test
    void shouldRejectMalformedDocument() {
        assertThatThrownBy(() -> AssistantStateCodec.decode("not json".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(JSONException.class);
    }
}

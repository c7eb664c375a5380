package com.phillippitts.platemate.service.persistence;

import com.phillippitts.platemate.config.properties.PersistenceProperties;
import com.phillippitts.platemate.domain.ChatMessage;
import com.phillippitts.platemate.domain.RestaurantRecord;
import com.phillippitts.platemate.domain.UserPreferences;
import com.phillippitts.platemate.exception.PersistenceException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Write-through store of chat history, preferences, favorites and recent searches.
 *
 * <p>State is loaded once at construction (keeping only the newest {@code persistence.max-history}
 * messages) and saved after every mutation. Storage failures are logged and never propagate:
 * losing persistence must not break the conversation.
 *
 * <p>Thread-safe: all access is synchronized on this instance.
 */
@Component
public class AssistantDataStore {

    private static final Logger LOG = LogManager.getLogger(AssistantDataStore.class);

    private final PersistenceStore store;
    private final int maxRecentSearches;

    private final List<ChatMessage> history = new ArrayList<>();
    private final List<RestaurantRecord> favorites = new ArrayList<>();
    private final List<String> recentSearches = new ArrayList<>();
    private UserPreferences preferences = UserPreferences.defaults();

    public AssistantDataStore(PersistenceStore store, PersistenceProperties props) {
        this.store = Objects.requireNonNull(store, "store");
        this.maxRecentSearches = props.maxRecentSearches();
        load(props.maxHistory());
    }

    public synchronized List<ChatMessage> history() {
        return List.copyOf(history);
    }

    public synchronized void addMessage(ChatMessage message) {
        history.add(Objects.requireNonNull(message, "message"));
        save();
    }

    public synchronized void clearChatHistory() {
        history.clear();
        save();
    }

    public synchronized UserPreferences preferences() {
        return preferences;
    }

    public synchronized void updatePreferences(UserPreferences updated) {
        // Favorites are owned by toggleFavorite; keep them consistent with the favorites list
        this.preferences = Objects.requireNonNull(updated, "updated")
                .withFavoriteRestaurantIds(preferences.favoriteRestaurantIds());
        save();
    }

    public synchronized List<RestaurantRecord> favorites() {
        return List.copyOf(favorites);
    }

    public synchronized boolean isFavorite(String restaurantId) {
        return favorites.stream().anyMatch(r -> r.getId().equals(restaurantId));
    }

    /**
     * Adds the restaurant to favorites, or removes it if already there.
     *
     * @return {@code true} if the restaurant is a favorite afterwards
     */
    public synchronized boolean toggleFavorite(RestaurantRecord restaurant) {
        Objects.requireNonNull(restaurant, "restaurant");
        List<String> ids = new ArrayList<>(preferences.favoriteRestaurantIds());
        boolean nowFavorite;
        if (favorites.removeIf(r -> r.getId().equals(restaurant.getId()))) {
            ids.remove(restaurant.getId());
            nowFavorite = false;
        } else {
            favorites.add(restaurant);
            ids.add(restaurant.getId());
            nowFavorite = true;
        }
        preferences = preferences.withFavoriteRestaurantIds(ids);
        save();
        return nowFavorite;
    }

    public synchronized Optional<RestaurantRecord> favorite(String restaurantId) {
        return favorites.stream().filter(r -> r.getId().equals(restaurantId)).findFirst();
    }

    /** Recent queries, newest first. */
    public synchronized List<String> recentSearches() {
        return List.copyOf(recentSearches);
    }

    /** Moves {@code query} to the front, dropping duplicates and anything past the cap. */
    public synchronized void addRecentSearch(String query) {
        if (query == null || query.isBlank()) {
            return;
        }
        recentSearches.remove(query);
        recentSearches.add(0, query);
        while (recentSearches.size() > maxRecentSearches) {
            recentSearches.remove(recentSearches.size() - 1);
        }
        save();
    }

    /** Saves after restaurants held by this store were changed in place, such as recomputed distances. */
    public synchronized void restaurantsUpdated() {
        save();
    }

    private void load(int maxHistory) {
        Optional<byte[]> bytes;
        try {
            bytes = store.loadState();
        } catch (PersistenceException e) {
            LOG.warn("Could not load assistant state; starting empty: {}", e.getMessage());
            return;
        }
        if (bytes.isEmpty()) {
            LOG.info("No saved assistant state; starting empty");
            return;
        }
        AssistantState state;
        try {
            state = AssistantStateCodec.decode(bytes.get());
        } catch (JSONException | IllegalArgumentException e) {
            LOG.warn("Saved assistant state is unreadable; starting empty: {}", e.getMessage());
            return;
        }
        List<ChatMessage> saved = state.history();
        int from = Math.max(0, saved.size() - maxHistory);
        history.addAll(saved.subList(from, saved.size()));
        favorites.addAll(state.favorites());
        recentSearches.addAll(state.recentSearches().subList(0, Math.min(maxRecentSearches, state.recentSearches().size())));
        preferences = state.preferences();
        LOG.info("Loaded assistant state: {} messages ({} dropped), {} favorites, {} recent searches",
                history.size(), from, favorites.size(), recentSearches.size());
    }

    private void save() {
        AssistantState snapshot = new AssistantState(history, preferences, favorites, recentSearches);
        try {
            store.saveState(AssistantStateCodec.encode(snapshot));
        } catch (PersistenceException e) {
            LOG.warn("Could not save assistant state: {}", e.getMessage());
        }
    }
}

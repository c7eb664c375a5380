package com.phillippitts.platemate.service.persistence;

import com.phillippitts.platemate.domain.ChatMessage;
import com.phillippitts.platemate.domain.RestaurantRecord;
import com.phillippitts.platemate.domain.UserPreferences;

import java.util.List;

/**
 * Everything that survives a restart.
 *
 * @param history            chat history, oldest first
 * @param preferences        user preferences
 * @param favorites          favorite restaurants, in the order they were added
 * @param recentSearches     recent queries, newest first
 */
public record AssistantState(List<ChatMessage> history,
                             UserPreferences preferences,
                             List<RestaurantRecord> favorites,
                             List<String> recentSearches) {

    public AssistantState {
        history = history == null ? List.of() : List.copyOf(history);
        preferences = preferences == null ? UserPreferences.defaults() : preferences;
        favorites = favorites == null ? List.of() : List.copyOf(favorites);
        recentSearches = recentSearches == null ? List.of() : List.copyOf(recentSearches);
    }

    public static AssistantState empty() {
        return new AssistantState(List.of(), UserPreferences.defaults(), List.of(), List.of());
    }
}

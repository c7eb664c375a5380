package com.phillippitts.platemate.domain;

import java.util.List;

/**
 * Persisted user preferences.
 *
 * @param favoriteRestaurantIds ids of favorite restaurants, in the order they were added
 * @param dietaryPreferences    e.g. Vegetarian, Gluten-Free
 * @param pricePreference       preferred maximum price level 1-4, or {@code null}
 * @param cuisinePreferences    preferred cuisines
 * @param distancePreference    preferred search radius in meters, or {@code null}
 * @param sortPreference        default sort of displayed restaurants
 */
public record UserPreferences(
        List<String> favoriteRestaurantIds,
        List<String> dietaryPreferences,
        Integer pricePreference,
        List<String> cuisinePreferences,
        Double distancePreference,
        SortOption sortPreference
) {

    public enum SortOption { DISTANCE, RATING, PRICE }

    public UserPreferences {
        favoriteRestaurantIds = favoriteRestaurantIds == null ? List.of() : List.copyOf(favoriteRestaurantIds);
        dietaryPreferences = dietaryPreferences == null ? List.of() : List.copyOf(dietaryPreferences);
        cuisinePreferences = cuisinePreferences == null ? List.of() : List.copyOf(cuisinePreferences);
        sortPreference = sortPreference == null ? SortOption.DISTANCE : sortPreference;
        if (pricePreference != null && (pricePreference < 1 || pricePreference > 4)) {
            throw new IllegalArgumentException("pricePreference must be within 1-4, got: " + pricePreference);
        }
    }

    /** Defaults: no favorites, 5 km radius, sorted by distance. */
    public static UserPreferences defaults() {
        return new UserPreferences(List.of(), List.of(), null, List.of(), 5000.0, SortOption.DISTANCE);
    }

    public UserPreferences withFavoriteRestaurantIds(List<String> ids) {
        return new UserPreferences(ids, dietaryPreferences, pricePreference, cuisinePreferences,
                distancePreference, sortPreference);
    }
}

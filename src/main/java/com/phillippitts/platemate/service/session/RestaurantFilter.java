package com.phillippitts.platemate.service.session;

import com.phillippitts.platemate.domain.RestaurantRecord;
import com.phillippitts.platemate.domain.UserPreferences.SortOption;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Filters and sorts displayed restaurants.
 *
 * @param query     substring of the name or a cuisine, case-insensitive; {@code null} for any
 * @param cuisines  keep restaurants serving at least one of these; empty for any
 * @param maxPrice  highest acceptable price level; {@code null} for any
 * @param minRating lowest acceptable rating; {@code null} for any
 * @param sort      result order
 */
public record RestaurantFilter(String query,
                               Set<String> cuisines,
                               Integer maxPrice,
                               Double minRating,
                               SortOption sort) {

    public RestaurantFilter {
        cuisines = cuisines == null ? Set.of() : Set.copyOf(cuisines);
        sort = sort == null ? SortOption.DISTANCE : sort;
    }

    public static RestaurantFilter sortedBy(SortOption sort) {
        return new RestaurantFilter(null, Set.of(), null, null, sort);
    }

    public List<RestaurantRecord> apply(List<RestaurantRecord> restaurants) {
        List<RestaurantRecord> out = new ArrayList<>();
        for (RestaurantRecord r : restaurants) {
            if (matches(r)) {
                out.add(r);
            }
        }
        // List.sort is stable, so records without a distance keep their relative order
        switch (sort) {
            case DISTANCE -> out.sort(Comparator.comparing(RestaurantRecord::getDistanceMeters,
                    Comparator.nullsLast(Comparator.naturalOrder())));
            case RATING -> out.sort(Comparator.comparingDouble(RestaurantRecord::getRating).reversed());
            case PRICE -> out.sort(Comparator.comparingInt(RestaurantRecord::getPriceLevel));
            default -> throw new IllegalStateException("Unknown sort option: " + sort);
        }
        return out;
    }

    private boolean matches(RestaurantRecord r) {
        if (query != null && !query.isBlank()) {
            String q = query.toLowerCase(Locale.ROOT);
            boolean hit = r.getName().toLowerCase(Locale.ROOT).contains(q)
                    || r.getCuisines().stream().anyMatch(c -> c.toLowerCase(Locale.ROOT).contains(q));
            if (!hit) {
                return false;
            }
        }
        if (!cuisines.isEmpty() && r.getCuisines().stream().noneMatch(cuisines::contains)) {
            return false;
        }
        if (maxPrice != null && r.getPriceLevel() > maxPrice) {
            return false;
        }
        return minRating == null || r.getRating() >= minRating;
    }
}

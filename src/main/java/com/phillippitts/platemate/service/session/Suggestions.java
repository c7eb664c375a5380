package com.phillippitts.platemate.service.session;

import java.util.ArrayList;
import java.util.List;

/**
 * Query suggestions and the cuisine catalogue offered to the user.
 */
final class Suggestions {

    static final int MAX_SUGGESTIONS = 6;

    static final List<String> COMMON_QUERIES = List.of(
            "Italian restaurants nearby",
            "Best sushi places",
            "Restaurants open now",
            "Outdoor dining options",
            "Family-friendly restaurants",
            "Vegan restaurants",
            "Restaurants with gluten-free options");

    static final List<String> AVAILABLE_CUISINES = List.of(
            "Italian", "Chinese", "Mexican", "Indian", "Japanese", "Thai",
            "French", "American", "Mediterranean", "Greek", "Korean", "Vietnamese",
            "Spanish", "Turkish", "Lebanese", "Ethiopian", "German", "Brazilian");

    private Suggestions() {
    }

    /** Recent searches first, then common queries not already listed; at most {@value #MAX_SUGGESTIONS}. */
    static List<String> suggestedQueries(List<String> recentSearches) {
        List<String> out = new ArrayList<>(recentSearches);
        for (String q : COMMON_QUERIES) {
            if (!out.contains(q)) {
                out.add(q);
            }
        }
        return List.copyOf(out.subList(0, Math.min(MAX_SUGGESTIONS, out.size())));
    }
}

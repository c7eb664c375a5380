package com.phillippitts.platemate.service.extraction;

import com.phillippitts.platemate.domain.Coordinate;
import com.phillippitts.platemate.domain.LocationFix;
import com.phillippitts.platemate.domain.RestaurantRecord;
import com.phillippitts.platemate.util.GeoDistance;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.UUID;

/**
 * Heuristic extraction of restaurant entities from free-form model output.
 *
 * <p>If the text mentions a venue keyword, one record is synthesized for each cuisine of a fixed
 * vocabulary that the text names (at most {@value #MAX_ENTITIES}, in order of first mention).
 * Field values come from fixed templates filled by the injected {@link Random}, so a seeded
 * random yields reproducible records. This is not a real search: names, addresses and ratings
 * are placeholders around the cuisines the model actually mentioned.
 */
@Component
public class EntityExtractor {

    private static final Logger LOG = LogManager.getLogger(EntityExtractor.class);

    static final int MAX_ENTITIES = 5;
    static final double JITTER_DEGREES = 0.01;
    static final Coordinate DEFAULT_COORDINATE = new Coordinate(37.7749, -122.4194);

    static final List<String> VENUE_KEYWORDS = List.of(
            "restaurant", "café", "cafe", "bistro", "diner", "eatery", "place", "bar", "grill");

    static final List<String> CUISINES = List.of(
            "Italian", "Chinese", "Mexican", "Indian", "Japanese",
            "Thai", "French", "American", "Mediterranean", "Greek");

    private static final List<String> NAME_SUFFIXES = List.of(
            "Delight", "Express", "Garden", "House", "Palace", "Bistro", "Kitchen");
    private static final List<String> STREETS = List.of("Main", "Oak", "Pine", "Maple", "Cedar");
    private static final List<String> HIGHLIGHTS = List.of(
            "signature dishes", "fresh ingredients", "vibrant atmosphere", "chef specials");
    private static final List<String> HOURS = List.of(
            "Mon-Fri: 11:00 AM - 10:00 PM", "Sat-Sun: 10:00 AM - 11:00 PM");

    private final Random random;

    public EntityExtractor(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Extracts restaurant entities from a model response.
     *
     * @param responseText model output
     * @param fix          latest location fix, used to place and measure the records
     * @return entities plus the unchanged text
     */
    public ExtractionResult extract(String responseText, Optional<LocationFix> fix) {
        if (responseText == null || responseText.isBlank()) {
            return new ExtractionResult(List.of(), responseText == null ? "" : responseText);
        }
        String lower = responseText.toLowerCase(Locale.ROOT);
        boolean mentionsVenue = VENUE_KEYWORDS.stream().anyMatch(lower::contains);
        if (!mentionsVenue) {
            return new ExtractionResult(List.of(), responseText);
        }

        List<String> cuisines = cuisinesInTextOrder(lower);
        List<RestaurantRecord> records = new ArrayList<>(cuisines.size());
        for (String cuisine : cuisines) {
            records.add(synthesize(cuisine, fix.orElse(null)));
        }
        LOG.debug("Extracted {} restaurant(s) for cuisines {}", records.size(), cuisines);
        return new ExtractionResult(records, responseText);
    }

    static List<String> cuisinesInTextOrder(String lowerText) {
        record Hit(String cuisine, int index) {}
        List<Hit> hits = new ArrayList<>();
        for (String cuisine : CUISINES) {
            int idx = lowerText.indexOf(cuisine.toLowerCase(Locale.ROOT));
            if (idx >= 0) {
                hits.add(new Hit(cuisine, idx));
            }
        }
        hits.sort(Comparator.comparingInt(Hit::index));
        return hits.stream().limit(MAX_ENTITIES).map(Hit::cuisine).toList();
    }

    private RestaurantRecord synthesize(String cuisine, LocationFix fix) {
        Coordinate coordinate = DEFAULT_COORDINATE;
        Double distance = null;
        if (fix != null) {
            Coordinate origin = fix.coordinate();
            coordinate = new Coordinate(
                    clamp(origin.latitude() + jitter(), -90.0, 90.0),
                    clamp(origin.longitude() + jitter(), -180.0, 180.0));
            distance = GeoDistance.meters(origin, coordinate);
        }

        String id = "rest_" + new UUID(random.nextLong(), random.nextLong());
        String name = cuisine + " " + pick(NAME_SUFFIXES);
        String address = between(10, 999) + " " + pick(STREETS) + " St";
        String phone = "(555) " + between(100, 999) + "-" + between(1000, 9999);
        String website = "https://" + cuisine.toLowerCase(Locale.ROOT) + "restaurant.example.com";
        double rating = Math.round((3.0 + random.nextDouble() * 2.0) * 10.0) / 10.0;
        int price = between(1, 4);
        String description = "Authentic " + cuisine + " cuisine with a modern twist. Popular for their "
                + pick(HIGHLIGHTS) + ".";

        return new RestaurantRecord(id, name, address, phone, website, rating, price,
                Set.of(cuisine), coordinate, HOURS, description, distance);
    }

    private double jitter() {
        return (random.nextDouble() * 2.0 - 1.0) * JITTER_DEGREES;
    }

    private int between(int lowInclusive, int highInclusive) {
        return lowInclusive + random.nextInt(highInclusive - lowInclusive + 1);
    }

    private String pick(List<String> options) {
        return options.get(random.nextInt(options.size()));
    }

    private static double clamp(double v, double min, double max) {
        return Math.max(min, Math.min(max, v));
    }
}

package com.phillippitts.platemate.domain;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Restaurant entity derived from a model response.
 *
 * <p>All fields are fixed at construction except {@link #getDistanceMeters()}, which is refreshed
 * whenever a new location fix arrives. Equality is by {@link #getId()}.
 *
 * <p>Thread Safety: the distance is {@code volatile}; all other fields are immutable.
 */
public final class RestaurantRecord {

    private final String id;
    private final String name;
    private final String address;
    private final String phone;
    private final String website;
    private final double rating;
    private final int priceLevel;
    private final Set<String> cuisines;
    private final Coordinate coordinates;
    private final List<String> hours;
    private final String description;
    private volatile Double distanceMeters;

    // CHECKSTYLE.OFF: ParameterNumber - flat value object mirrored by the persisted JSON
    public RestaurantRecord(String id,
                            String name,
                            String address,
                            String phone,
                            String website,
                            double rating,
                            int priceLevel,
                            Set<String> cuisines,
                            Coordinate coordinates,
                            List<String> hours,
                            String description,
                            Double distanceMeters) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.address = Objects.requireNonNull(address, "address must not be null");
        this.coordinates = Objects.requireNonNull(coordinates, "coordinates must not be null");
        if (rating < 0.0 || rating > 5.0) {
            throw new IllegalArgumentException("rating must be within [0,5], got: " + rating);
        }
        if (priceLevel < 1 || priceLevel > 4) {
            throw new IllegalArgumentException("priceLevel must be within [1,4], got: " + priceLevel);
        }
        this.phone = phone;
        this.website = website;
        this.rating = rating;
        this.priceLevel = priceLevel;
        this.cuisines = cuisines == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(cuisines));
        this.hours = hours == null ? null : List.copyOf(hours);
        this.description = description;
        this.distanceMeters = distanceMeters;
    }
    // CHECKSTYLE.ON: ParameterNumber

    public String getId() { return id; }
    public String getName() { return name; }
    public String getAddress() { return address; }
    public String getPhone() { return phone; }
    public String getWebsite() { return website; }
    public double getRating() { return rating; }
    public int getPriceLevel() { return priceLevel; }
    public Set<String> getCuisines() { return cuisines; }
    public Coordinate getCoordinates() { return coordinates; }
    public List<String> getHours() { return hours; }
    public String getDescription() { return description; }

    /** Distance from the latest location fix in meters, or {@code null} if no fix has been seen. */
    public Double getDistanceMeters() {
        return distanceMeters;
    }

    /** Only the session controller refreshes distances, on every new location fix. */
    public void updateDistance(Double meters) {
        this.distanceMeters = meters;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RestaurantRecord other)) {
            return false;
        }
        return id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "RestaurantRecord{id=" + id + ", name=" + name + ", cuisines=" + cuisines
                + ", distanceMeters=" + distanceMeters + '}';
    }
}

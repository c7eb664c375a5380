package com.phillippitts.platemate.service.location;

import java.util.Optional;

/**
 * Result of reverse geocoding. Either part may be {@code null}.
 *
 * @param subLocality neighbourhood or district
 * @param locality    city or town
 */
public record Placemark(String subLocality, String locality) {

    /** Sub-locality, else locality; empty when neither is known. */
    public Optional<String> displayName() {
        if (subLocality != null && !subLocality.isBlank()) {
            return Optional.of(subLocality);
        }
        if (locality != null && !locality.isBlank()) {
            return Optional.of(locality);
        }
        return Optional.empty();
    }
}

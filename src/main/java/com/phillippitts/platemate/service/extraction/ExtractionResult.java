package com.phillippitts.platemate.service.extraction;

import com.phillippitts.platemate.domain.RestaurantRecord;

import java.util.List;

/**
 * Output of {@link EntityExtractor#extract}.
 *
 * @param entities        synthesized restaurants in text order of their cuisine (may be empty)
 * @param passthroughText the response text, unchanged
 */
public record ExtractionResult(List<RestaurantRecord> entities, String passthroughText) {

    public ExtractionResult {
        entities = entities == null ? List.of() : List.copyOf(entities);
    }

    public boolean hasEntities() {
        return !entities.isEmpty();
    }
}

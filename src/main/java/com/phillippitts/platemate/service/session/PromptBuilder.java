package com.phillippitts.platemate.service.session;

import com.phillippitts.platemate.domain.Coordinate;
import com.phillippitts.platemate.domain.LocationFix;

import java.util.Optional;

/**
 * Adds location context to a user query before it is sent to the model.
 */
final class PromptBuilder {

    private PromptBuilder() {
    }

    static String augment(String userText, Optional<LocationFix> fix) {
        if (fix.isPresent()) {
            Coordinate c = fix.get().coordinate();
            return "Please find restaurants at these exact coordinates: "
                    + c.latitude() + ", " + c.longitude() + ". The user is asking: " + userText;
        }
        return "I am looking for restaurants nearby. " + userText;
    }
}

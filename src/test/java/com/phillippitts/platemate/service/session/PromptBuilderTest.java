package com.phillippitts.platemate.service.session;

import com.phillippitts.platemate.domain.LocationFix;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class PromptBuilderTest {

    @Test
    void shouldIncludeCoordinatesWhenFixKnown() {
        LocationFix fix = LocationFix.of(37.7749, -122.4194, 5.0);

        String prompt = PromptBuilder.augment("sushi", Optional.of(fix));

        assertThat(prompt).isEqualTo(
                "Please find restaurants at these exact coordinates: 37.7749, -122.4194. The user is asking: sushi");
    }

    @Test
    void shouldAskForNearbyWithoutFix() {
        assertThat(PromptBuilder.augment("tacos", Optional.empty()))
                .isEqualTo("I am looking for restaurants nearby. tacos");
    }
}

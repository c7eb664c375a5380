package com.phillippitts.platemate.service.location.impl;

import com.phillippitts.platemate.domain.LocationFix;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StaticLocationProviderTest {

    @Test
    void shouldDeliverConfiguredCoordinateToEveryListener() {
        StaticLocationProvider provider = new StaticLocationProvider(48.8566, 2.3522);
        List<LocationFix> first = new ArrayList<>();
        List<LocationFix> second = new ArrayList<>();
        provider.addListener(first::add);
        provider.addListener(second::add);

        provider.startUpdates();
        provider.requestOnce();

        assertThat(first).singleElement().satisfies(fix -> {
            assertThat(fix.coordinate().latitude()).isEqualTo(48.8566);
            assertThat(fix.coordinate().longitude()).isEqualTo(2.3522);
            assertThat(fix.accuracyMeters()).isZero();
        });
        assertThat(second).hasSize(1);
    }
}

package com.phillippitts.platemate.util;

import com.phillippitts.platemate.domain.Coordinate;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class GeoDistanceTest {

    private static final Coordinate SAN_FRANCISCO = new Coordinate(37.7749, -122.4194);
    private static final Coordinate LOS_ANGELES = new Coordinate(34.0522, -118.2437);

    @Test
    void shouldReturnZeroForSamePoint() {
        assertThat(GeoDistance.meters(SAN_FRANCISCO, SAN_FRANCISCO)).isEqualTo(0.0);
    }

    @Test
    void shouldMeasureOneDegreeOfLatitude() {
        double d = GeoDistance.meters(new Coordinate(0.0, 0.0), new Coordinate(1.0, 0.0));

        assertThat(d).isCloseTo(111_195.0, within(1.0));
    }

    @Test
    void shouldMeasureOneHundredthDegreeWithinOnePercent() {
        double d = GeoDistance.meters(new Coordinate(0.0, 0.0), new Coordinate(0.01, 0.0));

        assertThat(d).isCloseTo(1_113.0, within(11.13));
    }

    @Test
    void shouldMeasureCityPairWithinHalfPercent() {
        double d = GeoDistance.meters(SAN_FRANCISCO, LOS_ANGELES);

        assertThat(d).isCloseTo(559_000.0, within(3_000.0));
    }

    @Test
    void shouldBeSymmetric() {
        assertThat(GeoDistance.meters(SAN_FRANCISCO, LOS_ANGELES))
                .isCloseTo(GeoDistance.meters(LOS_ANGELES, SAN_FRANCISCO), within(1e-6));
    }
}

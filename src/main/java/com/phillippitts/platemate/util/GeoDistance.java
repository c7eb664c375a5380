package com.phillippitts.platemate.util;

import com.phillippitts.platemate.domain.Coordinate;

/**
 * Great-circle distance on a spherical Earth (haversine formula).
 *
 * <p>Accuracy is within about 0.5% of the ellipsoidal distance, which is ample for
 * "how far is this restaurant" display purposes.
 */
public final class GeoDistance {

    /** IUGG mean Earth radius in meters. */
    public static final double EARTH_RADIUS_METERS = 6_371_008.8;

    private GeoDistance() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns the great-circle distance between two coordinates.
     *
     * @param from start coordinate
     * @param to   end coordinate
     * @return distance in meters
     */
    public static double meters(Coordinate from, Coordinate to) {
        double lat1 = Math.toRadians(from.latitude());
        double lat2 = Math.toRadians(to.latitude());
        double dLat = lat2 - lat1;
        double dLon = Math.toRadians(to.longitude() - from.longitude());

        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(lat1) * Math.cos(lat2) * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_METERS * c;
    }
}

package com.phillippitts.platemate.domain;

/**
 * WGS84 geographic coordinate in decimal degrees.
 *
 * @param latitude  latitude in [-90, 90]
 * @param longitude longitude in [-180, 180]
 */
public record Coordinate(double latitude, double longitude) {

    public Coordinate {
        if (Double.isNaN(latitude) || latitude < -90.0 || latitude > 90.0) {
            throw new IllegalArgumentException("latitude out of range: " + latitude);
        }
        if (Double.isNaN(longitude) || longitude < -180.0 || longitude > 180.0) {
            throw new IllegalArgumentException("longitude out of range: " + longitude);
        }
    }
}

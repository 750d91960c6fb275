package io.meteofetch.core;

import java.util.Locale;

/**
 * Geographic point a series is requested for. Coordinates are validated on construction.
 */
public record Location(double latitude, double longitude) {
    public Location {
        if (Double.isNaN(latitude) || latitude < -90 || latitude > 90) {
            throw new IllegalArgumentException("latitude must be within [-90, 90]: " + latitude);
        }
        if (Double.isNaN(longitude) || longitude < -180 || longitude > 180) {
            throw new IllegalArgumentException("longitude must be within [-180, 180]: " + longitude);
        }
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%.4f,%.4f", latitude, longitude);
    }
}

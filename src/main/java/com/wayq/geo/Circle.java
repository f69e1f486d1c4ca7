package com.wayq.geo;

/**
 * A circular region: center in degrees, radius in meters.
 */
public record Circle(double lat, double lon, double radius) {
    public static final double DEFAULT_RADIUS = 100;

    public Circle {
        if (Double.isNaN(lat) || Double.isNaN(lon) || Double.isNaN(radius)) {
            throw new IllegalArgumentException("coordinates must be numbers");
        }
        if (lat < -85 || lat > 85) {
            throw new IllegalArgumentException("latitude \"" + Decimals.format(lat) + "\" not within range");
        }
        if (lon < -180 || lon > 180) {
            throw new IllegalArgumentException("longitude \"" + Decimals.format(lon) + "\" not within range");
        }
        if (radius < 0) {
            throw new IllegalArgumentException("radius must be positive");
        }
        if (Double.isInfinite(radius)) {
            throw new IllegalArgumentException("radius must be finite");
        }
    }

    /**
     * Parses {@code lat,lon[,radius]}, e.g. {@code -37.8,144.9,10km}. The radius defaults to 100 meters.
     */
    public static Circle parse(String text) {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("unexpected empty value");
        }
        String[] parts = text.split(",", -1);
        if (parts.length < 2 || parts.length > 3) {
            throw new IllegalArgumentException("invalid number of parts");
        }
        double lat = parseCoordinate("latitude", parts[0]);
        double lon = parseCoordinate("longitude", parts[1]);
        double radius = DEFAULT_RADIUS;
        if (parts.length == 3) {
            try {
                radius = DistanceUnit.parseMeters(parts[2]);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("radius " + e.getMessage(), e);
            }
        }
        return new Circle(lat, lon, radius);
    }

    private static double parseCoordinate(String name, String text) {
        double value;
        try {
            value = Double.parseDouble(text.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " \"" + text + "\" not recognized", e);
        }
        if (Double.isInfinite(value)) {
            throw new IllegalArgumentException(name + " \"" + text + "\" not within range");
        }
        return value;
    }

    @Override
    public String toString() {
        return Decimals.format(lat) + "," + Decimals.format(lon) + "," + Decimals.format(radius);
    }
}

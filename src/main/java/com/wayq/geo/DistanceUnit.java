package com.wayq.geo;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public enum DistanceUnit {
    METER(1, "m", "meter", "meters", "metre", "metres"),
    KILOMETER(1000, "km", "kilometer", "kilometers", "kilometre", "kilometres"),
    MILE(1609.344, "mi", "mile", "miles"),
    YARD(0.9144, "yd", "yard", "yards"),
    FOOT(0.3048, "ft", "foot", "feet");

    private static final Pattern DISTANCE = Pattern.compile("^(.*\\d)\\s?(\\w+)?$");

    private final double meters;
    private final String[] names;

    DistanceUnit(double meters, String... names) {
        this.meters = meters;
        this.names = names;
    }

    public double toMeters(double value) {
        return value * meters;
    }

    public static DistanceUnit find(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        for (DistanceUnit unit : values()) {
            for (String candidate : unit.names) {
                if (candidate.equals(lower)) {
                    return unit;
                }
            }
        }
        throw new IllegalArgumentException("unit \"" + name + "\" not recognized");
    }

    /**
     * Parses a distance such as {@code 100}, {@code 2km} or {@code 10 mi} into meters. A bare number is meters.
     */
    public static double parseMeters(String text) {
        Matcher m = DISTANCE.matcher(text.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("format not recognized");
        }
        double value;
        try {
            value = Double.parseDouble(m.group(1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("number \"" + m.group(1) + "\" not recognized", e);
        }
        if (Double.isInfinite(value)) {
            throw new IllegalArgumentException("number \"" + m.group(1) + "\" out of range");
        }
        if (value < 0) {
            throw new IllegalArgumentException("must be positive");
        }
        double meters = m.group(2) == null ? value : find(m.group(2)).toMeters(value);
        if (Double.isInfinite(meters)) {
            throw new IllegalArgumentException("distance \"" + text.trim() + "\" out of range");
        }
        return meters;
    }
}

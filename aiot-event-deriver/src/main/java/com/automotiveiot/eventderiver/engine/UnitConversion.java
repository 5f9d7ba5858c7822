package com.automotiveiot.eventderiver.engine;

/**
 * Conversions from the embedded client's raw units to the units stored downstream.
 */
public final class UnitConversion {

    public static final double STANDARD_GRAVITY = 9.80665;
    public static final double METERS_PER_SECOND_PER_MPH = 0.44704;

    private UnitConversion() {
    }

    public static double metersFromCentimeters(double centimeters) {
        if (centimeters < 0) {
            throw new InvalidReadingException("distance_cm", "distance cannot be negative: " + centimeters);
        }
        return centimeters / 100.0;
    }

    // finite for any finite axes short of the double range itself
    public static double gForceMagnitude(double x, double y, double z) {
        return Math.hypot(Math.hypot(x, y), z);
    }

    public static double metersPerSecondSquared(double g) {
        return g * STANDARD_GRAVITY;
    }

    public static double metersPerSecond(double mph) {
        return mph * METERS_PER_SECOND_PER_MPH;
    }
}

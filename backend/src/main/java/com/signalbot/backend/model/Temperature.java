package com.signalbot.backend.model;

/**
 * Magnitude of the combined score, independent of its sign.
 * Each band includes its lower edge.
 */
public enum Temperature {
    FROZEN(0, 0.0),
    COOL(1, 0.05),
    WARM(2, 0.15),
    HOT(3, 0.30);

    private final int level;
    private final double lowerBound;

    Temperature(int level, double lowerBound) {
        this.level = level;
        this.lowerBound = lowerBound;
    }

    public int getLevel() {
        return level;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public boolean isAtLeast(Temperature other) {
        return other == null || level >= other.level;
    }

    public static Temperature fromScore(double score) {
        double magnitude = Math.abs(score);
        if (magnitude >= HOT.lowerBound) {
            return HOT;
        }
        if (magnitude >= WARM.lowerBound) {
            return WARM;
        }
        if (magnitude >= COOL.lowerBound) {
            return COOL;
        }
        return FROZEN;
    }

    public static Temperature fromString(String value) {
        if (value == null || value.isBlank()) {
            return FROZEN;
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return FROZEN;
        }
    }
}

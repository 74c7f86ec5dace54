package com.ecotech.airquality.model;

/**
 * US EPA air quality bands.
 */
public enum AqiCategory {
    GOOD("Good", 0, 50),
    MODERATE("Moderate", 51, 100),
    UNHEALTHY_FOR_SENSITIVE_GROUPS("Unhealthy for Sensitive Groups", 101, 150),
    UNHEALTHY("Unhealthy", 151, 200),
    VERY_UNHEALTHY("Very Unhealthy", 201, 300),
    HAZARDOUS("Hazardous", 301, Integer.MAX_VALUE),
    UNKNOWN("Unknown", -1, -1);

    private final String label;
    private final int min;
    private final int max;

    AqiCategory(String label, int min, int max) {
        this.label = label;
        this.min = min;
        this.max = max;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }

    /**
     * Band for an index value. Null or negative values are {@link #UNKNOWN}.
     */
    public static AqiCategory fromAqi(Integer aqi) {
        if (aqi == null || aqi < 0) {
            return UNKNOWN;
        }
        for (AqiCategory category : values()) {
            if (category != UNKNOWN && aqi >= category.min && aqi <= category.max) {
                return category;
            }
        }
        return UNKNOWN;
    }
}

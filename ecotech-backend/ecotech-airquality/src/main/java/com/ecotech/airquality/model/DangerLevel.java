package com.ecotech.airquality.model;

/**
 * Coarse danger scale shown next to the AQI band.
 */
public enum DangerLevel {
    LOW("LOW"),
    MEDIUM("MEDIUM"),
    HIGH("HIGH"),
    CRITICAL("CRITICAL"),
    UNKNOWN("UNKNOWN");

    private final String value;

    DangerLevel(String value) {
        this.value = value;
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }

    public static DangerLevel fromAqi(Integer aqi) {
        if (aqi == null || aqi < 0) {
            return UNKNOWN;
        }
        if (aqi <= 50) {
            return LOW;
        }
        if (aqi <= 100) {
            return MEDIUM;
        }
        if (aqi <= 200) {
            return HIGH;
        }
        return CRITICAL;
    }
}

package com.ecotech.airquality.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * One station reading from the air quality feed.
 * Absent measurements are null; absent pollutants are missing from the map.
 */
@Value
@Builder
public class AirQualityReport {

    String city;

    Integer aqi;

    String station;

    @Singular("coordinate")
    List<Double> coordinates;

    String measuredAt;

    /** Pollutant code (pm25, pm10, o3, no2, so2, co) to measured value. */
    @Singular
    Map<String, Double> pollutants;

    Double temperature;

    Double humidity;

    Double pressure;

    public AqiCategory getCategory() {
        return AqiCategory.fromAqi(aqi);
    }

    public DangerLevel getDangerLevel() {
        return DangerLevel.fromAqi(aqi);
    }
}

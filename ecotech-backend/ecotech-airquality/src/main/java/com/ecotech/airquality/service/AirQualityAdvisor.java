package com.ecotech.airquality.service;

import com.ecotech.airquality.model.AqiCategory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Business recommendations for EcoTech field teams per AQI band.
 */
@Component
public class AirQualityAdvisor {

    public List<String> recommendationsFor(Integer aqi) {
        AqiCategory category = AqiCategory.fromAqi(aqi);
        switch (category) {
            case GOOD:
                return List.of(
                        "Air quality is optimal for outdoor activities",
                        "Favourable conditions for solar energy initiatives",
                        "Good moment for environmental awareness campaigns");
            case MODERATE:
                return List.of(
                        "Air quality is acceptable, keep monitoring the trend",
                        "Consider preventive emission reduction strategies");
            case UNHEALTHY_FOR_SENSITIVE_GROUPS:
            case UNHEALTHY:
                return List.of(
                        "Alert: apply mitigation measures immediately",
                        "Limit activities that add to pollution",
                        "Activate protection protocols for vulnerable groups");
            case VERY_UNHEALTHY:
            case HAZARDOUS:
                return List.of(
                        "CRITICAL: activate the environmental emergency plan",
                        "Suspend non-essential polluting activities",
                        "Coordinate corrective actions with the authorities");
            default:
                return List.of("Not enough data to generate recommendations");
        }
    }
}

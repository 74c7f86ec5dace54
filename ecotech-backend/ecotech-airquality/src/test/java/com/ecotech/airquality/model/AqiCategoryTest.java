package com.ecotech.airquality.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class AqiCategoryTest {

    @ParameterizedTest(name = "AQI {0} -> {1} / {2}")
    @CsvSource({
            "0, GOOD, LOW",
            "50, GOOD, LOW",
            "51, MODERATE, MEDIUM",
            "100, MODERATE, MEDIUM",
            "101, UNHEALTHY_FOR_SENSITIVE_GROUPS, HIGH",
            "150, UNHEALTHY_FOR_SENSITIVE_GROUPS, HIGH",
            "151, UNHEALTHY, HIGH",
            "200, UNHEALTHY, HIGH",
            "201, VERY_UNHEALTHY, CRITICAL",
            "300, VERY_UNHEALTHY, CRITICAL",
            "301, HAZARDOUS, CRITICAL",
            "999, HAZARDOUS, CRITICAL"
    })
    void bandBoundaries(int aqi, AqiCategory category, DangerLevel dangerLevel) {
        assertThat(AqiCategory.fromAqi(aqi)).isEqualTo(category);
        assertThat(DangerLevel.fromAqi(aqi)).isEqualTo(dangerLevel);
    }

    @Test
    @DisplayName("Missing or negative index is unknown")
    void unknown() {
        assertThat(AqiCategory.fromAqi(null)).isEqualTo(AqiCategory.UNKNOWN);
        assertThat(AqiCategory.fromAqi(-5)).isEqualTo(AqiCategory.UNKNOWN);
        assertThat(DangerLevel.fromAqi(null)).isEqualTo(DangerLevel.UNKNOWN);
    }

    @Test
    @DisplayName("Labels are human readable")
    void labels() {
        assertThat(AqiCategory.UNHEALTHY_FOR_SENSITIVE_GROUPS).hasToString("Unhealthy for Sensitive Groups");
        assertThat(AqiCategory.GOOD.getLabel()).isEqualTo("Good");
    }
}

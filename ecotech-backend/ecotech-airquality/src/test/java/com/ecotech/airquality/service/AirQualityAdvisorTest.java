package com.ecotech.airquality.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AirQualityAdvisorTest {

    private final AirQualityAdvisor advisor = new AirQualityAdvisor();

    @Test
    @DisplayName("Each band gets its own advice")
    void recommendationsPerBand() {
        assertThat(advisor.recommendationsFor(30)).hasSize(3).first().asString().contains("optimal");
        assertThat(advisor.recommendationsFor(75)).hasSize(2);
        assertThat(advisor.recommendationsFor(120)).isEqualTo(advisor.recommendationsFor(180));
        assertThat(advisor.recommendationsFor(350)).first().asString().startsWith("CRITICAL");
    }

    @Test
    @DisplayName("No index, no advice")
    void unknownIndex() {
        assertThat(advisor.recommendationsFor(null)).containsExactly("Not enough data to generate recommendations");
    }
}

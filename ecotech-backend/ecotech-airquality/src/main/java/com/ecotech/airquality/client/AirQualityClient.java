package com.ecotech.airquality.client;

import com.ecotech.airquality.model.AirQualityReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * WebClient-based client for the AQICN feed ({@code GET /feed/{city}/?token=...}).
 * Calls block until the response arrives or the timeout fires. Failures are never
 * retried here; every failure kind is reported as one {@link AirQualityException}.
 */
@Component
@Slf4j
public class AirQualityClient {

    static final List<String> POLLUTANT_CODES = List.of("pm25", "pm10", "o3", "no2", "so2", "co");

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String token;
    private final Duration timeout;
    private final String defaultCity;

    public AirQualityClient(WebClient.Builder builder,
                            ObjectMapper objectMapper,
                            @Value("${ecotech.airquality.base-url:https://api.waqi.info}") String baseUrl,
                            @Value("${ecotech.airquality.token:demo}") String token,
                            @Value("${ecotech.airquality.timeout:10s}") Duration timeout,
                            @Value("${ecotech.airquality.default-city:Mexico}") String defaultCity) {
        this.webClient = builder.baseUrl(baseUrl).build();
        this.objectMapper = objectMapper;
        this.token = token;
        this.timeout = timeout;
        this.defaultCity = defaultCity;
    }

    /**
     * Fetch the current reading for a city. A blank city means the configured default.
     *
     * @throws AirQualityException on timeout, connection failure, HTTP error,
     *                             malformed JSON or a non-"ok" status from the provider
     */
    public AirQualityReport fetch(String city) {
        String target = city == null || city.isBlank() ? defaultCity : city.trim();
        log.info("[AQI_FETCH_START] Fetching air quality | city={}", target);

        String body;
        try {
            body = webClient.get()
                    .uri(uriBuilder -> uriBuilder
                            .path("/feed/{city}/")
                            .queryParam("token", "{token}")
                            .build(target, token))
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout, Mono.error(() -> new AirQualityException(
                            "Timed out after " + timeout.toSeconds() + "s waiting for the air quality service")))
                    .block();
        } catch (AirQualityException e) {
            log.error("[AQI_FETCH_TIMEOUT] Air quality request timed out | city={} | timeout={}", target, timeout);
            throw e;
        } catch (WebClientResponseException e) {
            log.error("[AQI_FETCH_HTTP_ERROR] Air quality service answered with an error | city={} | status={}",
                    target, e.getStatusCode().value());
            throw new AirQualityException("Air quality service returned HTTP " + e.getStatusCode().value(), e);
        } catch (WebClientRequestException e) {
            log.error("[AQI_FETCH_CONNECT_ERROR] Could not reach air quality service | city={} | error={}",
                    target, e.getMessage());
            throw new AirQualityException("Could not connect to the air quality service", e);
        } catch (RuntimeException e) {
            log.error("[AQI_FETCH_FAILED] Unexpected air quality failure | city={} | error={}", target, e.getMessage(), e);
            throw new AirQualityException("Unexpected error while querying the air quality service", e);
        }

        AirQualityReport report = parse(target, body);
        log.info("[AQI_FETCH_SUCCESS] Air quality received | city={} | station={} | aqi={}",
                target, report.getStation(), report.getAqi());
        return report;
    }

    AirQualityReport parse(String city, String body) {
        if (body == null || body.isBlank()) {
            throw new AirQualityException("Air quality service returned an empty response");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.error("[AQI_PARSE_ERROR] Malformed JSON from air quality service | city={}", city);
            throw new AirQualityException("Could not process the air quality response", e);
        }

        if (!"ok".equals(root.path("status").asText())) {
            String reason = root.path("data").isTextual() ? root.path("data").asText() : "invalid response";
            log.warn("[AQI_PROVIDER_ERROR] Provider rejected request | city={} | reason={}", city, reason);
            throw new AirQualityException("Air quality service error: " + reason);
        }

        JsonNode data = root.path("data");
        JsonNode iaqi = data.path("iaqi");

        AirQualityReport.AirQualityReportBuilder report = AirQualityReport.builder()
                .city(city)
                .aqi(intOrNull(data.path("aqi")))
                .station(data.path("city").path("name").asText("Unknown"))
                .measuredAt(data.path("time").path("s").asText(null))
                .temperature(measurement(iaqi, "t"))
                .humidity(measurement(iaqi, "h"))
                .pressure(measurement(iaqi, "p"));

        for (JsonNode coordinate : data.path("city").path("geo")) {
            if (coordinate.isNumber()) {
                report.coordinate(coordinate.asDouble());
            }
        }
        for (String code : POLLUTANT_CODES) {
            Double value = measurement(iaqi, code);
            if (value != null) {
                report.pollutant(code, value);
            }
        }
        return report.build();
    }

    // AQICN reports "-" when a station has no current index; out-of-range values count as missing
    private static Integer intOrNull(JsonNode node) {
        if (node.isNumber()) {
            return node.canConvertToInt() ? node.asInt() : null;
        }
        if (node.isTextual() && node.asText().trim().matches("\\d{1,9}")) {
            return Integer.valueOf(node.asText().trim());
        }
        return null;
    }

    private static Double measurement(JsonNode iaqi, String code) {
        JsonNode value = iaqi.path(code).path("v");
        return value.isNumber() ? value.asDouble() : null;
    }
}

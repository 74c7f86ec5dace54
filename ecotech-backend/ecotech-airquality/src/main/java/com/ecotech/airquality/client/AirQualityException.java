package com.ecotech.airquality.client;

/**
 * Thrown when the air quality feed cannot be reached or answers with something unusable.
 * Timeouts, connection failures, HTTP errors and bad JSON all end up here.
 */
public class AirQualityException extends RuntimeException {

    public AirQualityException(String message) {
        super(message);
    }

    public AirQualityException(String message, Throwable cause) {
        super(message, cause);
    }
}

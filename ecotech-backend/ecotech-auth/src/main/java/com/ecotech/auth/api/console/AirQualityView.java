package com.ecotech.auth.api.console;

import com.ecotech.airquality.model.AirQualityReport;
import com.ecotech.airquality.service.AirQualityAdvisor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders an air quality report as console lines.
 */
@Component
public class AirQualityView {

    private static final String RULE = "=".repeat(70);
    private static final String THIN_RULE = "-".repeat(70);
    private static final String NOT_AVAILABLE = "N/A";

    private static final Map<String, String> POLLUTANT_NAMES = new LinkedHashMap<>();

    static {
        POLLUTANT_NAMES.put("pm25", "PM2.5 (fine particles)");
        POLLUTANT_NAMES.put("pm10", "PM10 (suspended particles)");
        POLLUTANT_NAMES.put("o3", "O3 (ozone)");
        POLLUTANT_NAMES.put("no2", "NO2 (nitrogen dioxide)");
        POLLUTANT_NAMES.put("so2", "SO2 (sulphur dioxide)");
        POLLUTANT_NAMES.put("co", "CO (carbon monoxide)");
    }

    private final AirQualityAdvisor advisor;

    public AirQualityView(AirQualityAdvisor advisor) {
        this.advisor = advisor;
    }

    public List<String> render(AirQualityReport report) {
        List<String> lines = new ArrayList<>();
        lines.add(RULE);
        lines.add(" AIR QUALITY REPORT - EcoTech Solutions");
        lines.add(RULE);
        lines.add("Station: " + report.getStation());
        lines.add("Measured at: " + orNotAvailable(report.getMeasuredAt()));
        if (!report.getCoordinates().isEmpty()) {
            lines.add("Coordinates: " + report.getCoordinates());
        }
        lines.add("");
        lines.add("AQI: " + orNotAvailable(report.getAqi()));
        lines.add("Category: " + report.getCategory().getLabel());
        lines.add("Danger level: " + report.getDangerLevel());
        lines.add("");
        lines.add("POLLUTANTS");
        lines.add(THIN_RULE);
        for (Map.Entry<String, String> pollutant : POLLUTANT_NAMES.entrySet()) {
            lines.add(String.format("  %-30s %s", pollutant.getValue(),
                    orNotAvailable(report.getPollutants().get(pollutant.getKey()))));
        }
        lines.add("");
        lines.add("WEATHER");
        lines.add(THIN_RULE);
        lines.add("  Temperature: " + withUnit(report.getTemperature(), " C"));
        lines.add("  Humidity: " + withUnit(report.getHumidity(), "%"));
        lines.add("  Pressure: " + withUnit(report.getPressure(), " hPa"));
        lines.add("");
        lines.add("RECOMMENDATIONS");
        lines.add(THIN_RULE);
        for (String recommendation : advisor.recommendationsFor(report.getAqi())) {
            lines.add("  * " + recommendation);
        }
        lines.add(RULE);
        return lines;
    }

    private static String orNotAvailable(Object value) {
        return value == null ? NOT_AVAILABLE : String.valueOf(value);
    }

    private static String withUnit(Double value, String unit) {
        return value == null ? NOT_AVAILABLE : value + unit;
    }
}

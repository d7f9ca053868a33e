// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/model/LocalSensorReading.java
package dev.devanks.agronomy.eto.model;

import dev.devanks.agronomy.eto.exception.InvalidSensorReadingException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Partial on-farm reading. Every measurement is optional; absent fields fall back to provider data.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LocalSensorReading {

    private LocalDate date;
    private Double temperatureMax;  // °C
    private Double temperatureMin;  // °C
    private Double humidity;        // %
    private Double windSpeed;       // m/s
    private Double solarRadiation;  // MJ/m²/day
    private Double rainfall;        // mm
    private SensorSource source;

    public boolean hasTemperaturePair() {
        return temperatureMax != null && temperatureMin != null;
    }

    /**
     * Rejects physically impossible readings before they reach any calculation.
     */
    public void validate() {
        if (hasTemperaturePair() && temperatureMax < temperatureMin) {
            throw new InvalidSensorReadingException(
                    "temperatureMax " + temperatureMax + " is below temperatureMin " + temperatureMin);
        }
        if (humidity != null && (humidity < 0 || humidity > 100)) {
            throw new InvalidSensorReadingException("humidity must be within [0, 100] but was " + humidity);
        }
        requireNonNegative("windSpeed", windSpeed);
        requireNonNegative("solarRadiation", solarRadiation);
        requireNonNegative("rainfall", rainfall);
    }

    private static void requireNonNegative(String field, Double value) {
        if (value != null && (value < 0 || value.isNaN())) {
            throw new InvalidSensorReadingException(field + " must be non-negative but was " + value);
        }
    }
}

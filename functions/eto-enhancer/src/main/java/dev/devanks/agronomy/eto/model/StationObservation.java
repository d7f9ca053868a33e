// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/model/StationObservation.java
package dev.devanks.agronomy.eto.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Ground-truth daily record from a local weather station or lysimeter.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StationObservation {
    private LocalDate date;
    private double referenceEt;    // mm/day
    private Double temperature;    // °C
    private Double humidity;       // %
    private Double windSpeed;      // m/s
    private Double solarRadiation; // MJ/m²/day
    private String source;         // station name or id
}

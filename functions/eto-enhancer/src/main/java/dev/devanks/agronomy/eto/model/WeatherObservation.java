// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/model/WeatherObservation.java
package dev.devanks.agronomy.eto.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * One provider's daily weather summary, normalized to metric units.
 */
@Value
@Builder(toBuilder = true)
public class WeatherObservation {

    LocalDate date;
    ProviderId provider;

    // Temperature (°C)
    double temperatureMax;
    double temperatureMin;
    double temperatureMean;

    // Relative humidity (%)
    double relativeHumidityMax;
    double relativeHumidityMin;
    double relativeHumidityMean;

    // Wind at 10 m (m/s)
    double windSpeed;
    double windSpeedMax;

    double precipitationSum;       // mm
    double shortwaveRadiationSum;  // MJ/m²/day
    double sunshineDuration;       // hours

    double et0FaoEvapotranspiration; // mm/day
    boolean etoCalculated;           // true when computed locally instead of supplied by the vendor

    double latitude;
    double longitude;
    double elevation;
    String timezone;
}

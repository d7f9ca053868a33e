// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/provider/WeatherProvider.java
package dev.devanks.agronomy.eto.provider;

import dev.devanks.agronomy.eto.model.HourlySolarData;
import dev.devanks.agronomy.eto.model.ProviderId;
import dev.devanks.agronomy.eto.model.WeatherObservation;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * A source of daily weather observations, normalized to metric units with an ETo value per day.
 * <p>
 * Implementations validate coordinates and date ranges before any network call and report every
 * vendor failure as {@link dev.devanks.agronomy.eto.exception.ProviderUnavailableException}.
 */
public interface WeatherProvider {

    ProviderId id();

    /**
     * @param startDate first day, inclusive; {@code null} means today (UTC)
     * @param endDate   last day, inclusive; {@code null} means today (UTC)
     * @return one observation per day, never empty
     */
    List<WeatherObservation> getWeatherData(double latitude, double longitude, LocalDate startDate, LocalDate endDate);

    WeatherObservation getCurrentWeatherData(double latitude, double longitude);

    List<WeatherObservation> getWeatherForecast(double latitude, double longitude, int days);

    /**
     * Hourly irradiance in lux for one day; empty when the provider does not offer it.
     */
    Optional<HourlySolarData> getHourlySolarRadiation(double latitude, double longitude, LocalDate date);
}

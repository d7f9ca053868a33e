// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/provider/WeatherbitWeatherProvider.java
package dev.devanks.agronomy.eto.provider;

import dev.devanks.agronomy.eto.client.WeatherbitApiClient;
import dev.devanks.agronomy.eto.config.EtoProperties;
import dev.devanks.agronomy.eto.exception.ProviderUnavailableException;
import dev.devanks.agronomy.eto.mapper.WeatherbitMapper;
import dev.devanks.agronomy.eto.model.ProviderId;
import dev.devanks.agronomy.eto.model.WeatherObservation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static dev.devanks.agronomy.eto.client.WeatherbitApiClient.MAX_FORECAST_DAYS;
import static dev.devanks.agronomy.eto.exception.ProviderUnavailableException.Reason.UNSUPPORTED_REQUEST;

/**
 * Agweather forecast endpoint: today plus up to seven more days, no history.
 */
@Component
@Slf4j
public class WeatherbitWeatherProvider extends KeyedWeatherProvider {

    private final WeatherbitApiClient apiClient;
    private final WeatherbitMapper mapper;

    public WeatherbitWeatherProvider(Clock clock, EtoProperties etoProperties,
                                     WeatherbitApiClient apiClient, WeatherbitMapper mapper) {
        super(clock, etoProperties);
        this.apiClient = apiClient;
        this.mapper = mapper;
    }

    @Override
    public ProviderId id() {
        return ProviderId.WEATHERBIT;
    }

    @Override
    protected List<WeatherObservation> fetch(double latitude, double longitude, LocalDate startDate, LocalDate endDate) {
        LocalDate today = today();
        if (startDate.isBefore(today)) {
            throw new ProviderUnavailableException(id(), UNSUPPORTED_REQUEST,
                    "historical data (start " + startDate + ") is not available from the agweather forecast");
        }
        long daysNeeded = ChronoUnit.DAYS.between(today, endDate) + 1;
        int days = (int) Math.min(daysNeeded, MAX_FORECAST_DAYS);
        if (daysNeeded > MAX_FORECAST_DAYS) {
            log.warn("Weatherbit forecast is capped at {} days; {} requested.", MAX_FORECAST_DAYS, daysNeeded);
        }

        List<WeatherObservation> observations = mapper.mapToObservations(
                apiClient.getAgWeatherForecast(latitude, longitude, days), latitude, longitude);
        return observations.stream()
                .filter(o -> !o.getDate().isBefore(startDate) && !o.getDate().isAfter(endDate))
                .toList();
    }

    @Override
    public List<WeatherObservation> getWeatherForecast(double latitude, double longitude, int days) {
        return super.getWeatherForecast(latitude, longitude, Math.min(days, MAX_FORECAST_DAYS));
    }
}

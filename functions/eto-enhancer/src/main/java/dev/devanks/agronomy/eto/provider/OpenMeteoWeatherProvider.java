// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/provider/OpenMeteoWeatherProvider.java
package dev.devanks.agronomy.eto.provider;

import dev.devanks.agronomy.eto.client.OpenMeteoApiClient;
import dev.devanks.agronomy.eto.mapper.OpenMeteoMapper;
import dev.devanks.agronomy.eto.model.Coordinates;
import dev.devanks.agronomy.eto.model.HourlySolarData;
import dev.devanks.agronomy.eto.model.ProviderId;
import dev.devanks.agronomy.eto.model.WeatherObservation;
import dev.devanks.agronomy.eto.model.vendor.OpenMeteoResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Free, keyless provider. The only one that supplies FAO-56 ETo directly and hourly irradiance.
 */
@Component
@Slf4j
public class OpenMeteoWeatherProvider extends AbstractWeatherProvider {

    private final OpenMeteoApiClient apiClient;
    private final OpenMeteoMapper mapper;

    public OpenMeteoWeatherProvider(Clock clock, OpenMeteoApiClient apiClient, OpenMeteoMapper mapper) {
        super(clock);
        this.apiClient = apiClient;
        this.mapper = mapper;
    }

    @Override
    public ProviderId id() {
        return ProviderId.OPEN_METEO;
    }

    @Override
    protected List<WeatherObservation> fetch(double latitude, double longitude, LocalDate startDate, LocalDate endDate) {
        OpenMeteoResponse response = apiClient.getDaily(latitude, longitude, OpenMeteoApiClient.DAILY_VARIABLES,
                startDate.toString(), endDate.toString());
        return mapper.mapToObservations(response);
    }

    @Override
    public Optional<HourlySolarData> getHourlySolarRadiation(double latitude, double longitude, LocalDate date) {
        Coordinates.validate(latitude, longitude);
        String day = (date != null ? date : today()).toString();
        OpenMeteoResponse response = callVendor(() -> apiClient.getHourly(latitude, longitude,
                OpenMeteoApiClient.HOURLY_SOLAR_VARIABLES, day, day));
        return mapper.mapToHourlySolar(response);
    }
}

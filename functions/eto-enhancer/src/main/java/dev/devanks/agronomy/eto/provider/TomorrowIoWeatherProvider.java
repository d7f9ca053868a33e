// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/provider/TomorrowIoWeatherProvider.java
package dev.devanks.agronomy.eto.provider;

import dev.devanks.agronomy.eto.client.TomorrowIoApiClient;
import dev.devanks.agronomy.eto.config.EtoProperties;
import dev.devanks.agronomy.eto.mapper.TomorrowIoMapper;
import dev.devanks.agronomy.eto.model.ProviderId;
import dev.devanks.agronomy.eto.model.WeatherObservation;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

@Component
public class TomorrowIoWeatherProvider extends KeyedWeatherProvider {

    private final TomorrowIoApiClient apiClient;
    private final TomorrowIoMapper mapper;

    public TomorrowIoWeatherProvider(Clock clock, EtoProperties etoProperties,
                                     TomorrowIoApiClient apiClient, TomorrowIoMapper mapper) {
        super(clock, etoProperties);
        this.apiClient = apiClient;
        this.mapper = mapper;
    }

    @Override
    public ProviderId id() {
        return ProviderId.TOMORROW_IO;
    }

    @Override
    protected List<WeatherObservation> fetch(double latitude, double longitude, LocalDate startDate, LocalDate endDate) {
        String location = String.format(Locale.ROOT, "%s,%s", latitude, longitude);
        return mapper.mapToObservations(apiClient.getDailyTimeline(location, TomorrowIoApiClient.DAILY_FIELDS,
                startDate + "T00:00:00Z", endDate + "T23:59:59Z"), latitude, longitude);
    }
}

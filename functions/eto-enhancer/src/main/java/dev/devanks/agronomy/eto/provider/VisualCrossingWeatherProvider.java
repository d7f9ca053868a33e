// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/provider/VisualCrossingWeatherProvider.java
package dev.devanks.agronomy.eto.provider;

import dev.devanks.agronomy.eto.client.VisualCrossingApiClient;
import dev.devanks.agronomy.eto.config.EtoProperties;
import dev.devanks.agronomy.eto.mapper.VisualCrossingMapper;
import dev.devanks.agronomy.eto.model.ProviderId;
import dev.devanks.agronomy.eto.model.WeatherObservation;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

@Component
public class VisualCrossingWeatherProvider extends KeyedWeatherProvider {

    private final VisualCrossingApiClient apiClient;
    private final VisualCrossingMapper mapper;

    public VisualCrossingWeatherProvider(Clock clock, EtoProperties etoProperties,
                                         VisualCrossingApiClient apiClient, VisualCrossingMapper mapper) {
        super(clock, etoProperties);
        this.apiClient = apiClient;
        this.mapper = mapper;
    }

    @Override
    public ProviderId id() {
        return ProviderId.VISUAL_CROSSING;
    }

    @Override
    protected List<WeatherObservation> fetch(double latitude, double longitude, LocalDate startDate, LocalDate endDate) {
        String location = String.format(Locale.ROOT, "%s,%s", latitude, longitude);
        return mapper.mapToObservations(
                apiClient.getTimeline(location, startDate.toString(), endDate.toString()), latitude, longitude);
    }
}

// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/provider/KeyedWeatherProvider.java
package dev.devanks.agronomy.eto.provider;

import dev.devanks.agronomy.eto.config.EtoProperties;
import dev.devanks.agronomy.eto.exception.ProviderUnavailableException;
import dev.devanks.agronomy.eto.model.Coordinates;
import dev.devanks.agronomy.eto.model.WeatherObservation;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

import static dev.devanks.agronomy.eto.exception.ProviderUnavailableException.Reason.MISSING_API_KEY;

/**
 * Base for vendors that need an API key. A missing key fails fast without a network call.
 */
public abstract class KeyedWeatherProvider extends AbstractWeatherProvider {

    private final EtoProperties etoProperties;

    protected KeyedWeatherProvider(Clock clock, EtoProperties etoProperties) {
        super(clock);
        this.etoProperties = etoProperties;
    }

    @Override
    public List<WeatherObservation> getWeatherData(double latitude, double longitude, LocalDate startDate, LocalDate endDate) {
        Coordinates.validate(latitude, longitude);
        if (!etoProperties.provider(id()).hasApiKey()) {
            throw new ProviderUnavailableException(id(), MISSING_API_KEY, "no API key configured");
        }
        return super.getWeatherData(latitude, longitude, startDate, endDate);
    }
}

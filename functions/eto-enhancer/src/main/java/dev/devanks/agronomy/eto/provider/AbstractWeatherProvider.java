// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/provider/AbstractWeatherProvider.java
package dev.devanks.agronomy.eto.provider;

import dev.devanks.agronomy.eto.exception.InvalidDateRangeException;
import dev.devanks.agronomy.eto.exception.ProviderUnavailableException;
import dev.devanks.agronomy.eto.model.Coordinates;
import dev.devanks.agronomy.eto.model.HourlySolarData;
import dev.devanks.agronomy.eto.model.WeatherObservation;
import feign.FeignException;
import feign.RetryableException;
import feign.codec.DecodeException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import static dev.devanks.agronomy.eto.exception.ProviderUnavailableException.Reason.INVALID_API_KEY;
import static dev.devanks.agronomy.eto.exception.ProviderUnavailableException.Reason.MALFORMED_RESPONSE;
import static dev.devanks.agronomy.eto.exception.ProviderUnavailableException.Reason.NO_DATA;
import static dev.devanks.agronomy.eto.exception.ProviderUnavailableException.Reason.OUTAGE;
import static dev.devanks.agronomy.eto.exception.ProviderUnavailableException.Reason.RATE_LIMITED;

/**
 * Argument validation, date defaulting and Feign error translation shared by all adapters.
 * Subclasses only implement {@link #fetch}.
 */
@Slf4j
public abstract class AbstractWeatherProvider implements WeatherProvider {

    private final Clock clock;

    protected AbstractWeatherProvider(Clock clock) {
        this.clock = clock;
    }

    /**
     * Vendor call for an already validated, non-null range.
     */
    protected abstract List<WeatherObservation> fetch(double latitude, double longitude, LocalDate startDate, LocalDate endDate);

    @Override
    public List<WeatherObservation> getWeatherData(double latitude, double longitude, LocalDate startDate, LocalDate endDate) {
        Coordinates.validate(latitude, longitude);
        LocalDate start = startDate != null ? startDate : today();
        LocalDate end = endDate != null ? endDate : today();
        if (start.isAfter(end)) {
            throw new InvalidDateRangeException(String.format("Start date %s is after end date %s", start, end));
        }

        log.debug("Fetching {} observations for ({}, {}) from {} to {}.", id().getTag(), latitude, longitude, start, end);
        List<WeatherObservation> observations = callVendor(() -> fetch(latitude, longitude, start, end));
        if (observations == null || observations.isEmpty()) {
            throw new ProviderUnavailableException(id(), NO_DATA,
                    String.format("no observations for %s..%s", start, end));
        }
        log.info("Received {} daily observations from {}.", observations.size(), id().getTag());
        return observations;
    }

    @Override
    public WeatherObservation getCurrentWeatherData(double latitude, double longitude) {
        LocalDate today = today();
        return getWeatherData(latitude, longitude, today, today).get(0);
    }

    @Override
    public List<WeatherObservation> getWeatherForecast(double latitude, double longitude, int days) {
        if (days < 1) {
            throw new InvalidDateRangeException("Forecast length must be at least 1 day but was " + days);
        }
        LocalDate today = today();
        return getWeatherData(latitude, longitude, today, today.plusDays(days - 1L));
    }

    @Override
    public Optional<HourlySolarData> getHourlySolarRadiation(double latitude, double longitude, LocalDate date) {
        Coordinates.validate(latitude, longitude);
        return Optional.empty();
    }

    protected LocalDate today() {
        return LocalDate.now(clock);
    }

    /**
     * Runs a vendor call, turning Feign failures into {@link ProviderUnavailableException}.
     */
    protected <T> T callVendor(Supplier<T> call) {
        try {
            return call.get();
        } catch (DecodeException e) {
            log.error("{} returned an undecodable payload: {}", id().getTag(), e.getMessage(), e);
            throw new ProviderUnavailableException(id(), MALFORMED_RESPONSE, e.getMessage(), e);
        } catch (RetryableException e) {
            log.error("{} could not be reached: {}", id().getTag(), e.getMessage(), e);
            throw new ProviderUnavailableException(id(), OUTAGE, e.getMessage(), e);
        } catch (FeignException e) {
            log.error("{} API call failed (Feign): Status={}, Body={}", id().getTag(), e.status(), e.contentUTF8(), e);
            throw new ProviderUnavailableException(id(), reasonFor(e.status()), "HTTP " + e.status(), e);
        }
    }

    static ProviderUnavailableException.Reason reasonFor(int status) {
        return switch (status) {
            case 401, 403 -> INVALID_API_KEY;
            case 429 -> RATE_LIMITED;
            default -> OUTAGE;
        };
    }
}

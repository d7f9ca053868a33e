// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/mapper/TomorrowIoMapper.java
package dev.devanks.agronomy.eto.mapper;

import dev.devanks.agronomy.eto.calculation.PenmanMonteithCalculator;
import dev.devanks.agronomy.eto.exception.ProviderUnavailableException;
import dev.devanks.agronomy.eto.model.ProviderId;
import dev.devanks.agronomy.eto.model.WeatherObservation;
import dev.devanks.agronomy.eto.model.vendor.TomorrowIoResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;

import static dev.devanks.agronomy.eto.calculation.UnitConversions.wattsToMegajoulesPerDay;
import static dev.devanks.agronomy.eto.exception.ProviderUnavailableException.Reason.MALFORMED_RESPONSE;

@Component
@Slf4j
public class TomorrowIoMapper {

    private static final ProviderId PROVIDER = ProviderId.TOMORROW_IO;
    private static final double HUMIDITY_SPREAD = 12;
    private static final int HOURS_PER_DAY = 24;

    public List<WeatherObservation> mapToObservations(TomorrowIoResponse response, double latitude, double longitude) {
        if (response == null || response.getData() == null || response.getData().getTimelines() == null
                || response.getData().getTimelines().isEmpty()) {
            throw new ProviderUnavailableException(PROVIDER, MALFORMED_RESPONSE, "response has no timelines");
        }
        TomorrowIoResponse.Timeline timeline = response.getData().getTimelines().get(0);
        if (timeline.getIntervals() == null) {
            throw new ProviderUnavailableException(PROVIDER, MALFORMED_RESPONSE, "daily timeline has no intervals");
        }
        double lat = response.getLocation() != null && response.getLocation().getLat() != null
                ? response.getLocation().getLat() : latitude;
        double lon = response.getLocation() != null && response.getLocation().getLon() != null
                ? response.getLocation().getLon() : longitude;

        return timeline.getIntervals().stream()
                .map(interval -> mapInterval(interval, lat, lon))
                .toList();
    }

    private WeatherObservation mapInterval(TomorrowIoResponse.Interval interval, double lat, double lon) {
        TomorrowIoResponse.Values values = interval.getValues();
        if (interval.getStartTime() == null || values == null || values.getHumidity() == null
                || (values.getTemperature() == null && (values.getTemperatureMax() == null || values.getTemperatureMin() == null))) {
            throw new ProviderUnavailableException(PROVIDER, MALFORMED_RESPONSE,
                    "interval is missing time, temperature or humidity: " + interval);
        }
        double tempMax = values.getTemperatureMax() != null ? values.getTemperatureMax() : values.getTemperature();
        double tempMin = values.getTemperatureMin() != null ? values.getTemperatureMin() : values.getTemperature();
        double tempMean = values.getTemperatureMax() != null && values.getTemperatureMin() != null
                ? (tempMax + tempMin) / 2
                : values.getTemperature();
        double humidity = values.getHumidity();
        double wind = values.getWindSpeed() != null ? values.getWindSpeed() : 0.0;
        double ghi = values.getSolarGHI() != null ? values.getSolarGHI() : 0.0;
        double solarEnergy = wattsToMegajoulesPerDay(ghi);

        boolean vendorEto = values.getEvapotranspiration() != null && values.getEvapotranspiration() > 0;
        double eto = vendorEto
                ? values.getEvapotranspiration()
                : PenmanMonteithCalculator.eto(tempMax, tempMin, humidity, wind, solarEnergy);

        return WeatherObservation.builder()
                .date(parseDate(interval.getStartTime()))
                .provider(PROVIDER)
                .temperatureMax(tempMax)
                .temperatureMin(tempMin)
                .temperatureMean(tempMean)
                .relativeHumidityMax(Math.min(100, humidity + HUMIDITY_SPREAD))
                .relativeHumidityMin(Math.max(0, humidity - HUMIDITY_SPREAD))
                .relativeHumidityMean(humidity)
                .windSpeed(wind)
                .windSpeedMax(wind)
                // precipitationIntensity is mm/h
                .precipitationSum(values.getPrecipitationIntensity() != null
                        ? values.getPrecipitationIntensity() * HOURS_PER_DAY : 0.0)
                .shortwaveRadiationSum(solarEnergy)
                .sunshineDuration(ghi / 1000 * 12)
                .et0FaoEvapotranspiration(eto)
                .etoCalculated(!vendorEto)
                .latitude(lat)
                .longitude(lon)
                .elevation(0.0)
                .timezone("UTC")
                .build();
    }

    private static LocalDate parseDate(String value) {
        try {
            return OffsetDateTime.parse(value).toLocalDate();
        } catch (DateTimeParseException e) {
            log.debug("startTime '{}' is not an offset timestamp, trying plain date.", value);
            try {
                return LocalDate.parse(value);
            } catch (DateTimeParseException inner) {
                throw new ProviderUnavailableException(PROVIDER, MALFORMED_RESPONSE, "unparsable startTime '" + value + "'", inner);
            }
        }
    }
}

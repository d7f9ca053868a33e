// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/mapper/VisualCrossingMapper.java
package dev.devanks.agronomy.eto.mapper;

import dev.devanks.agronomy.eto.calculation.PenmanMonteithCalculator;
import dev.devanks.agronomy.eto.exception.ProviderUnavailableException;
import dev.devanks.agronomy.eto.model.ProviderId;
import dev.devanks.agronomy.eto.model.WeatherObservation;
import dev.devanks.agronomy.eto.model.vendor.VisualCrossingResponse;
import com.google.common.annotations.VisibleForTesting;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.List;

import static dev.devanks.agronomy.eto.calculation.UnitConversions.kmhToMs;
import static dev.devanks.agronomy.eto.exception.ProviderUnavailableException.Reason.MALFORMED_RESPONSE;

@Component
@Slf4j
public class VisualCrossingMapper {

    private static final ProviderId PROVIDER = ProviderId.VISUAL_CROSSING;
    private static final double HUMIDITY_SPREAD = 15;
    private static final double DEFAULT_DAY_LENGTH_HOURS = 12;

    /**
     * Visual Crossing has no ETo field, so every row is computed with Penman-Monteith.
     */
    public List<WeatherObservation> mapToObservations(VisualCrossingResponse response, double latitude, double longitude) {
        if (response == null || response.getDays() == null) {
            throw new ProviderUnavailableException(PROVIDER, MALFORMED_RESPONSE, "response has no days");
        }
        double lat = response.getLatitude() != null ? response.getLatitude() : latitude;
        double lon = response.getLongitude() != null ? response.getLongitude() : longitude;

        return response.getDays().stream()
                .map(day -> mapDay(day, lat, lon, response.getTimezone()))
                .toList();
    }

    private WeatherObservation mapDay(VisualCrossingResponse.Day day, double lat, double lon, String timezone) {
        if (day.getDatetime() == null || day.getTempmax() == null || day.getTempmin() == null || day.getHumidity() == null) {
            throw new ProviderUnavailableException(PROVIDER, MALFORMED_RESPONSE,
                    "day is missing datetime, temperature or humidity: " + day);
        }
        double tempMax = day.getTempmax();
        double tempMin = day.getTempmin();
        double humidity = day.getHumidity();
        double wind = day.getWindspeed() != null ? kmhToMs(day.getWindspeed()) : 0.0;
        double solarEnergy = day.getSolarenergy() != null ? day.getSolarenergy() : 0.0;

        return WeatherObservation.builder()
                .date(parseDate(day.getDatetime()))
                .provider(PROVIDER)
                .temperatureMax(tempMax)
                .temperatureMin(tempMin)
                .temperatureMean(day.getTemp() != null ? day.getTemp() : (tempMax + tempMin) / 2)
                .relativeHumidityMax(Math.min(100, humidity + HUMIDITY_SPREAD))
                .relativeHumidityMin(Math.max(0, humidity - HUMIDITY_SPREAD))
                .relativeHumidityMean(humidity)
                .windSpeed(wind)
                .windSpeedMax(wind)
                .precipitationSum(day.getPrecip() != null ? day.getPrecip() : 0.0)
                .shortwaveRadiationSum(solarEnergy)
                .sunshineDuration(dayLengthHours(day.getSunrise(), day.getSunset()))
                .et0FaoEvapotranspiration(PenmanMonteithCalculator.eto(tempMax, tempMin, humidity, wind, solarEnergy))
                .etoCalculated(true)
                .latitude(lat)
                .longitude(lon)
                .elevation(0.0)
                .timezone(timezone)
                .build();
    }

    @VisibleForTesting
    static double dayLengthHours(String sunrise, String sunset) {
        if (sunrise == null || sunset == null) {
            return DEFAULT_DAY_LENGTH_HOURS;
        }
        try {
            Duration daylight = Duration.between(LocalTime.parse(sunrise), LocalTime.parse(sunset));
            if (daylight.isNegative()) {
                return DEFAULT_DAY_LENGTH_HOURS;
            }
            return daylight.getSeconds() / 3600.0;
        } catch (DateTimeParseException e) {
            log.warn("Could not parse sunrise '{}' / sunset '{}', assuming {} h of daylight.", sunrise, sunset, DEFAULT_DAY_LENGTH_HOURS);
            return DEFAULT_DAY_LENGTH_HOURS;
        }
    }

    private static LocalDate parseDate(String value) {
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new ProviderUnavailableException(PROVIDER, MALFORMED_RESPONSE, "unparsable date '" + value + "'", e);
        }
    }
}

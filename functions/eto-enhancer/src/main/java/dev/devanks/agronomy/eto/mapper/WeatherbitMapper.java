// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/mapper/WeatherbitMapper.java
package dev.devanks.agronomy.eto.mapper;

import dev.devanks.agronomy.eto.calculation.PenmanMonteithCalculator;
import dev.devanks.agronomy.eto.exception.ProviderUnavailableException;
import dev.devanks.agronomy.eto.model.ProviderId;
import dev.devanks.agronomy.eto.model.WeatherObservation;
import dev.devanks.agronomy.eto.model.vendor.WeatherbitResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;

import static dev.devanks.agronomy.eto.calculation.UnitConversions.wattsToMegajoulesPerDay;
import static dev.devanks.agronomy.eto.exception.ProviderUnavailableException.Reason.MALFORMED_RESPONSE;

@Component
@Slf4j
public class WeatherbitMapper {

    private static final ProviderId PROVIDER = ProviderId.WEATHERBIT;
    private static final double HUMIDITY_SPREAD = 10;

    public List<WeatherObservation> mapToObservations(WeatherbitResponse response, double latitude, double longitude) {
        if (response == null || response.getData() == null) {
            throw new ProviderUnavailableException(PROVIDER, MALFORMED_RESPONSE, "response has no data array");
        }
        double lat = parseCoordinate(response.getLat(), latitude);
        double lon = parseCoordinate(response.getLon(), longitude);

        return response.getData().stream()
                .map(day -> mapDay(day, lat, lon, response.getTimezone()))
                .toList();
    }

    private WeatherObservation mapDay(WeatherbitResponse.Day day, double lat, double lon, String timezone) {
        if (day.getDatetime() == null || day.getMaxTemp() == null || day.getMinTemp() == null
                || day.getRelativeHumidity() == null) {
            throw new ProviderUnavailableException(PROVIDER, MALFORMED_RESPONSE,
                    "day is missing datetime, temperature or humidity: " + day);
        }
        double tempMax = day.getMaxTemp();
        double tempMin = day.getMinTemp();
        double humidity = day.getRelativeHumidity();
        double wind = day.getWindSpeed() != null ? day.getWindSpeed() : 0.0;
        double solarWatts = day.getSolarRadiation() != null ? day.getSolarRadiation() : 0.0;
        double solarEnergy = wattsToMegajoulesPerDay(solarWatts);

        // Agweather leaves evapotranspiration empty (or 0) on some plans
        boolean vendorEto = day.getEvapotranspiration() != null && day.getEvapotranspiration() > 0;
        double eto = vendorEto
                ? day.getEvapotranspiration()
                : PenmanMonteithCalculator.eto(tempMax, tempMin, humidity, wind, solarEnergy);

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
                .sunshineDuration(solarWatts / 1000 * 12) // rough: 1000 W/m² for 12 h is a full sunny day
                .et0FaoEvapotranspiration(eto)
                .etoCalculated(!vendorEto)
                .latitude(lat)
                .longitude(lon)
                .elevation(0.0)
                .timezone(timezone)
                .build();
    }

    private static double parseCoordinate(String value, double fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            log.warn("Weatherbit returned unparsable coordinate '{}', using requested {}.", value, fallback);
            return fallback;
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

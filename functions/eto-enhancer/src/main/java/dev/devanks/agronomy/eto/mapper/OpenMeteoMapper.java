// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/mapper/OpenMeteoMapper.java
package dev.devanks.agronomy.eto.mapper;

import dev.devanks.agronomy.eto.calculation.PenmanMonteithCalculator;
import dev.devanks.agronomy.eto.exception.ProviderUnavailableException;
import dev.devanks.agronomy.eto.model.HourlySolarData;
import dev.devanks.agronomy.eto.model.ProviderId;
import dev.devanks.agronomy.eto.model.WeatherObservation;
import dev.devanks.agronomy.eto.model.vendor.OpenMeteoResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static dev.devanks.agronomy.eto.calculation.UnitConversions.secondsToHours;
import static dev.devanks.agronomy.eto.calculation.UnitConversions.wattsToLux;
import static dev.devanks.agronomy.eto.exception.ProviderUnavailableException.Reason.MALFORMED_RESPONSE;

@Component
@Slf4j
public class OpenMeteoMapper {

    private static final ProviderId PROVIDER = ProviderId.OPEN_METEO;

    public List<WeatherObservation> mapToObservations(OpenMeteoResponse response) {
        if (response == null || response.getDaily() == null || response.getDaily().getTime() == null) {
            throw malformed("response has no daily block");
        }
        OpenMeteoResponse.Daily daily = response.getDaily();
        int days = daily.getTime().size();
        requireLength(daily.getTemperatureMax(), days, "temperature_2m_max");
        requireLength(daily.getTemperatureMin(), days, "temperature_2m_min");
        requireLength(daily.getRelativeHumidityMean(), days, "relative_humidity_2m_mean");
        requireLength(daily.getWindSpeedMax(), days, "wind_speed_10m_max");
        requireLength(daily.getShortwaveRadiationSum(), days, "shortwave_radiation_sum");

        List<WeatherObservation> observations = new ArrayList<>(days);
        for (int i = 0; i < days; i++) {
            observations.add(mapDay(response, daily, i));
        }
        log.debug("Mapped {} Open-Meteo daily rows.", observations.size());
        return observations;
    }

    private WeatherObservation mapDay(OpenMeteoResponse response, OpenMeteoResponse.Daily daily, int i) {
        double tempMax = required(daily.getTemperatureMax(), i, "temperature_2m_max");
        double tempMin = required(daily.getTemperatureMin(), i, "temperature_2m_min");
        double humidityMean = required(daily.getRelativeHumidityMean(), i, "relative_humidity_2m_mean");
        double wind = orDefault(daily.getWindSpeedMax(), i, 0.0);
        double radiation = orDefault(daily.getShortwaveRadiationSum(), i, 0.0);

        Double vendorEto = at(daily.getEt0FaoEvapotranspiration(), i);
        double eto = vendorEto != null
                ? vendorEto
                : PenmanMonteithCalculator.eto(tempMax, tempMin, humidityMean, wind, radiation);

        return WeatherObservation.builder()
                .date(parseDate(daily.getTime().get(i)))
                .provider(PROVIDER)
                .temperatureMax(tempMax)
                .temperatureMin(tempMin)
                .temperatureMean(orDefault(daily.getTemperatureMean(), i, (tempMax + tempMin) / 2))
                .relativeHumidityMax(orDefault(daily.getRelativeHumidityMax(), i, humidityMean))
                .relativeHumidityMin(orDefault(daily.getRelativeHumidityMin(), i, humidityMean))
                .relativeHumidityMean(humidityMean)
                .windSpeed(wind)
                .windSpeedMax(wind)
                .precipitationSum(orDefault(daily.getPrecipitationSum(), i, 0.0))
                .shortwaveRadiationSum(radiation)
                .sunshineDuration(secondsToHours(orDefault(daily.getSunshineDuration(), i, 0.0)))
                .et0FaoEvapotranspiration(eto)
                .etoCalculated(vendorEto == null)
                .latitude(response.getLatitude() != null ? response.getLatitude() : 0.0)
                .longitude(response.getLongitude() != null ? response.getLongitude() : 0.0)
                .elevation(response.getElevation() != null ? response.getElevation() : 0.0)
                .timezone(response.getTimezone())
                .build();
    }

    /**
     * Hourly shortwave radiation converted to lux. Night hours (0 lux) are excluded from the average.
     */
    public Optional<HourlySolarData> mapToHourlySolar(OpenMeteoResponse response) {
        if (response == null || response.getHourly() == null
                || response.getHourly().getShortwaveRadiation() == null
                || response.getHourly().getShortwaveRadiation().isEmpty()) {
            log.warn("Open-Meteo hourly response carried no shortwave radiation values.");
            return Optional.empty();
        }
        List<Double> hourlyLux = response.getHourly().getShortwaveRadiation().stream()
                .map(watts -> watts != null ? wattsToLux(watts) : 0.0)
                .toList();

        double min = hourlyLux.stream().mapToDouble(Double::doubleValue).min().orElse(0);
        double max = hourlyLux.stream().mapToDouble(Double::doubleValue).max().orElse(0);
        double avgDaylight = hourlyLux.stream()
                .mapToDouble(Double::doubleValue)
                .filter(lux -> lux > 0)
                .average()
                .orElse(0);

        return Optional.of(HourlySolarData.builder()
                .minLux(min)
                .maxLux(max)
                .avgLux(avgDaylight)
                .hourlyLux(hourlyLux)
                .build());
    }

    private static void requireLength(List<Double> values, int expected, String field) {
        if (values == null || values.size() != expected) {
            throw malformed(String.format("daily '%s' has %s values, expected %d",
                    field, values == null ? "no" : String.valueOf(values.size()), expected));
        }
    }

    private static double required(List<Double> values, int i, String field) {
        Double value = at(values, i);
        if (value == null) {
            throw malformed(String.format("daily '%s' is null at index %d", field, i));
        }
        return value;
    }

    private static double orDefault(List<Double> values, int i, double fallback) {
        Double value = at(values, i);
        return value != null ? value : fallback;
    }

    private static Double at(List<Double> values, int i) {
        return values != null && i < values.size() ? values.get(i) : null;
    }

    private static LocalDate parseDate(String value) {
        if (value == null) {
            throw malformed("daily 'time' contains a null date");
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new ProviderUnavailableException(PROVIDER, MALFORMED_RESPONSE, "unparsable date '" + value + "'", e);
        }
    }

    private static ProviderUnavailableException malformed(String detail) {
        return new ProviderUnavailableException(PROVIDER, MALFORMED_RESPONSE, detail);
    }
}

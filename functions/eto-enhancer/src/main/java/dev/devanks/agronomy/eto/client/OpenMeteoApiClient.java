// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/client/OpenMeteoApiClient.java
package dev.devanks.agronomy.eto.client;

import dev.devanks.agronomy.eto.config.OpenMeteoApiClientConfig;
import dev.devanks.agronomy.eto.model.vendor.OpenMeteoResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;

/**
 * Feign client for the keyless Open-Meteo forecast API.
 * Variables are requested as comma-separated lists; wind speed is always requested in m/s.
 */
@FeignClient(name = "open-meteo-api",
        url = "${eto.providers.open-meteo.url}",
        configuration = OpenMeteoApiClientConfig.class)
public interface OpenMeteoApiClient {

    String DAILY_VARIABLES = "temperature_2m_max,temperature_2m_min,temperature_2m_mean,"
            + "relative_humidity_2m_max,relative_humidity_2m_min,relative_humidity_2m_mean,"
            + "wind_speed_10m_max,precipitation_sum,shortwave_radiation_sum,sunshine_duration,"
            + "et0_fao_evapotranspiration";

    String HOURLY_SOLAR_VARIABLES = "shortwave_radiation";

    @GetMapping("/v1/forecast?timezone=auto&wind_speed_unit=ms")
    OpenMeteoResponse getDaily(@RequestParam("latitude") double latitude,
                               @RequestParam("longitude") double longitude,
                               @RequestParam("daily") String daily,
                               @RequestParam("start_date") String startDate,
                               @RequestParam("end_date") String endDate);

    @GetMapping("/v1/forecast?timezone=auto")
    OpenMeteoResponse getHourly(@RequestParam("latitude") double latitude,
                                @RequestParam("longitude") double longitude,
                                @RequestParam("hourly") String hourly,
                                @RequestParam("start_date") String startDate,
                                @RequestParam("end_date") String endDate);
}

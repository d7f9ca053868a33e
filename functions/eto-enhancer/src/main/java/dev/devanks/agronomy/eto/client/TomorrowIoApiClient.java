// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/client/TomorrowIoApiClient.java
package dev.devanks.agronomy.eto.client;

import dev.devanks.agronomy.eto.config.TomorrowIoApiClientConfig;
import dev.devanks.agronomy.eto.model.vendor.TomorrowIoResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;

@FeignClient(name = "tomorrow-io-api",
        url = "${eto.providers.tomorrow-io.url}",
        configuration = TomorrowIoApiClientConfig.class)
public interface TomorrowIoApiClient {

    String DAILY_FIELDS = "temperature,temperatureMax,temperatureMin,humidity,windSpeed,"
            + "precipitationIntensity,solarGHI,evapotranspiration";

    // location is "lat,lon"; times are ISO-8601 instants
    @GetMapping("/v4/timelines?timesteps=1d&units=metric")
    TomorrowIoResponse getDailyTimeline(@RequestParam("location") String location,
                                        @RequestParam("fields") String fields,
                                        @RequestParam("startTime") String startTime,
                                        @RequestParam("endTime") String endTime);
}

// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/client/WeatherbitApiClient.java
package dev.devanks.agronomy.eto.client;

import dev.devanks.agronomy.eto.config.WeatherbitApiClientConfig;
import dev.devanks.agronomy.eto.model.vendor.WeatherbitResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;

@FeignClient(name = "weatherbit-api",
        url = "${eto.providers.weatherbit.url}",
        configuration = WeatherbitApiClientConfig.class)
public interface WeatherbitApiClient {

    /**
     * Agricultural forecast, up to {@value #MAX_FORECAST_DAYS} days starting today.
     */
    @GetMapping("/v2.0/forecast/agweather")
    WeatherbitResponse getAgWeatherForecast(@RequestParam("lat") double latitude,
                                            @RequestParam("lon") double longitude,
                                            @RequestParam("days") int days);

    int MAX_FORECAST_DAYS = 8;
}

// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/client/VisualCrossingApiClient.java
package dev.devanks.agronomy.eto.client;

import dev.devanks.agronomy.eto.config.VisualCrossingApiClientConfig;
import dev.devanks.agronomy.eto.model.vendor.VisualCrossingResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;

/**
 * Timeline API. The API key is appended by VisualCrossingApiClientConfig.
 */
@FeignClient(name = "visual-crossing-api",
        url = "${eto.providers.visual-crossing.url}",
        configuration = VisualCrossingApiClientConfig.class)
public interface VisualCrossingApiClient {

    // location is "lat,lon"
    @GetMapping("/{location}/{startDate}/{endDate}?unitGroup=metric&include=days&contentType=json")
    VisualCrossingResponse getTimeline(@PathVariable("location") String location,
                                       @PathVariable("startDate") String startDate,
                                       @PathVariable("endDate") String endDate);
}

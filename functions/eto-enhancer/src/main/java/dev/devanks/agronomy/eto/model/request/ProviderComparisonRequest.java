// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/model/request/ProviderComparisonRequest.java
package dev.devanks.agronomy.eto.model.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.devanks.agronomy.eto.model.ProviderId;
import dev.devanks.agronomy.eto.model.StationObservation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProviderComparisonRequest {
    private List<ProviderId> providers; // empty means every registered provider
    private List<StationObservation> stationObservations;
    private double latitude;
    private double longitude;
}

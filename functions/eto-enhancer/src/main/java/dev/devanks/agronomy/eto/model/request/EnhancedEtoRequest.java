// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/model/request/EnhancedEtoRequest.java
package dev.devanks.agronomy.eto.model.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.devanks.agronomy.eto.model.HistoricalValidation;
import dev.devanks.agronomy.eto.model.LocalSensorReading;
import dev.devanks.agronomy.eto.model.ProviderPerformance;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class EnhancedEtoRequest {
    private double latitude;
    private double longitude;
    private String date; // yyyy-MM-dd, defaults to today (UTC)
    private boolean useEnsemble;
    private Map<String, Double> providerWeights; // keyed by provider tag
    private LocalSensorReading localSensorReading;
    private boolean useRegionalCalibration;
    private List<HistoricalValidation> historicalValidations;
    private String pinnedProvider;
    private Map<String, ProviderPerformance> providerPerformance;
}

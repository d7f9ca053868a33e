// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/model/EnhancementOptions.java
package dev.devanks.agronomy.eto.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnhancementOptions {

    private boolean useEnsemble;

    // Null means simple averaging
    private Map<ProviderId, Double> providerWeights;

    private LocalSensorReading localSensorReading;

    private boolean useRegionalCalibration;

    @Builder.Default
    private List<HistoricalValidation> historicalValidations = new ArrayList<>();

    // Overrides provider selection on the single-provider path
    private ProviderId pinnedProvider;

    @Builder.Default
    private Map<ProviderId, ProviderPerformance> providerPerformance = new EnumMap<>(ProviderId.class);

    public static EnhancementOptions defaults() {
        return EnhancementOptions.builder().build();
    }
}

// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/model/EnhancedEToResult.java
package dev.devanks.agronomy.eto.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Final ETo estimate with the audit trail of how it was produced. Every result carries a
 * confidence and an estimated error so consumers can decide whether to warn the farmer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnhancedEToResult {

    private double eto;        // mm/day
    private double confidence; // 0..1
    private AccuracyMethod method;

    @Builder.Default
    private List<Contributor> contributors = new ArrayList<>();

    @Builder.Default
    private List<Correction> corrections = new ArrayList<>();

    private ResultMetadata metadata;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Contributor {
        private ProviderId provider;
        private double eto;
        private double weight;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Correction {
        private String type;
        private double adjustment; // mm/day (or the unit of the substituted input)
        private String reason;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ResultMetadata {
        private int providersUsed;
        private boolean hasLocalSensors;
        private boolean hasRegionalCalibration;
        private double estimatedError; // ±%
    }
}

package dev.devanks.agronomy.eto.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BiasReport {
    boolean hasBias;
    double biasAmount; // mm/day, positive means the provider overestimates
    double confidence;
    int sampleSize;

    public static BiasReport insufficient(int sampleSize) {
        return BiasReport.builder().hasBias(false).biasAmount(0).confidence(0).sampleSize(sampleSize).build();
    }
}

package dev.devanks.agronomy.eto.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ValidationStats {
    ProviderId provider;
    double meanBias;        // mm/day
    double meanBiasPercent; // %
    double rmse;
    double mae;
    double r2;
    int sampleSize;
    String recommendation;

    public boolean hasSamples() {
        return sampleSize > 0;
    }
}

// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/model/RegionalCalibration.java
package dev.devanks.agronomy.eto.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Learned correction for one (region cell, provider, season). Instances are immutable snapshots;
 * every online update produces a new one.
 */
@Value
@Builder(toBuilder = true)
public class RegionalCalibration {

    public static final double MAX_CONFIDENCE = 0.95;
    public static final int SATURATION_SAMPLES = 30;

    String regionCellId;
    ProviderId provider;
    Season season;
    double correctionFactor; // multiplicative
    double bias;             // additive, mm/day
    int sampleSize;
    double confidence;
    Instant lastUpdated;

    public CalibrationKey key() {
        return new CalibrationKey(regionCellId, provider, season);
    }

    public static RegionalCalibration initial(CalibrationKey key, Instant now) {
        return RegionalCalibration.builder()
                .regionCellId(key.getRegionCellId())
                .provider(key.getProvider())
                .season(key.getSeason())
                .correctionFactor(1.0)
                .bias(0.0)
                .sampleSize(0)
                .confidence(0.0)
                .lastUpdated(now)
                .build();
    }

    public static double confidenceFor(int sampleSize) {
        return Math.min(MAX_CONFIDENCE, (double) sampleSize / SATURATION_SAMPLES);
    }
}

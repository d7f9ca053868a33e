// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/service/BiasDetector.java
package dev.devanks.agronomy.eto.service;

import dev.devanks.agronomy.eto.model.BiasReport;
import dev.devanks.agronomy.eto.model.BiasSample;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

import static dev.devanks.agronomy.eto.calculation.UnitConversions.round;

@Service
@Slf4j
public class BiasDetector {

    static final int MIN_VALIDATED = 3;
    static final double BIAS_THRESHOLD = 0.5; // mm/day

    /**
     * Systematic offset between provider ETo and validated ETo. Samples without a validated value
     * are ignored; fewer than {@value #MIN_VALIDATED} remaining gives a no-bias, zero-confidence report.
     */
    public BiasReport detect(List<BiasSample> samples) {
        List<Double> biases = samples == null ? List.of() : samples.stream()
                .filter(s -> s.getValidatedETo() != null)
                .map(s -> s.getApiETo() - s.getValidatedETo())
                .toList();
        if (biases.size() < MIN_VALIDATED) {
            return BiasReport.insufficient(biases.size());
        }

        double mean = biases.stream().mapToDouble(Double::doubleValue).average().orElse(0);
        double variance = biases.stream().mapToDouble(b -> (b - mean) * (b - mean)).average().orElse(0);
        double stdDev = Math.sqrt(variance);
        double confidence = Math.max(0, 1 - stdDev / Math.max(Math.abs(mean), 1));
        boolean hasBias = Math.abs(mean) > BIAS_THRESHOLD;
        if (hasBias) {
            log.info("Systematic bias of {} mm/day detected over {} samples.", round(mean, 2), biases.size());
        }

        return BiasReport.builder()
                .hasBias(hasBias)
                .biasAmount(round(mean, 2))
                .confidence(round(confidence, 2))
                .sampleSize(biases.size())
                .build();
    }
}

// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/service/PatternCorrectionLearner.java
package dev.devanks.agronomy.eto.service;

import dev.devanks.agronomy.eto.model.HistoricalValidation;
import dev.devanks.agronomy.eto.model.PatternCorrection;
import dev.devanks.agronomy.eto.model.Season;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

import static dev.devanks.agronomy.eto.calculation.UnitConversions.round;

/**
 * Nearest-conditions correction: scales ETo by the mean measured/API ratio of past days with
 * similar temperature and humidity in the same season.
 */
@Service
@Slf4j
public class PatternCorrectionLearner {

    static final int MIN_HISTORY = 10;
    static final double TEMPERATURE_WINDOW = 5;   // °C
    static final double HUMIDITY_WINDOW = 15;     // %
    static final int FULL_CONFIDENCE_MATCHES = 20;
    static final double MAX_CONFIDENCE = 0.9;

    public PatternCorrection correct(double eto, double temperature, double humidity, Season season,
                                     List<HistoricalValidation> history) {
        if (history == null || history.size() < MIN_HISTORY) {
            log.debug("Only {} historical validations, pattern correction skipped.", history == null ? 0 : history.size());
            return new PatternCorrection(eto, 0.3, 0);
        }

        List<HistoricalValidation> similar = history.stream()
                .filter(h -> Math.abs(h.getTemp() - temperature) < TEMPERATURE_WINDOW)
                .filter(h -> Math.abs(h.getHumidity() - humidity) < HUMIDITY_WINDOW)
                .filter(h -> h.getSeason() == season)
                .filter(h -> h.getApiETo() > 0)
                .toList();
        if (similar.isEmpty()) {
            log.debug("No historical day matches T={} RH={} in {}.", temperature, humidity, season);
            return new PatternCorrection(eto, 0.5, 0);
        }

        double meanRatio = similar.stream()
                .mapToDouble(h -> h.getMeasuredETo() / h.getApiETo())
                .average()
                .orElse(1.0);
        double confidence = Math.min(MAX_CONFIDENCE, (double) similar.size() / FULL_CONFIDENCE_MATCHES);
        log.debug("Pattern correction from {} similar days: ratio={}, confidence={}", similar.size(), meanRatio, confidence);
        return new PatternCorrection(round(eto * meanRatio, 2), confidence, similar.size());
    }
}

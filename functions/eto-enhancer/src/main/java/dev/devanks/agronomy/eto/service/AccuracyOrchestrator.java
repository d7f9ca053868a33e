// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/service/AccuracyOrchestrator.java
package dev.devanks.agronomy.eto.service;

import dev.devanks.agronomy.eto.model.AccuracyMethod;
import dev.devanks.agronomy.eto.model.CalibrationAdjustment;
import dev.devanks.agronomy.eto.model.Coordinates;
import dev.devanks.agronomy.eto.model.EnhancedEToResult;
import dev.devanks.agronomy.eto.model.EnhancementOptions;
import dev.devanks.agronomy.eto.model.HistoricalValidation;
import dev.devanks.agronomy.eto.model.PatternCorrection;
import dev.devanks.agronomy.eto.model.ProviderId;
import dev.devanks.agronomy.eto.model.RegionalCalibration;
import dev.devanks.agronomy.eto.model.Season;
import dev.devanks.agronomy.eto.model.StrategyContext;
import dev.devanks.agronomy.eto.model.StrategyRecommendation;
import dev.devanks.agronomy.eto.model.WeatherObservation;
import dev.devanks.agronomy.eto.provider.ProviderRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Entry point for enhanced ETo. Chooses between the ensemble and the single-provider path and layers
 * sensor fusion, regional calibration and pattern correction on top, recording each adjustment.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccuracyOrchestrator {

    static final double SINGLE_PROVIDER_CONFIDENCE = 0.7;
    static final double SINGLE_PROVIDER_ERROR = 15;
    static final double MIN_ESTIMATED_ERROR = 5;
    static final double CALIBRATION_ADOPTION_CONFIDENCE = 0.5;
    static final double PATTERN_ADOPTION_CONFIDENCE = 0.6;
    static final int PATTERN_MIN_HISTORY = 10;

    private final ProviderRegistry providerRegistry;
    private final EnsembleCombiner ensembleCombiner;
    private final RegionalCalibrationStore calibrationStore;
    private final SensorFusionRefiner sensorFusionRefiner;
    private final PatternCorrectionLearner patternCorrectionLearner;
    private final ProviderSelector providerSelector;

    public EnhancedEToResult getEnhancedETo(double latitude, double longitude, LocalDate date, EnhancementOptions options) {
        Coordinates.validate(latitude, longitude);
        EnsembleCombiner.requireDate(date);
        EnhancementOptions opts = options != null ? options : EnhancementOptions.defaults();
        if (opts.getLocalSensorReading() != null) {
            opts.getLocalSensorReading().validate();
        }

        log.info("Enhanced ETo requested for ({}, {}) on {}: ensemble={}, calibration={}, sensors={}",
                latitude, longitude, date, opts.isUseEnsemble(), opts.isUseRegionalCalibration(),
                opts.getLocalSensorReading() != null);

        EnhancedEToResult result = opts.isUseEnsemble()
                ? ensemble(latitude, longitude, date, opts)
                : singleProvider(latitude, longitude, date, opts);

        log.info("Enhanced ETo for ({}, {}) on {}: {} mm/day via {} (confidence {}, ±{}%)",
                latitude, longitude, date, result.getEto(), result.getMethod().getTag(),
                result.getConfidence(), result.getMetadata().getEstimatedError());
        return result;
    }

    private EnhancedEToResult ensemble(double latitude, double longitude, LocalDate date, EnhancementOptions opts) {
        EnhancedEToResult result = opts.getProviderWeights() != null
                ? ensembleCombiner.weightedAverage(latitude, longitude, date, opts.getProviderWeights())
                : ensembleCombiner.simpleAverage(latitude, longitude, date);

        if (opts.isUseRegionalCalibration()) {
            ProviderId primary = result.getContributors().get(0).getProvider();
            CalibrationAdjustment adjustment = calibrationStore.apply(result.getEto(), primary, latitude, longitude, date);
            if (adjustment.getConfidence() > CALIBRATION_ADOPTION_CONFIDENCE) {
                adoptCalibration(result, adjustment, "Regional calibration applied to ensemble");
                EnhancedEToResult.ResultMetadata metadata = result.getMetadata();
                metadata.setEstimatedError(metadata.getEstimatedError() * (1 - adjustment.getConfidence() * 0.5));
            }
        }
        return result;
    }

    private EnhancedEToResult singleProvider(double latitude, double longitude, LocalDate date, EnhancementOptions opts) {
        ProviderId providerId = opts.getPinnedProvider() != null
                ? opts.getPinnedProvider()
                : providerSelector.select(opts.getProviderPerformance());
        List<WeatherObservation> observations = providerRegistry.get(providerId)
                .getWeatherData(latitude, longitude, date, date);
        WeatherObservation observation = EnsembleCombiner.observationFor(providerId, observations, date);

        EnhancedEToResult result = opts.getLocalSensorReading() != null
                ? sensorFusionRefiner.refine(observation, opts.getLocalSensorReading())
                : singleProviderResult(observation);

        if (opts.isUseRegionalCalibration()) {
            CalibrationAdjustment adjustment = calibrationStore.apply(result.getEto(), observation.getProvider(),
                    latitude, longitude, date);
            if (adjustment.getConfidence() > CALIBRATION_ADOPTION_CONFIDENCE) {
                adoptCalibration(result, adjustment, String.format(Locale.ROOT,
                        "Regional calibration applied (%.0f%% confidence)", adjustment.getConfidence() * 100));
                EnhancedEToResult.ResultMetadata metadata = result.getMetadata();
                metadata.setEstimatedError(Math.max(MIN_ESTIMATED_ERROR,
                        metadata.getEstimatedError() * (1 - adjustment.getConfidence())));
            }
        }

        List<HistoricalValidation> history = opts.getHistoricalValidations();
        if (history != null && history.size() >= PATTERN_MIN_HISTORY) {
            PatternCorrection pattern = patternCorrectionLearner.correct(result.getEto(),
                    observation.getTemperatureMean(), observation.getRelativeHumidityMean(), Season.of(date),
                    history);
            if (pattern.getConfidence() > PATTERN_ADOPTION_CONFIDENCE) {
                double adjustment = pattern.getCorrectedETo() - result.getEto();
                result.setEto(pattern.getCorrectedETo());
                result.getCorrections().add(EnhancedEToResult.Correction.builder()
                        .type("ml-pattern-correction")
                        .adjustment(adjustment)
                        .reason(String.format(Locale.ROOT, "Pattern-based correction from %d similar days (%.0f%% confidence)",
                                pattern.getMatchCount(), pattern.getConfidence() * 100))
                        .build());
                result.setMethod(AccuracyMethod.ML_CORRECTED);
                result.setConfidence(Math.max(result.getConfidence(), pattern.getConfidence()));
            }
        }
        return result;
    }

    /**
     * Feeds one ground-truth measurement into the regional calibration.
     */
    public RegionalCalibration addCalibrationData(ProviderId provider, double latitude, double longitude, LocalDate date,
                                                  double apiETo, double measuredETo) {
        return calibrationStore.update(provider, latitude, longitude, date, apiETo, measuredETo);
    }

    public StrategyRecommendation recommendStrategy(StrategyContext context) {
        if (context.isHasLocalSensors()) {
            return new StrategyRecommendation(AccuracyMethod.SENSOR_FUSION, "±5%",
                    "Local sensors provide the most accurate temperature and humidity data");
        }
        if (context.isMultipleProvidersAvailable() && context.isHasRegionalData()) {
            return new StrategyRecommendation(AccuracyMethod.REGIONALLY_CALIBRATED, "±8%",
                    "Ensemble reduces random error, calibration corrects systematic bias");
        }
        if (context.getHistoricalValidations() >= 20) {
            return new StrategyRecommendation(AccuracyMethod.ML_CORRECTED, "±10%",
                    "Sufficient historical data for pattern-based correction");
        }
        if (context.isMultipleProvidersAvailable()) {
            return new StrategyRecommendation(AccuracyMethod.ENSEMBLE_AVERAGE, "±12%",
                    "Multiple providers reduce random error through averaging");
        }
        return new StrategyRecommendation(AccuracyMethod.SINGLE_PROVIDER, "±15-20%",
                "Standard API accuracy, consider adding calibration or sensors");
    }

    private static EnhancedEToResult singleProviderResult(WeatherObservation observation) {
        List<EnhancedEToResult.Contributor> contributors = new ArrayList<>();
        contributors.add(EnhancedEToResult.Contributor.builder()
                .provider(observation.getProvider())
                .eto(observation.getEt0FaoEvapotranspiration())
                .weight(1.0)
                .build());
        return EnhancedEToResult.builder()
                .eto(observation.getEt0FaoEvapotranspiration())
                .confidence(SINGLE_PROVIDER_CONFIDENCE)
                .method(AccuracyMethod.SINGLE_PROVIDER)
                .contributors(contributors)
                .corrections(new ArrayList<>())
                .metadata(EnhancedEToResult.ResultMetadata.builder()
                        .providersUsed(1)
                        .hasLocalSensors(false)
                        .hasRegionalCalibration(false)
                        .estimatedError(SINGLE_PROVIDER_ERROR)
                        .build())
                .build();
    }

    private static void adoptCalibration(EnhancedEToResult result, CalibrationAdjustment adjustment, String reason) {
        result.setEto(adjustment.getCalibratedETo());
        result.getCorrections().add(EnhancedEToResult.Correction.builder()
                .type("regional-calibration")
                .adjustment(adjustment.getCorrection())
                .reason(reason)
                .build());
        result.getMetadata().setHasRegionalCalibration(true);
    }
}

// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/function/EtoFunctions.java
package dev.devanks.agronomy.eto.function;

import com.google.common.annotations.VisibleForTesting;
import dev.devanks.agronomy.eto.exception.InvalidDateRangeException;
import dev.devanks.agronomy.eto.model.BiasReport;
import dev.devanks.agronomy.eto.model.CropStressAssessment;
import dev.devanks.agronomy.eto.model.EnhancedEToResult;
import dev.devanks.agronomy.eto.model.EnhancementOptions;
import dev.devanks.agronomy.eto.model.ProviderComparison;
import dev.devanks.agronomy.eto.model.ProviderId;
import dev.devanks.agronomy.eto.model.RegionalCalibration;
import dev.devanks.agronomy.eto.model.request.BiasCheckRequest;
import dev.devanks.agronomy.eto.model.request.CalibrationFeedbackRequest;
import dev.devanks.agronomy.eto.model.request.CropStressCheckRequest;
import dev.devanks.agronomy.eto.model.request.EnhancedEtoRequest;
import dev.devanks.agronomy.eto.model.request.ProviderComparisonRequest;
import dev.devanks.agronomy.eto.provider.ProviderRegistry;
import dev.devanks.agronomy.eto.service.AccuracyOrchestrator;
import dev.devanks.agronomy.eto.service.BiasDetector;
import dev.devanks.agronomy.eto.service.CropStressValidator;
import dev.devanks.agronomy.eto.service.ProviderValidationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Spring Cloud Function beans exposing the enhancer. Inputs and outputs are JSON.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EtoFunctions {

    private final AccuracyOrchestrator accuracyOrchestrator;
    private final ProviderValidationService providerValidationService;
    private final CropStressValidator cropStressValidator;
    private final BiasDetector biasDetector;
    private final ProviderRegistry providerRegistry;
    private final Clock clock;

    @Bean
    public Function<EnhancedEtoRequest, EnhancedEToResult> enhancedEto() {
        return request -> {
            log.info("enhancedEto function triggered with payload: {}", request);
            LocalDate date = parseDate(request.getDate());
            try {
                return accuracyOrchestrator.getEnhancedETo(request.getLatitude(), request.getLongitude(), date, toOptions(request));
            } catch (RuntimeException e) {
                log.error("Enhanced ETo failed for ({}, {}) on {}: {}", request.getLatitude(), request.getLongitude(), date, e.getMessage(), e);
                throw e;
            }
        };
    }

    @Bean
    public Function<CalibrationFeedbackRequest, RegionalCalibration> calibrationFeedback() {
        return request -> {
            log.info("calibrationFeedback function triggered with payload: {}", request);
            return accuracyOrchestrator.addCalibrationData(request.getProvider(), request.getLatitude(), request.getLongitude(),
                    parseDate(request.getDate()), request.getApiETo(), request.getMeasuredETo());
        };
    }

    @Bean
    public Function<ProviderComparisonRequest, ProviderComparison> providerComparison() {
        return request -> {
            log.info("providerComparison function triggered for {} station days",
                    request.getStationObservations() == null ? 0 : request.getStationObservations().size());
            List<ProviderId> providers = request.getProviders() == null || request.getProviders().isEmpty()
                    ? new ArrayList<>(providerRegistry.ids())
                    : request.getProviders();
            return providerValidationService.compareProviders(providers, request.getStationObservations(),
                    request.getLatitude(), request.getLongitude());
        };
    }

    @Bean
    public Function<CropStressCheckRequest, CropStressAssessment> cropStressCheck() {
        return request -> {
            log.info("cropStressCheck function triggered with payload: {}", request);
            if (request.getFeedback() == null) {
                throw new IllegalArgumentException("Crop stress feedback is required");
            }
            return cropStressValidator.validate(request.getFeedback(), request.getEto());
        };
    }

    @Bean
    public Function<BiasCheckRequest, BiasReport> biasCheck() {
        return request -> {
            log.info("biasCheck function triggered with {} samples", request.getSamples() == null ? 0 : request.getSamples().size());
            return biasDetector.detect(request.getSamples());
        };
    }

    @VisibleForTesting
    LocalDate parseDate(String value) {
        if (value == null || value.isBlank()) {
            return LocalDate.now(clock);
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new InvalidDateRangeException("Invalid date '" + value + "'. Use YYYY-MM-DD format.", e);
        }
    }

    @VisibleForTesting
    static EnhancementOptions toOptions(EnhancedEtoRequest request) {
        EnhancementOptions.EnhancementOptionsBuilder options = EnhancementOptions.builder()
                .useEnsemble(request.isUseEnsemble())
                .useRegionalCalibration(request.isUseRegionalCalibration())
                .localSensorReading(request.getLocalSensorReading())
                .pinnedProvider(request.getPinnedProvider() != null ? ProviderId.fromTag(request.getPinnedProvider()) : null)
                .providerWeights(request.getProviderWeights() != null ? byProvider(request.getProviderWeights()) : null);
        if (request.getHistoricalValidations() != null) {
            options.historicalValidations(request.getHistoricalValidations());
        }
        if (request.getProviderPerformance() != null) {
            options.providerPerformance(byProvider(request.getProviderPerformance()));
        }
        return options.build();
    }

    private static <V> Map<ProviderId, V> byProvider(Map<String, V> byTag) {
        Map<ProviderId, V> result = new EnumMap<>(ProviderId.class);
        byTag.forEach((tag, value) -> result.put(ProviderId.fromTag(tag), value));
        return result;
    }
}

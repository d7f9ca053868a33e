// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/service/EnsembleCombiner.java
package dev.devanks.agronomy.eto.service;

import dev.devanks.agronomy.eto.config.EtoProperties;
import dev.devanks.agronomy.eto.exception.InvalidDateRangeException;
import dev.devanks.agronomy.eto.exception.NoProvidersAvailableException;
import dev.devanks.agronomy.eto.exception.ProviderUnavailableException;
import dev.devanks.agronomy.eto.model.AccuracyMethod;
import dev.devanks.agronomy.eto.model.Coordinates;
import dev.devanks.agronomy.eto.model.EnhancedEToResult;
import dev.devanks.agronomy.eto.model.ProviderEstimate;
import dev.devanks.agronomy.eto.model.ProviderId;
import dev.devanks.agronomy.eto.model.WeatherObservation;
import dev.devanks.agronomy.eto.provider.ProviderRegistry;
import dev.devanks.agronomy.eto.provider.WeatherProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

import static dev.devanks.agronomy.eto.calculation.UnitConversions.round;
import static dev.devanks.agronomy.eto.exception.ProviderUnavailableException.Reason.NO_DATA;

/**
 * Fuses ETo estimates from several providers fetched in parallel.
 * <p>
 * Every provider call runs on the bounded-elastic scheduler with its own timeout. A failing or slow
 * provider is dropped from the ensemble; only a batch with no successes is an error.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EnsembleCombiner {

    private final ProviderRegistry providerRegistry;
    private final EtoProperties etoProperties;

    public EnhancedEToResult simpleAverage(double latitude, double longitude, LocalDate date) {
        return combineSimple(fetchEstimates(latitude, longitude, date));
    }

    public EnhancedEToResult weightedAverage(double latitude, double longitude, LocalDate date,
                                             Map<ProviderId, Double> weights) {
        return combineWeighted(fetchEstimates(latitude, longitude, date), weights);
    }

    /**
     * Fetches the configured providers concurrently. Results keep the configured provider order.
     *
     * @throws NoProvidersAvailableException when every provider failed
     */
    public List<ProviderEstimate> fetchEstimates(double latitude, double longitude, LocalDate date) {
        Coordinates.validate(latitude, longitude);
        requireDate(date);
        List<ProviderId> configured = etoProperties.getEnsemble().getProviders().stream()
                .filter(providerRegistry::contains)
                .distinct()
                .toList();
        log.info("Fetching ETo for ({}, {}) on {} from {} providers: {}", latitude, longitude, date, configured.size(), configured);

        List<ProviderEstimate> estimates = streamEstimates(configured, latitude, longitude, date)
                .collectList()
                .block();

        if (estimates == null || estimates.isEmpty()) {
            log.error("All {} ensemble providers failed for ({}, {}) on {}.", configured.size(), latitude, longitude, date);
            throw new NoProvidersAvailableException(
                    String.format("None of the %d configured weather providers returned data for %s", configured.size(), date));
        }
        log.info("Ensemble received {} of {} provider estimates.", estimates.size(), configured.size());
        return estimates;
    }

    /**
     * One estimate per provider that answered in time, in the order given. Failures are logged and skipped.
     */
    Flux<ProviderEstimate> streamEstimates(List<ProviderId> providers, double latitude, double longitude, LocalDate date) {
        return Flux.fromIterable(providers)
                .flatMapSequential(id -> Mono.fromCallable(() -> estimate(providerRegistry.get(id), latitude, longitude, date))
                        .subscribeOn(Schedulers.boundedElastic())
                        .timeout(etoProperties.getEnsemble().getProviderTimeout())
                        .doOnSuccess(e -> log.debug("{} returned ETo {} mm/day", id.getTag(), e.getEto()))
                        .onErrorResume(e -> {
                            logFailure(id, e);
                            return Mono.empty();
                        }));
    }

    /**
     * Equal-weight mean with population standard deviation.
     */
    public EnhancedEToResult combineSimple(List<ProviderEstimate> estimates) {
        requireEstimates(estimates);
        double weight = 1.0 / estimates.size();
        List<Double> weights = estimates.stream().map(e -> weight).toList();
        return combine(estimates, weights, AccuracyMethod.ENSEMBLE_AVERAGE);
    }

    /**
     * Weighted mean and variance. A provider without a weight counts as 1.0; weights are normalized
     * over the estimates actually present. Non-positive totals fall back to equal weights.
     */
    public EnhancedEToResult combineWeighted(List<ProviderEstimate> estimates, Map<ProviderId, Double> providerWeights) {
        requireEstimates(estimates);
        List<Double> raw = estimates.stream()
                .map(e -> {
                    Double w = providerWeights != null ? providerWeights.get(e.getProvider()) : null;
                    return w != null ? Math.max(0, w) : 1.0;
                })
                .toList();
        double total = raw.stream().mapToDouble(Double::doubleValue).sum();

        List<Double> normalized;
        if (total <= 0) {
            log.warn("Provider weights sum to {}, falling back to equal weights.", total);
            double equal = 1.0 / estimates.size();
            normalized = raw.stream().map(w -> equal).toList();
        } else {
            normalized = raw.stream().map(w -> w / total).toList();
        }
        return combine(estimates, normalized, AccuracyMethod.WEIGHTED_ENSEMBLE);
    }

    private EnhancedEToResult combine(List<ProviderEstimate> estimates, List<Double> weights, AccuracyMethod method) {
        double mean = 0;
        for (int i = 0; i < estimates.size(); i++) {
            mean += weights.get(i) * estimates.get(i).getEto();
        }
        double variance = 0;
        for (int i = 0; i < estimates.size(); i++) {
            double deviation = estimates.get(i).getEto() - mean;
            variance += weights.get(i) * deviation * deviation;
        }
        double stdDev = Math.sqrt(variance);

        double confidence;
        double estimatedError;
        if (stdDev == 0) {
            confidence = 1.0;
            estimatedError = 0.0;
        } else if (mean <= 0) {
            confidence = 0.0;
            estimatedError = 100.0;
        } else {
            confidence = Math.max(0, 1 - stdDev / mean);
            estimatedError = stdDev / mean * 100;
        }

        List<EnhancedEToResult.Contributor> contributors = new ArrayList<>(estimates.size());
        for (int i = 0; i < estimates.size(); i++) {
            contributors.add(EnhancedEToResult.Contributor.builder()
                    .provider(estimates.get(i).getProvider())
                    .eto(estimates.get(i).getEto())
                    .weight(weights.get(i))
                    .build());
        }

        return EnhancedEToResult.builder()
                .eto(round(mean, 2))
                .confidence(round(confidence, 2))
                .method(method)
                .contributors(contributors)
                .corrections(new ArrayList<>())
                .metadata(EnhancedEToResult.ResultMetadata.builder()
                        .providersUsed(estimates.size())
                        .hasLocalSensors(false)
                        .hasRegionalCalibration(false)
                        .estimatedError(estimatedError)
                        .build())
                .build();
    }

    private ProviderEstimate estimate(WeatherProvider provider, double latitude, double longitude, LocalDate date) {
        List<WeatherObservation> observations = provider.getWeatherData(latitude, longitude, date, date);
        WeatherObservation observation = observationFor(provider.id(), observations, date);
        return new ProviderEstimate(provider.id(), observation.getEt0FaoEvapotranspiration(), observation);
    }

    /**
     * The row for {@code date}. Rows for neighbouring days never stand in for it.
     *
     * @throws ProviderUnavailableException with {@code NO_DATA} when no row carries that date
     */
    static WeatherObservation observationFor(ProviderId provider, List<WeatherObservation> observations, LocalDate date) {
        return observations.stream()
                .filter(o -> date.equals(o.getDate()))
                .findFirst()
                .orElseThrow(() -> new ProviderUnavailableException(provider, NO_DATA,
                        String.format("%d row(s) returned but none for %s", observations.size(), date)));
    }

    static void requireDate(LocalDate date) {
        if (date == null) {
            throw new InvalidDateRangeException("A target date is required");
        }
    }

    private static void logFailure(ProviderId id, Throwable e) {
        if (e instanceof ProviderUnavailableException) {
            log.warn("Excluding {} from ensemble: {}", id.getTag(), e.getMessage());
        } else if (e instanceof TimeoutException) {
            log.warn("Excluding {} from ensemble: no response within timeout.", id.getTag());
        } else {
            log.error("Excluding {} from ensemble after unexpected failure: {}", id.getTag(), e.getMessage(), e);
        }
    }

    private static void requireEstimates(List<ProviderEstimate> estimates) {
        if (estimates == null || estimates.isEmpty()) {
            throw new NoProvidersAvailableException("No provider estimates to combine");
        }
    }
}

// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/service/ProviderValidationService.java
package dev.devanks.agronomy.eto.service;

import com.google.common.annotations.VisibleForTesting;
import dev.devanks.agronomy.eto.exception.NoProvidersAvailableException;
import dev.devanks.agronomy.eto.exception.ProviderUnavailableException;
import dev.devanks.agronomy.eto.model.Coordinates;
import dev.devanks.agronomy.eto.model.ProviderComparison;
import dev.devanks.agronomy.eto.model.ProviderId;
import dev.devanks.agronomy.eto.model.QuickValidation;
import dev.devanks.agronomy.eto.model.StationObservation;
import dev.devanks.agronomy.eto.model.ValidationRecord;
import dev.devanks.agronomy.eto.model.ValidationStats;
import dev.devanks.agronomy.eto.model.WeatherObservation;
import dev.devanks.agronomy.eto.provider.ProviderRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

import static dev.devanks.agronomy.eto.calculation.UnitConversions.round;
import static java.util.stream.Collectors.toMap;

/**
 * Scores weather providers against local station ground truth.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProviderValidationService {

    static final String INSUFFICIENT_DATA = "Insufficient validation data: no provider days could be paired with station records.";

    private final ProviderRegistry providerRegistry;
    private final ValidationReportFormatter reportFormatter;

    /**
     * Fetches the provider once for the whole station period and compares day by day. A failed fetch
     * or a period without overlapping days yields empty statistics rather than an exception.
     */
    public ValidationStats validateProvider(ProviderId provider, List<StationObservation> stationObservations,
                                            double latitude, double longitude) {
        Coordinates.validate(latitude, longitude);
        List<StationObservation> stations = stationObservations == null ? List.of() : stationObservations.stream()
                .filter(s -> s.getDate() != null)
                .toList();
        if (stations.isEmpty()) {
            log.warn("No station observations supplied for validating {}.", provider.getTag());
            return insufficient(provider);
        }

        LocalDate start = stations.stream().map(StationObservation::getDate).min(Comparator.naturalOrder()).orElseThrow();
        LocalDate end = stations.stream().map(StationObservation::getDate).max(Comparator.naturalOrder()).orElseThrow();

        Map<LocalDate, WeatherObservation> apiByDate;
        try {
            apiByDate = providerRegistry.get(provider).getWeatherData(latitude, longitude, start, end).stream()
                    .collect(toMap(WeatherObservation::getDate, Function.identity(), (first, second) -> first));
        } catch (ProviderUnavailableException e) {
            log.warn("Validation of {} skipped: {}", provider.getTag(), e.getMessage());
            return insufficient(provider);
        }

        List<ValidationRecord> records = new ArrayList<>();
        for (StationObservation station : stations) {
            WeatherObservation api = apiByDate.get(station.getDate());
            if (api == null) {
                log.debug("{} has no data for station day {}", provider.getTag(), station.getDate());
                continue;
            }
            records.add(toRecord(provider, station, api.getEt0FaoEvapotranspiration()));
        }
        log.info("Paired {} of {} station days for {}.", records.size(), stations.size(), provider.getTag());
        return calculateStatistics(provider, records);
    }

    /**
     * Validates every provider in parallel and picks the one with the lowest RMSE.
     *
     * @throws NoProvidersAvailableException when no provider produced any paired day
     */
    public ProviderComparison compareProviders(List<ProviderId> providers, List<StationObservation> stationObservations,
                                               double latitude, double longitude) {
        Coordinates.validate(latitude, longitude);
        if (providers == null || providers.isEmpty()) {
            throw new IllegalArgumentException("At least one provider is required for a comparison");
        }
        List<ValidationStats> validations = Flux.fromIterable(providers)
                .flatMapSequential(provider -> Mono.fromCallable(
                                () -> validateProvider(provider, stationObservations, latitude, longitude))
                        .subscribeOn(Schedulers.boundedElastic()))
                .collectList()
                .block();
        List<ValidationStats> results = Objects.requireNonNullElse(validations, List.of());

        ValidationStats best = results.stream()
                .filter(ValidationStats::hasSamples)
                .min(Comparator.comparingDouble(ValidationStats::getRmse))
                .orElseThrow(() -> new NoProvidersAvailableException(
                        "None of " + providers + " produced data overlapping the station observations"));
        log.info("Best provider against station data: {} (RMSE {})", best.getProvider().getTag(), best.getRmse());

        int stationDays = stationObservations == null ? 0 : stationObservations.size();
        return ProviderComparison.builder()
                .validations(results)
                .bestProvider(best.getProvider())
                .report(reportFormatter.comparisonReport(results, best.getProvider(), latitude, longitude, stationDays))
                .build();
    }

    /**
     * Multiplier that removes the mean percentage bias: {@code 1 / (1 + bias% / 100)}.
     */
    public double correctionFactor(ValidationStats stats) {
        return round(1 / (1 + stats.getMeanBiasPercent() / 100), 3);
    }

    public double applyCorrection(double apiETo, double correctionFactor) {
        return round(apiETo * correctionFactor, 2);
    }

    /**
     * Bias summary for a handful of paired values, without a provider fetch.
     */
    public QuickValidation quickValidation(double[] apiETo, double[] stationETo) {
        if (apiETo == null || stationETo == null || apiETo.length != stationETo.length || apiETo.length == 0) {
            throw new IllegalArgumentException("API and station arrays must be non-empty and of equal length");
        }
        double errorSum = 0;
        double stationSum = 0;
        for (int i = 0; i < apiETo.length; i++) {
            errorSum += apiETo[i] - stationETo[i];
            stationSum += stationETo[i];
        }
        double bias = errorSum / apiETo.length;
        double stationMean = stationSum / stationETo.length;
        double biasPercent = stationMean != 0 ? bias / stationMean * 100 : 0;
        return new QuickValidation(round(bias, 2), round(biasPercent, 1), round(1 / (1 + biasPercent / 100), 3));
    }

    public String validationReport(ValidationStats stats) {
        return reportFormatter.validationReport(stats, correctionFactor(stats));
    }

    @VisibleForTesting
    ValidationStats calculateStatistics(ProviderId provider, List<ValidationRecord> records) {
        int n = records.size();
        if (n == 0) {
            return insufficient(provider);
        }
        double meanBias = records.stream().mapToDouble(ValidationRecord::getError).average().orElse(0);
        double meanBiasPercent = records.stream().mapToDouble(ValidationRecord::getErrorPercent).average().orElse(0);
        double rmse = Math.sqrt(records.stream().mapToDouble(r -> r.getError() * r.getError()).average().orElse(0));
        double mae = records.stream().mapToDouble(r -> Math.abs(r.getError())).average().orElse(0);

        double stationMean = records.stream().mapToDouble(ValidationRecord::getStationETo).average().orElse(0);
        double ssTotal = records.stream().mapToDouble(r -> Math.pow(r.getStationETo() - stationMean, 2)).sum();
        double ssResidual = records.stream().mapToDouble(r -> r.getError() * r.getError()).sum();
        double r2;
        if (ssTotal == 0) {
            r2 = ssResidual == 0 ? 1 : 0;
        } else {
            r2 = 1 - ssResidual / ssTotal;
        }

        return ValidationStats.builder()
                .provider(provider)
                .meanBias(round(meanBias, 2))
                .meanBiasPercent(round(meanBiasPercent, 1))
                .rmse(round(rmse, 2))
                .mae(round(mae, 2))
                .r2(round(r2, 3))
                .sampleSize(n)
                .recommendation(recommendation(provider, meanBiasPercent, rmse, r2))
                .build();
    }

    @VisibleForTesting
    static String recommendation(ProviderId provider, double meanBiasPercent, double rmse, double r2) {
        double absPercent = Math.abs(meanBiasPercent);
        String name = provider.getTag();
        if (absPercent < 5 && rmse < 0.5 && r2 > 0.95) {
            return String.format("Excellent accuracy! %s matches local station very well. Use without correction.", name);
        }
        if (absPercent < 10 && rmse < 1.0 && r2 > 0.90) {
            return String.format(Locale.ROOT, "Good accuracy. %s shows %s of %.1f%%. Consider applying correction factor.",
                    name, meanBiasPercent > 0 ? "slight overestimation" : "slight underestimation", absPercent);
        }
        if (absPercent < 20 && rmse < 1.5 && r2 > 0.80) {
            return String.format(Locale.ROOT, "Moderate accuracy. %s %s by %.1f%%. Correction factor recommended for precision irrigation.",
                    name, meanBiasPercent > 0 ? "overestimates" : "underestimates", absPercent);
        }
        return String.format(Locale.ROOT, "Lower accuracy detected. %s %s by %.1f%%. Strong recommendation to use local station or apply correction factor.",
                name, meanBiasPercent > 0 ? "overestimates" : "underestimates", absPercent);
    }

    private static ValidationRecord toRecord(ProviderId provider, StationObservation station, double apiETo) {
        double stationETo = station.getReferenceEt();
        double error = apiETo - stationETo;
        return ValidationRecord.builder()
                .date(station.getDate())
                .provider(provider)
                .apiETo(apiETo)
                .stationETo(stationETo)
                .error(error)
                .errorPercent(stationETo != 0 ? error / stationETo * 100 : 0)
                .build();
    }

    private static ValidationStats insufficient(ProviderId provider) {
        return ValidationStats.builder()
                .provider(provider)
                .sampleSize(0)
                .recommendation(INSUFFICIENT_DATA)
                .build();
    }
}

package dev.devanks.agronomy.eto.service;

import dev.devanks.agronomy.eto.config.EtoProperties;
import dev.devanks.agronomy.eto.exception.InvalidDateRangeException;
import dev.devanks.agronomy.eto.exception.NoProvidersAvailableException;
import dev.devanks.agronomy.eto.exception.ProviderUnavailableException;
import dev.devanks.agronomy.eto.model.AccuracyMethod;
import dev.devanks.agronomy.eto.model.EnhancedEToResult;
import dev.devanks.agronomy.eto.model.ProviderEstimate;
import dev.devanks.agronomy.eto.model.ProviderId;
import dev.devanks.agronomy.eto.model.WeatherObservation;
import dev.devanks.agronomy.eto.provider.ProviderRegistry;
import dev.devanks.agronomy.eto.provider.WeatherProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static dev.devanks.agronomy.eto.exception.ProviderUnavailableException.Reason.RATE_LIMITED;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("EnsembleCombiner Unit Tests")
class EnsembleCombinerTest {

    private static final LocalDate DATE = LocalDate.of(2024, 6, 15);

    private EtoProperties etoProperties;

    @BeforeEach
    void setUp() {
        etoProperties = new EtoProperties();
    }

    private static ProviderEstimate estimate(ProviderId id, double eto) {
        return new ProviderEstimate(id, eto, WeatherObservation.builder().provider(id).date(DATE).et0FaoEvapotranspiration(eto).build());
    }

    private static WeatherProvider providerReturning(ProviderId id, double eto) {
        WeatherProvider provider = mock(WeatherProvider.class);
        when(provider.id()).thenReturn(id);
        when(provider.getWeatherData(19.0, 73.0, DATE, DATE)).thenReturn(List.of(
                WeatherObservation.builder().provider(id).date(DATE).et0FaoEvapotranspiration(eto).build()));
        return provider;
    }

    private static WeatherProvider providerFailing(ProviderId id) {
        WeatherProvider provider = mock(WeatherProvider.class);
        when(provider.id()).thenReturn(id);
        when(provider.getWeatherData(19.0, 73.0, DATE, DATE))
                .thenThrow(new ProviderUnavailableException(id, RATE_LIMITED, "HTTP 429"));
        return provider;
    }

    @Test
    @DisplayName("combineSimple - two providers give mean, sd-derived confidence and error")
    void combineSimple_TwoEstimates() {
        EnsembleCombiner combiner = new EnsembleCombiner(new ProviderRegistry(List.of()), etoProperties);

        EnhancedEToResult result = combiner.combineSimple(List.of(
                estimate(ProviderId.OPEN_METEO, 5.0), estimate(ProviderId.WEATHERBIT, 5.4)));

        assertThat(result.getEto()).isEqualTo(5.2);
        assertThat(result.getConfidence()).isEqualTo(0.96);
        assertThat(result.getMetadata().getEstimatedError()).isCloseTo(3.846, within(0.001));
        assertThat(result.getMetadata().getProvidersUsed()).isEqualTo(2);
        assertThat(result.getMethod()).isEqualTo(AccuracyMethod.ENSEMBLE_AVERAGE);
        assertThat(result.getContributors()).extracting(EnhancedEToResult.Contributor::getWeight).containsExactly(0.5, 0.5);
    }

    @Test
    void combineSimple_IdenticalEstimates_FullConfidence() {
        EnsembleCombiner combiner = new EnsembleCombiner(new ProviderRegistry(List.of()), etoProperties);

        EnhancedEToResult result = combiner.combineSimple(List.of(
                estimate(ProviderId.OPEN_METEO, 4.2), estimate(ProviderId.WEATHERBIT, 4.2), estimate(ProviderId.TOMORROW_IO, 4.2)));

        assertThat(result.getEto()).isEqualTo(4.2);
        assertThat(result.getConfidence()).isEqualTo(1.0);
        assertThat(result.getMetadata().getEstimatedError()).isEqualTo(0.0);
    }

    @Test
    void combineSimple_AllZero_FullConfidence() {
        EnsembleCombiner combiner = new EnsembleCombiner(new ProviderRegistry(List.of()), etoProperties);

        EnhancedEToResult result = combiner.combineSimple(List.of(estimate(ProviderId.OPEN_METEO, 0.0), estimate(ProviderId.WEATHERBIT, 0.0)));

        assertThat(result.getEto()).isEqualTo(0.0);
        assertThat(result.getConfidence()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("combineWeighted - a single non-zero weight selects that provider")
    void combineWeighted_OneHotWeights() {
        EnsembleCombiner combiner = new EnsembleCombiner(new ProviderRegistry(List.of()), etoProperties);
        Map<ProviderId, Double> weights = new EnumMap<>(ProviderId.class);
        weights.put(ProviderId.OPEN_METEO, 1.0);
        weights.put(ProviderId.WEATHERBIT, 0.0);
        weights.put(ProviderId.TOMORROW_IO, 0.0);

        EnhancedEToResult result = combiner.combineWeighted(List.of(
                estimate(ProviderId.OPEN_METEO, 5.0), estimate(ProviderId.WEATHERBIT, 6.0), estimate(ProviderId.TOMORROW_IO, 7.0)), weights);

        assertThat(result.getEto()).isEqualTo(5.0);
        assertThat(result.getConfidence()).isEqualTo(1.0);
        assertThat(result.getMethod()).isEqualTo(AccuracyMethod.WEIGHTED_ENSEMBLE);
    }

    @Test
    void combineWeighted_MissingWeightCountsAsOne() {
        EnsembleCombiner combiner = new EnsembleCombiner(new ProviderRegistry(List.of()), etoProperties);

        EnhancedEToResult result = combiner.combineWeighted(List.of(
                estimate(ProviderId.OPEN_METEO, 4.0), estimate(ProviderId.WEATHERBIT, 7.0)), Map.of(ProviderId.OPEN_METEO, 2.0));

        // (2 * 4 + 1 * 7) / 3
        assertThat(result.getEto()).isEqualTo(5.0);
    }

    @Test
    void combineWeighted_ZeroTotal_FallsBackToEqualWeights() {
        EnsembleCombiner combiner = new EnsembleCombiner(new ProviderRegistry(List.of()), etoProperties);

        EnhancedEToResult result = combiner.combineWeighted(List.of(
                estimate(ProviderId.OPEN_METEO, 4.0), estimate(ProviderId.WEATHERBIT, 6.0)),
                Map.of(ProviderId.OPEN_METEO, 0.0, ProviderId.WEATHERBIT, 0.0));

        assertThat(result.getEto()).isEqualTo(5.0);
    }

    @Test
    void combineSimple_Empty_Throws() {
        EnsembleCombiner combiner = new EnsembleCombiner(new ProviderRegistry(List.of()), etoProperties);

        assertThatThrownBy(() -> combiner.combineSimple(List.of()))
                .isInstanceOf(NoProvidersAvailableException.class);
    }

    @Test
    @DisplayName("simpleAverage - a failing provider is dropped from the ensemble")
    void simpleAverage_OneProviderFails_UsesRemaining() {
        ProviderRegistry registry = new ProviderRegistry(List.of(
                providerReturning(ProviderId.OPEN_METEO, 5.0),
                providerFailing(ProviderId.WEATHERBIT),
                providerReturning(ProviderId.TOMORROW_IO, 5.4)));
        EnsembleCombiner combiner = new EnsembleCombiner(registry, etoProperties);

        EnhancedEToResult result = combiner.simpleAverage(19.0, 73.0, DATE);

        assertThat(result.getEto()).isEqualTo(5.2);
        assertThat(result.getMetadata().getProvidersUsed()).isEqualTo(2);
        assertThat(result.getContributors()).extracting(EnhancedEToResult.Contributor::getProvider)
                .containsExactly(ProviderId.OPEN_METEO, ProviderId.TOMORROW_IO);
    }

    @Test
    void simpleAverage_SlowProvider_TimesOut() {
        WeatherProvider slow = mock(WeatherProvider.class);
        when(slow.id()).thenReturn(ProviderId.VISUAL_CROSSING);
        when(slow.getWeatherData(19.0, 73.0, DATE, DATE)).thenAnswer(invocation -> {
            Thread.sleep(2_000);
            return List.of();
        });
        etoProperties.getEnsemble().setProviderTimeout(Duration.ofMillis(100));
        EnsembleCombiner combiner = new EnsembleCombiner(
                new ProviderRegistry(List.of(providerReturning(ProviderId.OPEN_METEO, 4.4), slow)), etoProperties);

        EnhancedEToResult result = combiner.simpleAverage(19.0, 73.0, DATE);

        assertThat(result.getEto()).isEqualTo(4.4);
        assertThat(result.getMetadata().getProvidersUsed()).isEqualTo(1);
    }

    @Test
    void simpleAverage_AllProvidersFail_Throws() {
        EnsembleCombiner combiner = new EnsembleCombiner(new ProviderRegistry(List.of(
                providerFailing(ProviderId.OPEN_METEO), providerFailing(ProviderId.WEATHERBIT))), etoProperties);

        assertThatThrownBy(() -> combiner.simpleAverage(19.0, 73.0, DATE))
                .isInstanceOf(NoProvidersAvailableException.class);
    }

    @Test
    void fetchEstimates_OnlyConfiguredProvidersAreCalled() {
        etoProperties.getEnsemble().setProviders(List.of(ProviderId.WEATHERBIT));
        EnsembleCombiner combiner = new EnsembleCombiner(new ProviderRegistry(List.of(
                providerReturning(ProviderId.OPEN_METEO, 5.0), providerReturning(ProviderId.WEATHERBIT, 6.1))), etoProperties);

        List<ProviderEstimate> estimates = combiner.fetchEstimates(19.0, 73.0, DATE);

        assertThat(estimates).extracting(ProviderEstimate::getProvider).containsExactly(ProviderId.WEATHERBIT);
    }

    @Test
    @DisplayName("streamEstimates - keeps provider order and skips failures")
    void streamEstimates_PreservesOrder() {
        EnsembleCombiner combiner = new EnsembleCombiner(new ProviderRegistry(List.of(
                providerReturning(ProviderId.OPEN_METEO, 5.0),
                providerFailing(ProviderId.VISUAL_CROSSING),
                providerReturning(ProviderId.WEATHERBIT, 5.4))), etoProperties);

        StepVerifier.create(combiner.streamEstimates(
                        List.of(ProviderId.WEATHERBIT, ProviderId.VISUAL_CROSSING, ProviderId.OPEN_METEO), 19.0, 73.0, DATE))
                .assertNext(e -> assertThat(e.getProvider()).isEqualTo(ProviderId.WEATHERBIT))
                .assertNext(e -> assertThat(e.getEto()).isEqualTo(5.0))
                .verifyComplete();
    }

    @Test
    @DisplayName("simpleAverage - a provider answering only for another day is excluded")
    void simpleAverage_ProviderReturnsNeighbouringDay_Excluded() {
        WeatherProvider shifted = mock(WeatherProvider.class);
        when(shifted.id()).thenReturn(ProviderId.TOMORROW_IO);
        when(shifted.getWeatherData(19.0, 73.0, DATE, DATE)).thenReturn(List.of(WeatherObservation.builder()
                .provider(ProviderId.TOMORROW_IO).date(DATE.minusDays(1)).et0FaoEvapotranspiration(9.0).build()));
        EnsembleCombiner combiner = new EnsembleCombiner(new ProviderRegistry(List.of(
                providerReturning(ProviderId.OPEN_METEO, 5.0), shifted)), etoProperties);

        EnhancedEToResult result = combiner.simpleAverage(19.0, 73.0, DATE);

        assertThat(result.getEto()).isEqualTo(5.0);
        assertThat(result.getMetadata().getProvidersUsed()).isEqualTo(1);
        assertThat(result.getContributors()).extracting(EnhancedEToResult.Contributor::getProvider)
                .containsExactly(ProviderId.OPEN_METEO);
    }

    @Test
    void fetchEstimates_NullDate_RejectedBeforeAnyProviderCall() {
        WeatherProvider openMeteo = providerReturning(ProviderId.OPEN_METEO, 5.0);
        EnsembleCombiner combiner = new EnsembleCombiner(new ProviderRegistry(List.of(openMeteo)), etoProperties);

        assertThatThrownBy(() -> combiner.fetchEstimates(19.0, 73.0, null))
                .isInstanceOf(InvalidDateRangeException.class);
        verify(openMeteo, never()).getWeatherData(anyDouble(), anyDouble(), any(), any());
    }
}

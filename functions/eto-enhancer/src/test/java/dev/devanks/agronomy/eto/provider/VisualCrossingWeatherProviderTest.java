package dev.devanks.agronomy.eto.provider;

import dev.devanks.agronomy.eto.client.VisualCrossingApiClient;
import dev.devanks.agronomy.eto.config.EtoProperties;
import dev.devanks.agronomy.eto.exception.ProviderUnavailableException;
import dev.devanks.agronomy.eto.mapper.VisualCrossingMapper;
import dev.devanks.agronomy.eto.model.ProviderId;
import dev.devanks.agronomy.eto.model.WeatherObservation;
import dev.devanks.agronomy.eto.model.vendor.VisualCrossingResponse;
import feign.FeignException;
import feign.Request;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;

import static dev.devanks.agronomy.eto.exception.ProviderUnavailableException.Reason.RATE_LIMITED;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VisualCrossingWeatherProviderTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-15T06:00:00Z"), ZoneOffset.UTC);

    @Mock
    private VisualCrossingApiClient mockApiClient;
    @Mock
    private VisualCrossingMapper mockMapper;

    private VisualCrossingWeatherProvider provider;

    @BeforeEach
    void setUp() {
        EtoProperties etoProperties = new EtoProperties();
        etoProperties.getProviders().getVisualCrossing().setApiKey("vc-key");
        provider = new VisualCrossingWeatherProvider(CLOCK, etoProperties, mockApiClient, mockMapper);
    }

    @Test
    void getWeatherData_HistoricalRange_UsesLatLonLocation() {
        VisualCrossingResponse response = new VisualCrossingResponse();
        when(mockApiClient.getTimeline("19.08,73.2", "2024-05-01", "2024-05-01")).thenReturn(response);
        when(mockMapper.mapToObservations(response, 19.08, 73.2)).thenReturn(List.of(
                WeatherObservation.builder().provider(ProviderId.VISUAL_CROSSING).date(LocalDate.of(2024, 5, 1)).build()));

        List<WeatherObservation> result = provider.getWeatherData(19.08, 73.2, LocalDate.of(2024, 5, 1), LocalDate.of(2024, 5, 1));

        assertThat(result).hasSize(1);
    }

    @Test
    void getWeatherData_TooManyRequests_MapsToRateLimited() {
        Request dummyRequest = Request.create(Request.HttpMethod.GET, "/fake", Collections.emptyMap(), null, StandardCharsets.UTF_8, null);
        when(mockApiClient.getTimeline(anyString(), anyString(), anyString()))
                .thenThrow(new FeignException.TooManyRequests("Too many requests", dummyRequest, null, Collections.emptyMap()));

        assertThatThrownBy(() -> provider.getWeatherData(19.08, 73.2, null, null))
                .isInstanceOf(ProviderUnavailableException.class)
                .extracting(e -> ((ProviderUnavailableException) e).getReason())
                .isEqualTo(RATE_LIMITED);
    }
}

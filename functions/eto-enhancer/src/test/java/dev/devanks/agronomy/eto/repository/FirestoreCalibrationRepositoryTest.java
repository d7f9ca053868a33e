package dev.devanks.agronomy.eto.repository;

import dev.devanks.agronomy.eto.config.EtoProperties;
import dev.devanks.agronomy.eto.entity.RegionalCalibrationEntity;
import dev.devanks.agronomy.eto.exception.CalibrationStoreUnavailableException;
import dev.devanks.agronomy.eto.mapper.CalibrationEntityMapper;
import dev.devanks.agronomy.eto.model.ProviderId;
import dev.devanks.agronomy.eto.model.RegionalCalibration;
import dev.devanks.agronomy.eto.model.Season;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("FirestoreCalibrationRepository Unit Tests")
class FirestoreCalibrationRepositoryTest {

    @Mock
    private RegionalCalibrationFirestoreRepository mockFirestoreRepository;

    @Captor
    private ArgumentCaptor<List<String>> cellsCaptor;
    @Captor
    private ArgumentCaptor<RegionalCalibrationEntity> entityCaptor;

    private FirestoreCalibrationRepository repository;

    @BeforeEach
    void setUp() {
        EtoProperties etoProperties = new EtoProperties();
        etoProperties.getCalibration().setRepositoryTimeout(Duration.ofMillis(500));
        repository = new FirestoreCalibrationRepository(mockFirestoreRepository, new CalibrationEntityMapper(), etoProperties);
    }

    private static RegionalCalibrationEntity entity() {
        return RegionalCalibrationEntity.builder()
                .id("19.5,73.5_open-meteo_monsoon")
                .regionCellId("19.5,73.5").provider("open-meteo").season("monsoon")
                .correctionFactor(0.92).bias(0.3).sampleSize(12).confidence(0.4)
                .lastUpdated(Instant.parse("2024-07-01T00:00:00Z"))
                .build();
    }

    @Test
    @DisplayName("loadNearby - queries the 3x3 neighbourhood and maps entities")
    void loadNearby_Success() {
        // Arrange
        when(mockFirestoreRepository.findByRegionCellIdIn(cellsCaptor.capture())).thenReturn(Flux.just(entity()));

        // Act
        List<RegionalCalibration> result = repository.loadNearby(19.7, 73.8);

        // Assert
        assertThat(cellsCaptor.getValue()).hasSize(9).contains("19.5,73.5", "19.0,73.0", "20.0,74.0");
        assertThat(result).singleElement().satisfies(c -> {
            assertThat(c.getProvider()).isEqualTo(ProviderId.OPEN_METEO);
            assertThat(c.getSeason()).isEqualTo(Season.MONSOON);
            assertThat(c.getSampleSize()).isEqualTo(12);
        });
    }

    @Test
    void loadNearby_FirestoreError_WrapsAsUnavailable() {
        when(mockFirestoreRepository.findByRegionCellIdIn(anyList()))
                .thenReturn(Flux.error(new IllegalStateException("UNAVAILABLE: io exception")));

        assertThatThrownBy(() -> repository.loadNearby(19.7, 73.8))
                .isInstanceOf(CalibrationStoreUnavailableException.class)
                .hasRootCauseMessage("UNAVAILABLE: io exception");
    }

    @Test
    void loadNearby_SlowFirestore_TimesOut() {
        when(mockFirestoreRepository.findByRegionCellIdIn(anyList())).thenReturn(Flux.never());

        assertThatThrownBy(() -> repository.loadNearby(19.7, 73.8))
                .isInstanceOf(CalibrationStoreUnavailableException.class);
    }

    @Test
    @DisplayName("save - writes the entity under its composite document id")
    void save_Success() {
        // Arrange
        when(mockFirestoreRepository.save(entityCaptor.capture()))
                .thenAnswer(invocation -> Mono.just(invocation.getArgument(0, RegionalCalibrationEntity.class)));
        RegionalCalibration calibration = new CalibrationEntityMapper().mapToModel(entity());

        // Act
        repository.save(calibration);

        // Assert
        verify(mockFirestoreRepository).save(any(RegionalCalibrationEntity.class));
        assertThat(entityCaptor.getValue().getId()).isEqualTo("19.5,73.5_open-meteo_monsoon");
        assertThat(entityCaptor.getValue().getCorrectionFactor()).isEqualTo(0.92);
    }

    @Test
    void save_FirestoreError_WrapsAsUnavailable() {
        when(mockFirestoreRepository.save(any(RegionalCalibrationEntity.class)))
                .thenReturn(Mono.error(new RuntimeException("PERMISSION_DENIED")));
        RegionalCalibration calibration = new CalibrationEntityMapper().mapToModel(entity());

        assertThatThrownBy(() -> repository.save(calibration))
                .isInstanceOf(CalibrationStoreUnavailableException.class)
                .hasMessageContaining("19.5,73.5_open-meteo_monsoon");
    }
}

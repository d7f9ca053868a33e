// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/repository/FirestoreCalibrationRepository.java
package dev.devanks.agronomy.eto.repository;

import dev.devanks.agronomy.eto.config.EtoProperties;
import dev.devanks.agronomy.eto.entity.RegionalCalibrationEntity;
import dev.devanks.agronomy.eto.exception.CalibrationStoreUnavailableException;
import dev.devanks.agronomy.eto.mapper.CalibrationEntityMapper;
import dev.devanks.agronomy.eto.model.Coordinates;
import dev.devanks.agronomy.eto.model.RegionalCalibration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * {@link CalibrationRepository} backed by the {@code regional_calibrations} Firestore collection.
 * Reactive calls are blocked with the configured repository timeout.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "eto.calibration.repository", havingValue = "firestore")
public class FirestoreCalibrationRepository implements CalibrationRepository {

    private final RegionalCalibrationFirestoreRepository firestoreRepository;
    private final CalibrationEntityMapper entityMapper;
    private final EtoProperties etoProperties;

    @Override
    public List<RegionalCalibration> loadNearby(double latitude, double longitude) {
        List<String> cells = Coordinates.neighbouringCellIds(latitude, longitude);
        log.info("Loading calibrations for cells {} from Firestore.", cells);
        try {
            List<RegionalCalibrationEntity> entities = firestoreRepository.findByRegionCellIdIn(cells)
                    .doOnSubscribe(s -> log.debug("Subscribed to calibration query for {} cells", cells.size()))
                    .doOnError(e -> log.error("Error loading calibrations near ({}, {}): {}", latitude, longitude, e.getMessage(), e))
                    .collectList()
                    .block(etoProperties.getCalibration().getRepositoryTimeout());
            return entities == null ? List.of() : entities.stream().map(entityMapper::mapToModel).toList();
        } catch (RuntimeException e) {
            throw new CalibrationStoreUnavailableException("Failed to load calibrations near " + latitude + "," + longitude, e);
        }
    }

    @Override
    public void save(RegionalCalibration calibration) {
        RegionalCalibrationEntity entity = entityMapper.mapToEntity(calibration);
        try {
            firestoreRepository.save(entity)
                    .doOnSuccess(saved -> log.info("Successfully saved calibration ID: {}", saved.getId()))
                    .doOnError(e -> log.error("Failed to save calibration ID: {}", entity.getId(), e))
                    .block(etoProperties.getCalibration().getRepositoryTimeout());
        } catch (RuntimeException e) {
            throw new CalibrationStoreUnavailableException("Failed to save calibration " + entity.getId(), e);
        }
    }
}

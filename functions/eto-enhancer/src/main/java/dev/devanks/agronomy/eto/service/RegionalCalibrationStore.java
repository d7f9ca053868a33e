// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/service/RegionalCalibrationStore.java
package dev.devanks.agronomy.eto.service;

import com.google.common.annotations.VisibleForTesting;
import dev.devanks.agronomy.eto.config.EtoProperties;
import dev.devanks.agronomy.eto.exception.CalibrationStoreUnavailableException;
import dev.devanks.agronomy.eto.exception.InvalidCalibrationDataException;
import dev.devanks.agronomy.eto.model.CalibrationAdjustment;
import dev.devanks.agronomy.eto.model.CalibrationKey;
import dev.devanks.agronomy.eto.model.Coordinates;
import dev.devanks.agronomy.eto.model.ProviderId;
import dev.devanks.agronomy.eto.model.RegionalCalibration;
import dev.devanks.agronomy.eto.model.Season;
import dev.devanks.agronomy.eto.repository.CalibrationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import static dev.devanks.agronomy.eto.calculation.UnitConversions.round;

/**
 * Learns a multiplicative factor and an additive bias per (0.5° cell, provider, season) from
 * ground-truth measurements, and applies them to raw provider ETo.
 * <p>
 * Updates are exponential moving averages, serialized per key. Readers see immutable snapshots
 * without locking. Entries are loaded lazily from the {@link CalibrationRepository} the first time a
 * cell is touched and written back after every update.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RegionalCalibrationStore {

    private final CalibrationRepository calibrationRepository;
    private final EtoProperties etoProperties;
    private final Clock clock;

    private final ConcurrentMap<CalibrationKey, RegionalCalibration> calibrations = new ConcurrentHashMap<>();
    private final ConcurrentMap<CalibrationKey, Object> writeLocks = new ConcurrentHashMap<>();
    private final Set<String> loadedCells = ConcurrentHashMap.newKeySet();

    /**
     * Calibrated ETo for the point, or the input unchanged with zero confidence when nothing has
     * been learned for its cell, provider and season.
     */
    public CalibrationAdjustment apply(double eto, ProviderId provider, double latitude, double longitude, LocalDate date) {
        CalibrationKey key = keyFor(provider, latitude, longitude, date);
        ensureLoaded(latitude, longitude, key.getRegionCellId());

        RegionalCalibration calibration = calibrations.get(key);
        if (calibration == null) {
            log.debug("No calibration for {}, returning ETo unchanged.", key);
            return CalibrationAdjustment.unchanged(eto);
        }

        double calibrated = Math.max(0, eto * calibration.getCorrectionFactor() - calibration.getBias());
        log.debug("Calibrated {} -> {} using {}", eto, calibrated, calibration);
        return new CalibrationAdjustment(round(calibrated, 2), calibrated - eto, calibration.getConfidence());
    }

    /**
     * Folds one (provider estimate, measurement) pair into the calibration for the point's key.
     *
     * @return the new snapshot
     * @throws InvalidCalibrationDataException when apiETo is not positive or measuredETo is negative
     */
    public RegionalCalibration update(ProviderId provider, double latitude, double longitude, LocalDate date,
                                      double apiETo, double measuredETo) {
        if (!(apiETo > 0)) {
            throw new InvalidCalibrationDataException("apiETo must be positive but was " + apiETo);
        }
        if (!(measuredETo >= 0)) {
            throw new InvalidCalibrationDataException("measuredETo must be non-negative but was " + measuredETo);
        }
        CalibrationKey key = keyFor(provider, latitude, longitude, date);
        ensureLoaded(latitude, longitude, key.getRegionCellId());

        RegionalCalibration updated;
        synchronized (writeLocks.computeIfAbsent(key, k -> new Object())) {
            RegionalCalibration current = calibrations.getOrDefault(key, RegionalCalibration.initial(key, clock.instant()));
            updated = blend(current, apiETo, measuredETo);
            calibrations.put(key, updated);
            persist(updated);
        }
        log.info("Updated calibration {}: factor={}, bias={}, samples={}, confidence={}",
                key, updated.getCorrectionFactor(), updated.getBias(), updated.getSampleSize(), updated.getConfidence());
        return updated;
    }

    public Optional<RegionalCalibration> find(ProviderId provider, double latitude, double longitude, LocalDate date) {
        CalibrationKey key = keyFor(provider, latitude, longitude, date);
        ensureLoaded(latitude, longitude, key.getRegionCellId());
        return Optional.ofNullable(calibrations.get(key));
    }

    /**
     * True when any provider has a calibration for the point's cell in the date's season.
     */
    public boolean hasRegionalData(double latitude, double longitude, LocalDate date) {
        String cell = Coordinates.regionCellId(latitude, longitude);
        ensureLoaded(latitude, longitude, cell);
        Season season = Season.of(date);
        return calibrations.keySet().stream()
                .anyMatch(k -> k.getRegionCellId().equals(cell) && k.getSeason() == season);
    }

    @VisibleForTesting
    RegionalCalibration blend(RegionalCalibration current, double apiETo, double measuredETo) {
        double alpha = etoProperties.getCalibration().getLearningRate();
        int samples = current.getSampleSize() + 1;
        return current.toBuilder()
                .correctionFactor(current.getCorrectionFactor() * (1 - alpha) + (measuredETo / apiETo) * alpha)
                .bias(current.getBias() * (1 - alpha) + (apiETo - measuredETo) * alpha)
                .sampleSize(samples)
                .confidence(RegionalCalibration.confidenceFor(samples))
                .lastUpdated(clock.instant())
                .build();
    }

    private CalibrationKey keyFor(ProviderId provider, double latitude, double longitude, LocalDate date) {
        Coordinates.validate(latitude, longitude);
        return new CalibrationKey(Coordinates.regionCellId(latitude, longitude), provider, Season.of(date));
    }

    private void ensureLoaded(double latitude, double longitude, String cellId) {
        if (loadedCells.contains(cellId)) {
            return;
        }
        try {
            Map<CalibrationKey, RegionalCalibration> loaded = new HashMap<>();
            calibrationRepository.loadNearby(latitude, longitude).forEach(c -> loaded.put(c.key(), c));
            // In-memory entries may be newer than what was persisted
            loaded.forEach(calibrations::putIfAbsent);
            loadedCells.add(cellId);
            log.debug("Loaded {} stored calibrations around cell {}.", loaded.size(), cellId);
        } catch (CalibrationStoreUnavailableException e) {
            log.warn("Calibration store unavailable for cell {}, continuing with in-memory data: {}", cellId, e.getMessage());
        }
    }

    private void persist(RegionalCalibration calibration) {
        try {
            calibrationRepository.save(calibration);
        } catch (CalibrationStoreUnavailableException e) {
            log.warn("Could not persist calibration {}, keeping in-memory update: {}", calibration.key(), e.getMessage());
        }
    }
}

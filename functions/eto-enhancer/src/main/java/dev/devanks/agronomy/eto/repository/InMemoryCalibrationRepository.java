// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/repository/InMemoryCalibrationRepository.java
package dev.devanks.agronomy.eto.repository;

import dev.devanks.agronomy.eto.model.CalibrationKey;
import dev.devanks.agronomy.eto.model.Coordinates;
import dev.devanks.agronomy.eto.model.RegionalCalibration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local calibration storage for local runs and tests. Contents are lost on restart.
 */
@Repository
@Slf4j
@ConditionalOnProperty(name = "eto.calibration.repository", havingValue = "memory", matchIfMissing = true)
public class InMemoryCalibrationRepository implements CalibrationRepository {

    private final Map<CalibrationKey, RegionalCalibration> entries = new ConcurrentHashMap<>();

    @Override
    public List<RegionalCalibration> loadNearby(double latitude, double longitude) {
        Set<String> cells = Set.copyOf(Coordinates.neighbouringCellIds(latitude, longitude));
        List<RegionalCalibration> nearby = entries.values().stream()
                .filter(c -> cells.contains(c.getRegionCellId()))
                .toList();
        log.debug("Loaded {} in-memory calibrations around ({}, {}).", nearby.size(), latitude, longitude);
        return nearby;
    }

    @Override
    public void save(RegionalCalibration calibration) {
        entries.put(calibration.key(), calibration);
    }
}

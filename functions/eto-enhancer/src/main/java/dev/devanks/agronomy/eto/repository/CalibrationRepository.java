// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/repository/CalibrationRepository.java
package dev.devanks.agronomy.eto.repository;

import dev.devanks.agronomy.eto.model.RegionalCalibration;

import java.util.List;

/**
 * Durable storage for learned regional calibrations.
 * <p>
 * Implementations throw {@link dev.devanks.agronomy.eto.exception.CalibrationStoreUnavailableException}
 * when the backing store cannot be reached.
 */
public interface CalibrationRepository {

    /**
     * All calibrations in the 0.5° cell containing the point and its eight neighbours.
     */
    List<RegionalCalibration> loadNearby(double latitude, double longitude);

    /**
     * Insert or replace the entry with the same (cell, provider, season) key.
     */
    void save(RegionalCalibration calibration);
}

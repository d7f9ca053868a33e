// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/mapper/CalibrationEntityMapper.java
package dev.devanks.agronomy.eto.mapper;

import dev.devanks.agronomy.eto.entity.RegionalCalibrationEntity;
import dev.devanks.agronomy.eto.model.ProviderId;
import dev.devanks.agronomy.eto.model.RegionalCalibration;
import dev.devanks.agronomy.eto.model.Season;
import org.springframework.stereotype.Component;

@Component
public class CalibrationEntityMapper {

    public RegionalCalibrationEntity mapToEntity(RegionalCalibration calibration) {
        return RegionalCalibrationEntity.builder()
                .id(documentId(calibration))
                .regionCellId(calibration.getRegionCellId())
                .provider(calibration.getProvider().getTag())
                .season(calibration.getSeason().getTag())
                .correctionFactor(calibration.getCorrectionFactor())
                .bias(calibration.getBias())
                .sampleSize(calibration.getSampleSize())
                .confidence(calibration.getConfidence())
                .lastUpdated(calibration.getLastUpdated())
                .build();
    }

    public RegionalCalibration mapToModel(RegionalCalibrationEntity entity) {
        return RegionalCalibration.builder()
                .regionCellId(entity.getRegionCellId())
                .provider(ProviderId.fromTag(entity.getProvider()))
                .season(Season.fromTag(entity.getSeason()))
                .correctionFactor(entity.getCorrectionFactor())
                .bias(entity.getBias())
                .sampleSize(entity.getSampleSize())
                // Recomputed so a stored value can never exceed the cap
                .confidence(RegionalCalibration.confidenceFor(entity.getSampleSize()))
                .lastUpdated(entity.getLastUpdated())
                .build();
    }

    static String documentId(RegionalCalibration calibration) {
        return calibration.getRegionCellId() + "_" + calibration.getProvider().getTag() + "_" + calibration.getSeason().getTag();
    }
}

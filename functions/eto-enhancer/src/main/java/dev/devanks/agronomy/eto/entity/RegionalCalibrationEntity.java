// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/entity/RegionalCalibrationEntity.java
package dev.devanks.agronomy.eto.entity;

import com.google.cloud.firestore.annotation.DocumentId;
import com.google.cloud.spring.data.firestore.Document;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collectionName = "regional_calibrations")
public class RegionalCalibrationEntity {

    @DocumentId // "<cell>_<provider>_<season>", e.g. "19.5,73.5_open-meteo_monsoon"
    private String id;

    private String regionCellId;
    private String provider; // ProviderId tag
    private String season;   // Season tag
    private double correctionFactor;
    private double bias;
    private int sampleSize;
    private double confidence;
    private Instant lastUpdated;
}

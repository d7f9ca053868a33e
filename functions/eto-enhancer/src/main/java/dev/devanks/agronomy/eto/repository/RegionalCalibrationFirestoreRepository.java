// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/repository/RegionalCalibrationFirestoreRepository.java
package dev.devanks.agronomy.eto.repository;

import com.google.cloud.spring.data.firestore.FirestoreReactiveRepository;
import dev.devanks.agronomy.eto.entity.RegionalCalibrationEntity;
import reactor.core.publisher.Flux;

import java.util.List;

public interface RegionalCalibrationFirestoreRepository extends FirestoreReactiveRepository<RegionalCalibrationEntity> {

    // Firestore "in" filters accept at most 30 values; a 3x3 neighbourhood needs 9
    Flux<RegionalCalibrationEntity> findByRegionCellIdIn(List<String> regionCellIds);
}

// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/config/FirestoreConfig.java
package dev.devanks.agronomy.eto.config;

import com.google.cloud.spring.data.firestore.repository.config.EnableReactiveFirestoreRepositories;
import dev.devanks.agronomy.eto.repository.RegionalCalibrationFirestoreRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;

/**
 * Firestore repositories are only created when calibrations are persisted there, so local runs
 * need no GCP project or credentials.
 */
@Configuration
@ConditionalOnProperty(name = "eto.calibration.repository", havingValue = "firestore")
@EnableReactiveFirestoreRepositories(basePackageClasses = RegionalCalibrationFirestoreRepository.class)
public class FirestoreConfig {
}

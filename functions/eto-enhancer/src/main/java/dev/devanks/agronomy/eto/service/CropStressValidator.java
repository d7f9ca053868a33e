// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/service/CropStressValidator.java
package dev.devanks.agronomy.eto.service;

import dev.devanks.agronomy.eto.model.CropStressAssessment;
import dev.devanks.agronomy.eto.model.CropStressFeedback;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Uses observed crop stress as an indirect check on the ETo that drove irrigation.
 * More stress than expected means the crop needed more water, so ETo was too low.
 */
@Service
@Slf4j
public class CropStressValidator {

    static final double CORRECTION_THRESHOLD = 0.2;
    static final double ACCURACY_THRESHOLD = 0.15;
    static final double CORRECTION_FRACTION = 0.1;

    public CropStressAssessment validate(CropStressFeedback feedback, double eto) {
        double difference = feedback.getActualStress() - feedback.getExpectedStress();
        double magnitude = Math.abs(difference);

        double suggested = magnitude > CORRECTION_THRESHOLD ? Math.signum(difference) * eto * CORRECTION_FRACTION : 0.0;
        boolean accurate = magnitude < ACCURACY_THRESHOLD;
        // Between the two thresholds: not accurate, yet no correction suggested
        boolean deadZone = !accurate && magnitude <= CORRECTION_THRESHOLD;

        if (!accurate) {
            log.info("Farm {} on {}: stress differs by {} (stage {}), suggested ETo correction {}.",
                    feedback.getFarmId(), feedback.getDate(), difference, feedback.getCropStage(), suggested);
        }
        return CropStressAssessment.builder()
                .accurate(accurate)
                .suggestedCorrection(suggested)
                .stressDifference(difference)
                .inDeadZone(deadZone)
                .build();
    }
}

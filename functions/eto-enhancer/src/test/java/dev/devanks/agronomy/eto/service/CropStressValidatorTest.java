package dev.devanks.agronomy.eto.service;

import dev.devanks.agronomy.eto.model.CropStressAssessment;
import dev.devanks.agronomy.eto.model.CropStressFeedback;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CropStressValidatorTest {

    private final CropStressValidator validator = new CropStressValidator();

    private static CropStressFeedback feedback(double expected, double actual) {
        return CropStressFeedback.builder()
                .date(LocalDate.of(2024, 3, 12)).farmId(42).expectedStress(expected).actualStress(actual)
                .irrigationAmount(18).cropStage("flowering")
                .build();
    }

    @Test
    void validate_MoreStressThanExpected_SuggestsRaisingEto() {
        CropStressAssessment assessment = validator.validate(feedback(0.3, 0.6), 5.0);

        assertThat(assessment.isAccurate()).isFalse();
        assertThat(assessment.getSuggestedCorrection()).isCloseTo(0.5, within(1e-9));
        assertThat(assessment.getStressDifference()).isCloseTo(0.3, within(1e-9));
        assertThat(assessment.isInDeadZone()).isFalse();
    }

    @Test
    void validate_LessStressThanExpected_SuggestsLoweringEto() {
        CropStressAssessment assessment = validator.validate(feedback(0.5, 0.1), 6.0);

        assertThat(assessment.getSuggestedCorrection()).isCloseTo(-0.6, within(1e-9));
    }

    @Test
    void validate_SmallDifference_IsAccurate() {
        CropStressAssessment assessment = validator.validate(feedback(0.3, 0.4), 5.0);

        assertThat(assessment.isAccurate()).isTrue();
        assertThat(assessment.getSuggestedCorrection()).isEqualTo(0.0);
        assertThat(assessment.isInDeadZone()).isFalse();
    }

    @Test
    void validate_BetweenThresholds_FlagsDeadZone() {
        CropStressAssessment assessment = validator.validate(feedback(0.3, 0.48), 5.0);

        assertThat(assessment.isAccurate()).isFalse();
        assertThat(assessment.getSuggestedCorrection()).isEqualTo(0.0);
        assertThat(assessment.isInDeadZone()).isTrue();
    }
}

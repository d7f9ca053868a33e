package dev.devanks.agronomy.eto.service;

import dev.devanks.agronomy.eto.model.BiasReport;
import dev.devanks.agronomy.eto.model.BiasSample;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BiasDetectorTest {

    private final BiasDetector detector = new BiasDetector();

    private static BiasSample sample(int day, double api, Double validated) {
        return new BiasSample(LocalDate.of(2024, 5, day), api, validated);
    }

    @Test
    void detect_FewerThanThreeValidated_ReportsInsufficient() {
        BiasReport report = detector.detect(List.of(sample(1, 5.0, 4.0), sample(2, 5.0, null), sample(3, 5.2, 4.1)));

        assertThat(report.isHasBias()).isFalse();
        assertThat(report.getConfidence()).isEqualTo(0.0);
        assertThat(report.getSampleSize()).isEqualTo(2);
    }

    @Test
    void detect_ConsistentOverestimate_FlagsBias() {
        BiasReport report = detector.detect(List.of(
                sample(1, 5.0, 4.0), sample(2, 5.5, 4.5), sample(3, 6.0, 5.0), sample(4, 4.0, null)));

        assertThat(report.isHasBias()).isTrue();
        assertThat(report.getBiasAmount()).isEqualTo(1.0);
        assertThat(report.getConfidence()).isEqualTo(1.0);
        assertThat(report.getSampleSize()).isEqualTo(3);
    }

    @Test
    void detect_SmallScatteredOffsets_NoBias() {
        BiasReport report = detector.detect(List.of(sample(1, 5.2, 5.0), sample(2, 5.3, 5.0), sample(3, 5.1, 5.0)));

        assertThat(report.isHasBias()).isFalse();
        assertThat(report.getBiasAmount()).isEqualTo(0.2);
        assertThat(report.getConfidence()).isGreaterThan(0.9);
    }

    @Test
    void detect_NullSamples_ReportsInsufficient() {
        assertThat(detector.detect(null).getSampleSize()).isZero();
    }
}

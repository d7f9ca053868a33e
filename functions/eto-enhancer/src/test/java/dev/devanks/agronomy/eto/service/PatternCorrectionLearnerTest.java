package dev.devanks.agronomy.eto.service;

import dev.devanks.agronomy.eto.model.HistoricalValidation;
import dev.devanks.agronomy.eto.model.PatternCorrection;
import dev.devanks.agronomy.eto.model.Season;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PatternCorrectionLearnerTest {

    private final PatternCorrectionLearner learner = new PatternCorrectionLearner();

    private static HistoricalValidation day(double temp, double humidity, Season season, double api, double measured) {
        return HistoricalValidation.builder().temp(temp).humidity(humidity).season(season).apiETo(api).measuredETo(measured).build();
    }

    @Test
    void correct_ShortHistory_ReturnsInputWithLowConfidence() {
        List<HistoricalValidation> history = Collections.nCopies(9, day(30, 60, Season.MONSOON, 5.0, 5.5));

        PatternCorrection correction = learner.correct(4.0, 30, 60, Season.MONSOON, history);

        assertThat(correction.getCorrectedETo()).isEqualTo(4.0);
        assertThat(correction.getConfidence()).isEqualTo(0.3);
        assertThat(correction.getMatchCount()).isZero();
    }

    @Test
    void correct_SimilarDays_ScalesByMeanRatio() {
        List<HistoricalValidation> history = new ArrayList<>(Collections.nCopies(12, day(29, 62, Season.MONSOON, 5.0, 5.5)));
        // Too hot, too dry and wrong season: ignored
        history.add(day(36, 62, Season.MONSOON, 5.0, 2.5));
        history.add(day(29, 85, Season.MONSOON, 5.0, 2.5));
        history.add(day(29, 62, Season.SUMMER, 5.0, 2.5));

        PatternCorrection correction = learner.correct(4.0, 30, 60, Season.MONSOON, history);

        assertThat(correction.getCorrectedETo()).isEqualTo(4.4);
        assertThat(correction.getConfidence()).isEqualTo(0.6);
        assertThat(correction.getMatchCount()).isEqualTo(12);
    }

    @Test
    void correct_ManyMatches_ConfidenceCapped() {
        List<HistoricalValidation> history = Collections.nCopies(40, day(30, 60, Season.WINTER, 4.0, 4.0));

        assertThat(learner.correct(3.0, 30, 60, Season.WINTER, history).getConfidence()).isEqualTo(0.9);
    }

    @Test
    void correct_NoSimilarDay_ReturnsInputWithMediumConfidence() {
        List<HistoricalValidation> history = Collections.nCopies(15, day(15, 30, Season.WINTER, 3.0, 3.3));

        PatternCorrection correction = learner.correct(6.0, 35, 40, Season.SUMMER, history);

        assertThat(correction.getCorrectedETo()).isEqualTo(6.0);
        assertThat(correction.getConfidence()).isEqualTo(0.5);
    }
}

package dev.devanks.agronomy.eto.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Season Unit Tests")
class SeasonTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "2024-12-01, WINTER",
            "2024-01-15, WINTER",
            "2024-02-29, WINTER",
            "2024-03-01, SUMMER",
            "2024-05-31, SUMMER",
            "2024-06-15, MONSOON",
            "2024-09-30, MONSOON",
            "2024-10-01, POST_MONSOON",
            "2024-11-30, POST_MONSOON"
    })
    void of_mapsMonthToSeason(String date, Season expected) {
        assertThat(Season.of(LocalDate.parse(date))).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({"post-monsoon, POST_MONSOON", "MONSOON, MONSOON", "winter, WINTER"})
    void fromTag_acceptsTagOrName(String value, Season expected) {
        assertThat(Season.fromTag(value)).isEqualTo(expected);
    }
}

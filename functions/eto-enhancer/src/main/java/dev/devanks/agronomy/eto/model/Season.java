// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/model/Season.java
package dev.devanks.agronomy.eto.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.LocalDate;
import java.util.Arrays;

/**
 * Agronomic seasons used as the calibration and pattern-matching key (South Asian calendar).
 */
@Getter
@RequiredArgsConstructor
public enum Season {
    WINTER("winter"),
    SUMMER("summer"),
    MONSOON("monsoon"),
    POST_MONSOON("post-monsoon");

    @JsonValue
    private final String tag;

    public static Season of(LocalDate date) {
        int month = date.getMonthValue();
        if (month == 12 || month <= 2) {
            return WINTER;
        }
        if (month <= 5) {
            return SUMMER;
        }
        if (month <= 9) {
            return MONSOON;
        }
        return POST_MONSOON;
    }

    @JsonCreator
    public static Season fromTag(String value) {
        return Arrays.stream(values())
                .filter(season -> season.tag.equalsIgnoreCase(value) || season.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown season: " + value));
    }
}

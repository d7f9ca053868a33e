// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/model/ProviderId.java
package dev.devanks.agronomy.eto.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

@Getter
@RequiredArgsConstructor
public enum ProviderId {
    OPEN_METEO("open-meteo"),
    VISUAL_CROSSING("visual-crossing"),
    WEATHERBIT("weatherbit"),
    TOMORROW_IO("tomorrow-io");

    @JsonValue
    private final String tag;

    @JsonCreator
    public static ProviderId fromTag(String value) {
        return Arrays.stream(values())
                .filter(id -> id.tag.equalsIgnoreCase(value) || id.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown weather provider: " + value));
    }
}

package dev.devanks.agronomy.eto.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SensorSource {
    MANUAL, IOT, STATION;

    @JsonValue
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SensorSource fromTag(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}

// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/model/AccuracyMethod.java
package dev.devanks.agronomy.eto.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum AccuracyMethod {
    SINGLE_PROVIDER("single-provider"),
    ENSEMBLE_AVERAGE("ensemble-average"),
    WEIGHTED_ENSEMBLE("weighted-ensemble"),
    SENSOR_FUSION("sensor-fusion"),
    ML_CORRECTED("ml-corrected"),
    REGIONALLY_CALIBRATED("regionally-calibrated");

    @JsonValue
    private final String tag;
}

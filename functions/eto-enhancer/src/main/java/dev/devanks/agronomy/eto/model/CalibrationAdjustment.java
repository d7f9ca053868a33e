package dev.devanks.agronomy.eto.model;

import lombok.Value;

@Value
public class CalibrationAdjustment {
    double calibratedETo;
    double correction; // mm/day, calibrated minus input
    double confidence;

    public static CalibrationAdjustment unchanged(double eto) {
        return new CalibrationAdjustment(eto, 0.0, 0.0);
    }
}

package dev.devanks.agronomy.eto.model;

import lombok.Value;

@Value
public class PatternCorrection {
    double correctedETo;
    double confidence;
    int matchCount;
}

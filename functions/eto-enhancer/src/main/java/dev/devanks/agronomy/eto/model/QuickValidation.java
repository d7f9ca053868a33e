package dev.devanks.agronomy.eto.model;

import lombok.Value;

@Value
public class QuickValidation {
    double bias;
    double biasPercent;
    double correctionFactor;
}

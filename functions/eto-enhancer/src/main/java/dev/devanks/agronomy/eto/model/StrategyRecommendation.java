package dev.devanks.agronomy.eto.model;

import lombok.Value;

@Value
public class StrategyRecommendation {
    AccuracyMethod strategy;
    String expectedAccuracy;
    String reasoning;
}

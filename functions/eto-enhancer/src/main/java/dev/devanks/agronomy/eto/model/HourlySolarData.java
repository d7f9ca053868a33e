package dev.devanks.agronomy.eto.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class HourlySolarData {
    double minLux;
    double maxLux;
    double avgLux; // daylight hours only
    List<Double> hourlyLux;
}

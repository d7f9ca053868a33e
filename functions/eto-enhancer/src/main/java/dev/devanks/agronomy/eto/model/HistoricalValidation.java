package dev.devanks.agronomy.eto.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HistoricalValidation {
    private double apiETo;
    private double measuredETo;
    private double temp;     // °C mean
    private double humidity; // % mean
    private Season season;
}

package dev.devanks.agronomy.eto.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StrategyContext {
    private boolean hasLocalSensors;
    private boolean hasRegionalData;
    private boolean multipleProvidersAvailable;
    private int historicalValidations;
}

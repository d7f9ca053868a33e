package dev.devanks.agronomy.eto.model;

import lombok.Value;

/**
 * One provider's ETo for the requested day, as fed into the ensemble.
 */
@Value
public class ProviderEstimate {
    ProviderId provider;
    double eto;
    WeatherObservation observation;
}

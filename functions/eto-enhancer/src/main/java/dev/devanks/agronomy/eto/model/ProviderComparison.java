package dev.devanks.agronomy.eto.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ProviderComparison {
    List<ValidationStats> validations;
    ProviderId bestProvider;
    String report;
}

package dev.devanks.agronomy.eto.model;

import lombok.Value;

@Value
public class CalibrationKey {
    String regionCellId;
    ProviderId provider;
    Season season;
}

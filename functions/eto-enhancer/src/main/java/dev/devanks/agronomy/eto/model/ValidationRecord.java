package dev.devanks.agronomy.eto.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class ValidationRecord {
    LocalDate date;
    ProviderId provider;
    double apiETo;
    double stationETo;
    double error;        // api - station
    double errorPercent;
}

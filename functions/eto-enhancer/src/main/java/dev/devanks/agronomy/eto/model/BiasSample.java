package dev.devanks.agronomy.eto.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BiasSample {
    private LocalDate date;
    private double apiETo;
    private Double validatedETo; // null when no ground truth exists for the day
}

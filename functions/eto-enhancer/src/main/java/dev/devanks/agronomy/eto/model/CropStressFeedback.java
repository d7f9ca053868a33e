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
public class CropStressFeedback {
    private LocalDate date;
    private long farmId;
    private double expectedStress; // 0..1, what the irrigation model predicted
    private double actualStress;   // 0..1, what the farmer observed
    private double irrigationAmount; // mm applied
    private Double soilMoisture;     // volumetric, optional
    private String cropStage;
}

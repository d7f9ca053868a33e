package dev.devanks.agronomy.eto.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CropStressAssessment {
    boolean accurate;
    double suggestedCorrection; // mm/day
    double stressDifference;    // actual - expected
    boolean inDeadZone;         // neither accurate nor large enough to suggest a correction
}

// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/model/request/CalibrationFeedbackRequest.java
package dev.devanks.agronomy.eto.model.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.devanks.agronomy.eto.model.ProviderId;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CalibrationFeedbackRequest {
    private ProviderId provider;
    private double latitude;
    private double longitude;
    private String date;
    private double apiETo;
    private double measuredETo;
}

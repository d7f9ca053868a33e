// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/model/request/CropStressCheckRequest.java
package dev.devanks.agronomy.eto.model.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.devanks.agronomy.eto.model.CropStressFeedback;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CropStressCheckRequest {
    private double eto; // the ETo the irrigation was based on
    private CropStressFeedback feedback;
}

// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/model/request/BiasCheckRequest.java
package dev.devanks.agronomy.eto.model.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.devanks.agronomy.eto.model.BiasSample;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BiasCheckRequest {
    private List<BiasSample> samples;
}

// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/config/EtoProperties.java
package dev.devanks.agronomy.eto.config;

import dev.devanks.agronomy.eto.model.ProviderId;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.hibernate.validator.constraints.URL;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "eto")
public class EtoProperties {

    @Data
    @Validated
    public static class ProviderProperties {
        @NotEmpty
        @URL
        private String url;
        private String apiKey; // Not needed by Open-Meteo; injected from env for the others

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    @Data
    @Validated
    public static class ProvidersProperties {
        @NotNull
        @Valid
        private ProviderProperties openMeteo = new ProviderProperties();
        @NotNull
        @Valid
        private ProviderProperties visualCrossing = new ProviderProperties();
        @NotNull
        @Valid
        private ProviderProperties weatherbit = new ProviderProperties();
        @NotNull
        @Valid
        private ProviderProperties tomorrowIo = new ProviderProperties();
    }

    @Data
    @Validated
    public static class EnsembleProperties {
        @NotEmpty
        private List<ProviderId> providers = List.of(ProviderId.values());
        @NotNull
        private Duration providerTimeout = Duration.ofSeconds(10);
    }

    @Data
    @Validated
    public static class CalibrationProperties {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double learningRate = 0.2;
        @NotEmpty
        private String repository = "memory"; // memory | firestore
        @NotNull
        private Duration repositoryTimeout = Duration.ofSeconds(5);
    }

    @Data
    @Validated
    public static class SensorFusionProperties {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double confidence = 0.9;
        @DecimalMin("0.0")
        private double estimatedErrorPercent = 5.0;
    }

    @NotNull
    @Valid
    private ProvidersProperties providers = new ProvidersProperties();

    @NotNull
    @Valid
    private EnsembleProperties ensemble = new EnsembleProperties();

    @NotNull
    @Valid
    private CalibrationProperties calibration = new CalibrationProperties();

    @NotNull
    @Valid
    private SensorFusionProperties sensorFusion = new SensorFusionProperties();

    @NotEmpty
    private String userAgent = "ETo-Enhancer-Java-Feign/1.0";

    public ProviderProperties provider(ProviderId id) {
        return switch (id) {
            case OPEN_METEO -> providers.getOpenMeteo();
            case VISUAL_CROSSING -> providers.getVisualCrossing();
            case WEATHERBIT -> providers.getWeatherbit();
            case TOMORROW_IO -> providers.getTomorrowIo();
        };
    }
}

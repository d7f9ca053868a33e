// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/config/OpenMeteoApiClientConfig.java
package dev.devanks.agronomy.eto.config;

import feign.Logger.Level;
import feign.RequestInterceptor;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;

import static feign.Logger.Level.BASIC;

@RequiredArgsConstructor
public class OpenMeteoApiClientConfig {

    private final EtoProperties etoProperties;

    // Open-Meteo is keyless; only identify ourselves
    @Bean
    public RequestInterceptor userAgentInterceptor() {
        return ApiKeyInterceptors.userAgent(etoProperties);
    }

    @Bean
    public Level feignLoggerLevel() {
        return BASIC;
    }
}

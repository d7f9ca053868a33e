// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/config/TomorrowIoApiClientConfig.java
package dev.devanks.agronomy.eto.config;

import feign.Logger.Level;
import feign.RequestInterceptor;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;

import static feign.Logger.Level.BASIC;

@RequiredArgsConstructor
public class TomorrowIoApiClientConfig {

    private final EtoProperties etoProperties;

    @Bean
    public RequestInterceptor apiKeyInterceptor() {
        return ApiKeyInterceptors.queryApiKey("apikey", etoProperties.getProviders().getTomorrowIo());
    }

    @Bean
    public RequestInterceptor userAgentInterceptor() {
        return ApiKeyInterceptors.userAgent(etoProperties);
    }

    @Bean
    public Level feignLoggerLevel() {
        return BASIC;
    }
}

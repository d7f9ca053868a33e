// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/config/WeatherbitApiClientConfig.java
package dev.devanks.agronomy.eto.config;

import feign.Logger.Level;
import feign.RequestInterceptor;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;

import static feign.Logger.Level.BASIC;

@RequiredArgsConstructor
public class WeatherbitApiClientConfig {

    private final EtoProperties etoProperties;

    @Bean
    public RequestInterceptor apiKeyInterceptor() {
        return ApiKeyInterceptors.queryApiKey("key", etoProperties.getProviders().getWeatherbit());
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

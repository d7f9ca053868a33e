package dev.devanks.agronomy.eto.config;

import feign.RequestInterceptor;
import lombok.extern.slf4j.Slf4j;

import static org.springframework.http.HttpHeaders.USER_AGENT;

/**
 * Shared interceptor factories for the vendor Feign clients.
 */
@Slf4j
final class ApiKeyInterceptors {

    private ApiKeyInterceptors() {
    }

    static RequestInterceptor userAgent(EtoProperties properties) {
        return template -> template.header(USER_AGENT, properties.getUserAgent());
    }

    /**
     * Appends the vendor API key as a query parameter. A missing key is left to the provider
     * adapter, which rejects the call before it is made.
     */
    static RequestInterceptor queryApiKey(String parameterName, EtoProperties.ProviderProperties provider) {
        return template -> {
            if (!provider.hasApiKey()) {
                log.warn("No API key configured; request to {} will be sent without '{}'.", template.url(), parameterName);
                return;
            }
            log.debug("Adding '{}' query parameter to weather API request.", parameterName);
            template.query(parameterName, provider.getApiKey());
        };
    }
}

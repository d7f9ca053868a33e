// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/config/AppConfig.java
package dev.devanks.agronomy.eto.config;

import dev.devanks.agronomy.eto.provider.ProviderRegistry;
import dev.devanks.agronomy.eto.provider.WeatherProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

@Configuration
@Slf4j
public class AppConfig {

    // "Today" for provider date defaults is a UTC calendar day
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ProviderRegistry providerRegistry(List<WeatherProvider> weatherProviders) {
        log.info("Initializing ProviderRegistry with {} adapters.", weatherProviders.size());
        return new ProviderRegistry(weatherProviders);
    }
}

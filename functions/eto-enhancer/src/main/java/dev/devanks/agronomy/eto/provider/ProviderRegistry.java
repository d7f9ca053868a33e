// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/provider/ProviderRegistry.java
package dev.devanks.agronomy.eto.provider;

import dev.devanks.agronomy.eto.exception.ProviderUnavailableException;
import dev.devanks.agronomy.eto.model.ProviderId;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

import static dev.devanks.agronomy.eto.exception.ProviderUnavailableException.Reason.NO_DATA;

/**
 * Lookup of the configured {@link WeatherProvider} adapters by id. Immutable once built.
 */
@Slf4j
public class ProviderRegistry {

    private final Map<ProviderId, WeatherProvider> providers;

    public ProviderRegistry(Collection<? extends WeatherProvider> adapters) {
        Map<ProviderId, WeatherProvider> byId = new EnumMap<>(ProviderId.class);
        for (WeatherProvider adapter : adapters) {
            WeatherProvider previous = byId.put(adapter.id(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Duplicate weather provider registered for " + adapter.id());
            }
        }
        this.providers = Collections.unmodifiableMap(byId);
        log.info("Registered weather providers: {}", byId.keySet());
    }

    public WeatherProvider get(ProviderId id) {
        WeatherProvider provider = providers.get(id);
        if (provider == null) {
            throw new ProviderUnavailableException(id, NO_DATA, "provider is not registered");
        }
        return provider;
    }

    public boolean contains(ProviderId id) {
        return providers.containsKey(id);
    }

    public Set<ProviderId> ids() {
        return providers.keySet();
    }
}

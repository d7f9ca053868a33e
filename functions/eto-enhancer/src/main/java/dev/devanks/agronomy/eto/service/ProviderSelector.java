// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/service/ProviderSelector.java
package dev.devanks.agronomy.eto.service;

import dev.devanks.agronomy.eto.model.ProviderId;
import dev.devanks.agronomy.eto.model.ProviderPerformance;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

@Service
@Slf4j
public class ProviderSelector {

    static final List<ProviderId> STATIC_RANKING = List.of(
            ProviderId.OPEN_METEO, ProviderId.TOMORROW_IO, ProviderId.WEATHERBIT, ProviderId.VISUAL_CROSSING);

    static final int MIN_SAMPLES = 5;

    /**
     * Provider with the lowest error metric among those with at least {@value #MIN_SAMPLES} samples,
     * otherwise the head of the static ranking.
     */
    public ProviderId select(Map<ProviderId, ProviderPerformance> performance) {
        if (performance == null || performance.isEmpty()) {
            return STATIC_RANKING.get(0);
        }
        return performance.entrySet().stream()
                .filter(e -> e.getValue() != null && e.getValue().getSampleSize() >= MIN_SAMPLES)
                .min(Comparator.comparingDouble((Map.Entry<ProviderId, ProviderPerformance> e) -> e.getValue().getAccuracyErrorMetric())
                        .thenComparingInt(e -> STATIC_RANKING.indexOf(e.getKey())))
                .map(e -> {
                    log.debug("Selected {} by measured error {}", e.getKey().getTag(), e.getValue().getAccuracyErrorMetric());
                    return e.getKey();
                })
                .orElse(STATIC_RANKING.get(0));
    }

    public List<ProviderId> ranking() {
        return STATIC_RANKING;
    }
}

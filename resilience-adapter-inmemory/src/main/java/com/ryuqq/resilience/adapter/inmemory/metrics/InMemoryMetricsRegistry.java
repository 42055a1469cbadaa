package com.ryuqq.resilience.adapter.inmemory.metrics;

import com.ryuqq.resilience.core.metrics.ResilienceMetrics;
import com.ryuqq.resilience.core.spi.MetricsRegistry;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link MetricsRegistry}.
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>metrics:</strong> ConcurrentHashMap&lt;String, ResilienceMetrics&gt; - one counter set per operation name</li>
 * </ul>
 *
 * <p><strong>Concurrency:</strong></p>
 * <ul>
 *   <li>Creation is atomic via computeIfAbsent; repeat lookups return the same instance</li>
 *   <li>Counter updates are serialized by each {@link ResilienceMetrics} instance, never by the registry</li>
 *   <li>Resets zero counters in place so callers holding a reference keep accumulating into the live instance</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryMetricsRegistry implements MetricsRegistry {

    private final ConcurrentHashMap<String, ResilienceMetrics> metrics = new ConcurrentHashMap<>();

    @Override
    public ResilienceMetrics getMetrics(String operationName) {
        if (operationName == null || operationName.isBlank()) {
            throw new IllegalArgumentException("operationName cannot be null or blank");
        }
        return metrics.computeIfAbsent(operationName, name -> new ResilienceMetrics());
    }

    @Override
    public Optional<ResilienceMetrics> find(String operationName) {
        if (operationName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(metrics.get(operationName));
    }

    @Override
    public Map<String, ResilienceMetrics> all() {
        return new TreeMap<>(metrics);
    }

    @Override
    public void reset(String operationName) {
        find(operationName).ifPresent(ResilienceMetrics::reset);
    }

    @Override
    public void resetAll() {
        metrics.values().forEach(ResilienceMetrics::reset);
    }

    @Override
    public int size() {
        return metrics.size();
    }

    /**
     * Removes every operation entry.
     *
     * <p>Intended for tests only.</p>
     */
    public void clear() {
        metrics.clear();
    }
}

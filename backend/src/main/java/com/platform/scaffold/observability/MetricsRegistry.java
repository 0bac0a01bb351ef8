package com.platform.scaffold.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Central registry for application metrics.
 * Provides methods for recording custom counters, latencies and feature state.
 */
@Slf4j
@Component
public class MetricsRegistry {
    
    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters;
    private final Map<String, Timer> timers;
    private final Map<String, AtomicInteger> gaugeValues;
    
    public MetricsRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.counters = new ConcurrentHashMap<>();
        this.timers = new ConcurrentHashMap<>();
        this.gaugeValues = new ConcurrentHashMap<>();
    }
    
    /**
     * Increment a counter with tags.
     */
    public void incrementCounter(String name, String... tags) {
        String key = name + "." + String.join(".", tags);
        counters.computeIfAbsent(key, k -> 
            Counter.builder(name)
                .tags(tags)
                .register(meterRegistry))
            .increment();
    }
    
    /**
     * Record latency for a persistence operation.
     */
    public void recordLatency(String system, String operation, long latencyMs) {
        String timerKey = system + "." + operation;
        Timer timer = timers.computeIfAbsent(timerKey, k -> 
            Timer.builder("scaffold.operation.latency")
                .tag("system", system)
                .tag("operation", operation)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry));
        
        timer.record(Duration.ofMillis(latencyMs));
    }
    
    /**
     * Expose a feature's composition state as a 0/1 gauge.
     */
    public void setFeatureEnabled(String feature, boolean enabled) {
        AtomicInteger value = gaugeValues.computeIfAbsent(feature, k -> {
            AtomicInteger holder = new AtomicInteger(0);
            Gauge.builder("scaffold.feature.enabled", holder, AtomicInteger::get)
                .tag("feature", feature)
                .register(meterRegistry);
            return holder;
        });
        value.set(enabled ? 1 : 0);
        log.debug("Recorded feature {} enabled={}", feature, enabled);
    }
    
    /**
     * Current count of a tagged counter, 0 when it was never incremented.
     */
    public double getCount(String name, String... tags) {
        Counter counter = meterRegistry.find(name).tags(tags).counter();
        return counter != null ? counter.count() : 0;
    }
}

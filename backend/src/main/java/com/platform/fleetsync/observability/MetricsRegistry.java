package com.platform.fleetsync.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central registry for fleet sync metrics.
 * Device call latencies, credential recovery outcomes, drift and discovery counts.
 */
@Slf4j
@Component
public class MetricsRegistry {
    
    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters;
    private final Map<String, Timer> timers;
    
    public MetricsRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.counters = new ConcurrentHashMap<>();
        this.timers = new ConcurrentHashMap<>();
    }
    
    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }
    
    /**
     * Record latency of a single device call.
     */
    public void recordDeviceCall(int generation, String operation, String outcome, long latencyMs) {
        String timerKey = generation + "." + operation + "." + outcome;
        Timer timer = timers.computeIfAbsent(timerKey, k ->
            Timer.builder("fleetsync.device.call.latency")
                .tag("generation", "gen" + generation)
                .tag("operation", operation)
                .tag("outcome", outcome)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry));
        
        timer.record(Duration.ofMillis(latencyMs));
    }
    
    public void incrementCounter(String name) {
        counters.computeIfAbsent(name, k ->
            Counter.builder(name)
                .register(meterRegistry))
            .increment();
    }
    
    /**
     * Increment a counter with tags (key/value pairs).
     */
    public void incrementCounter(String name, String... tags) {
        String key = name + String.join(".", tags);
        counters.computeIfAbsent(key, k ->
            Counter.builder(name)
                .tags(tags)
                .register(meterRegistry))
            .increment();
    }
    
    public void recordCredentialTransition(Object fromState, Object toState) {
        incrementCounter("fleetsync.credential.transition",
            "from", String.valueOf(fromState),
            "to", String.valueOf(toState));
    }
    
    public void recordDriftCheck(String status) {
        incrementCounter("fleetsync.drift.checks", "status", status);
    }
    
    public void recordDiscoveryUpsert(boolean created) {
        incrementCounter("fleetsync.discovery.upserts", "result", created ? "created" : "updated");
    }
    
    public void recordCacheInvalidation(String reason) {
        incrementCounter("fleetsync.client.cache.invalidations", "reason", reason);
    }
}

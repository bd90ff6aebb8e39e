package it.unimib.datai.clout.controlplane.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import it.unimib.datai.clout.common.model.ExecutionOutcome;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class Metrics {
    private final MeterRegistry registry;
    private final Map<String, Counter> enqueuedCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> dequeuedCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> evictedCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> rejectedCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> executionCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> timeoutCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> retryCounters = new ConcurrentHashMap<>();
    private final Map<String, Timer> latencyTimers = new ConcurrentHashMap<>();

    public Metrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() {
        return registry;
    }

    public void enqueued(String queue) {
        counter(enqueuedCounters, "queue_enqueued_total", "queue", queue).increment();
    }

    public void dequeued(String queue) {
        counter(dequeuedCounters, "queue_dequeued_total", "queue", queue).increment();
    }

    public void evicted(String queue, int count) {
        counter(evictedCounters, "queue_evicted_total", "queue", queue).increment(count);
    }

    public void rejected(String queue) {
        counter(rejectedCounters, "queue_rejected_total", "queue", queue).increment();
    }

    public void execution(String function, ExecutionOutcome outcome) {
        String key = function + '\u0000' + outcome.name();
        executionCounters.computeIfAbsent(key, ignored -> Counter.builder("function_execution_total")
                .tag("function", function)
                .tag("outcome", outcome.name().toLowerCase())
                .register(registry)).increment();
    }

    public void timeout(String function) {
        counter(timeoutCounters, "function_timeout_total", "function", function).increment();
    }

    public void retry(String function) {
        counter(retryCounters, "function_retry_total", "function", function).increment();
    }

    public Timer latency(String function) {
        return latencyTimers.computeIfAbsent(function, name -> Timer.builder("function_latency_ms")
                .tag("function", name)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry));
    }

    private Counter counter(Map<String, Counter> map, String name, String tag, String value) {
        return map.computeIfAbsent(value, key -> Counter.builder(name)
                .tag(tag, value)
                .register(registry));
    }
}

package fr.lapetina.llmmanager.infrastructure.metrics;

import fr.lapetina.llmmanager.domain.model.ErrorType;
import fr.lapetina.llmmanager.registry.InstanceRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Dispatch counters per instance, backend type and outcome
 * - Dispatch latency timers per instance
 * - Error counters by type
 * - Live instance and backend type gauges
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    public static final String OUTCOME_SUCCESS = "success";
    public static final String OUTCOME_FAILURE = "failure";
    public static final String UNKNOWN = "unknown";

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> dispatchCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> errorCounters = new ConcurrentHashMap<>();

    private final AtomicInteger liveInstances = new AtomicInteger(0);
    private final AtomicInteger backendTypes = new AtomicInteger(0);

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        Gauge.builder(prefix + "_live_instances", liveInstances, AtomicInteger::get)
                .description("Number of live model instances")
                .register(registry);

        Gauge.builder(prefix + "_backend_types", backendTypes, AtomicInteger::get)
                .description("Number of registered backend types")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("llm_manager");
    }

    /**
     * Keeps the instance and type gauges in line with the given registry.
     */
    public void bindTo(InstanceRegistry instanceRegistry) {
        liveInstances.set(instanceRegistry.instanceCount());
        backendTypes.set(instanceRegistry.typeCount());
        instanceRegistry.addListener(event -> {
            liveInstances.set(instanceRegistry.instanceCount());
            backendTypes.set(instanceRegistry.typeCount());
        });
    }

    /**
     * Records a settled dispatch and its latency.
     */
    public void recordDispatch(String instanceId, String typeName, String outcome, Duration latency) {
        String key = instanceId + ":" + typeName + ":" + outcome;
        dispatchCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_dispatch_total")
                        .description("Total number of settled dispatches")
                        .tag("instance", instanceId)
                        .tag("type", typeName)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();

        String timerKey = instanceId + ":" + typeName;
        latencyTimers.computeIfAbsent(timerKey, k ->
                Timer.builder(prefix + "_dispatch_latency")
                        .description("Backend round-trip latency")
                        .tag("instance", instanceId)
                        .tag("type", typeName)
                        .publishPercentiles(0.5, 0.9, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Increments error counter.
     */
    public void incrementErrorCount(String instanceId, String typeName, ErrorType errorType) {
        String key = instanceId + ":" + typeName + ":" + errorType.name();
        errorCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_errors_total")
                        .description("Total number of dispatch errors")
                        .tag("instance", instanceId)
                        .tag("type", typeName)
                        .tag("error", errorType.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Counts a dispatch to an id that is not live. The id itself is not used as a
     * tag so that arbitrary caller input cannot create new series.
     */
    public void incrementNotFoundCount() {
        incrementErrorCount(UNKNOWN, UNKNOWN, ErrorType.INSTANCE_NOT_FOUND);
    }

    public int getLiveInstances() {
        return liveInstances.get();
    }

    public int getBackendTypes() {
        return backendTypes.get();
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}

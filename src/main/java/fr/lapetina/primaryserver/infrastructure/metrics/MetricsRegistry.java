package fr.lapetina.primaryserver.infrastructure.metrics;

import fr.lapetina.primaryserver.domain.model.ErrorType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Chunk, particle and event counters
 * - Generation and request latency timers
 * - Protocol violation and error counters
 * - Lifecycle state and event counter gauges
 * - JVM and system metrics, Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    private final Counter chunksServed;
    private final Counter particlesServed;
    private final Counter exhaustionSignals;
    private final Counter eventsGenerated;
    private final Counter protocolViolations;
    private final Counter reconfigurations;
    private final Counter chunksRolledBack;
    private final Timer generationLatency;

    private final ConcurrentHashMap<String, Timer> requestTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<ErrorType, Counter> errorCounters = new ConcurrentHashMap<>();

    private final AtomicInteger ringBufferRemaining = new AtomicInteger(0);

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        this.chunksServed = Counter.builder(prefix + "_chunks_served_total")
                .description("Chunks handed out to workers")
                .register(registry);
        this.particlesServed = Counter.builder(prefix + "_particles_served_total")
                .description("Primary particles handed out to workers")
                .register(registry);
        this.exhaustionSignals = Counter.builder(prefix + "_exhaustion_signals_total")
                .description("No-more-work replies sent")
                .register(registry);
        this.eventsGenerated = Counter.builder(prefix + "_events_generated_total")
                .description("Events produced by the generator")
                .register(registry);
        this.protocolViolations = Counter.builder(prefix + "_protocol_violations_total")
                .description("Requests with an unknown token")
                .register(registry);
        this.reconfigurations = Counter.builder(prefix + "_reconfigurations_total")
                .description("Accepted reconfiguration commands")
                .register(registry);
        this.chunksRolledBack = Counter.builder(prefix + "_chunks_rolled_back_total")
                .description("Chunks put back after their requester gave up")
                .register(registry);
        this.generationLatency = Timer.builder(prefix + "_generation_latency")
                .description("Time to produce one event")
                .publishPercentileHistogram()
                .register(registry);

        Gauge.builder(prefix + "_ringbuffer_remaining", ringBufferRemaining, AtomicInteger::get)
                .description("Remaining capacity in the ring buffer")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("primserver");
    }

    public void recordChunkServed(int particles) {
        chunksServed.increment();
        particlesServed.increment(particles);
    }

    public void incrementExhaustionSignals() {
        exhaustionSignals.increment();
    }

    public void recordEventGenerated(Duration latency) {
        eventsGenerated.increment();
        generationLatency.record(latency);
    }

    public void incrementProtocolViolations() {
        protocolViolations.increment();
    }

    public void incrementChunksRolledBack() {
        chunksRolledBack.increment();
    }

    public void incrementReconfigurations() {
        reconfigurations.increment();
    }

    /**
     * Records request latency per request token.
     */
    public void recordRequestLatency(String token, Duration latency) {
        requestTimers.computeIfAbsent(token, k ->
                Timer.builder(prefix + "_request_latency")
                        .description("Work channel request latency")
                        .tag("token", token)
                        .publishPercentiles(0.5, 0.9, 0.99)
                        .register(registry)
        ).record(latency);
    }

    public void incrementErrorCount(ErrorType errorType) {
        errorCounters.computeIfAbsent(errorType, k ->
                Counter.builder(prefix + "_errors_total")
                        .description("Error replies by type")
                        .tag("type", errorType.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Registers the lifecycle state gauge (wire code).
     */
    public void registerLifecycleState(Supplier<Number> stateCode) {
        Gauge.builder(prefix + "_lifecycle_state", stateCode, s -> s.get().doubleValue())
                .description("Lifecycle state (0=INITIALIZING, 1=WAITING_EVENT, 2=READY_TO_SERVE, 3=IDLE, 4=STOPPED)")
                .register(registry);
    }

    /**
     * Registers the gauge of events started in the current generation cycle.
     */
    public void registerEventCounter(Supplier<Number> eventCounter) {
        Gauge.builder(prefix + "_event_counter", eventCounter, s -> s.get().doubleValue())
                .description("Events started in the current generation cycle")
                .register(registry);
    }

    public void setRingBufferRemaining(int value) {
        ringBufferRemaining.set(value);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}

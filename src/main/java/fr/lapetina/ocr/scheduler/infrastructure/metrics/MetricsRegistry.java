package fr.lapetina.ocr.scheduler.infrastructure.metrics;

import fr.lapetina.ocr.scheduler.domain.model.ErrorType;
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
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Job lifecycle counters (submitted, succeeded, failed, rejected)
 * - Failure counters by error kind
 * - Pipeline stage latency timers
 * - Gauges for queue, workers, engine and GPU memory, sampled on scrape
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    private final Counter submitted;
    private final Counter succeeded;
    private final Counter failed;
    private final Counter publishFailures;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> rejectionCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<ErrorType, Counter> failureCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> stageTimers = new ConcurrentHashMap<>();

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        // Register JVM metrics
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        this.submitted = Counter.builder(prefix + "_tasks_submitted")
                .description("Jobs accepted into the queue")
                .register(registry);
        this.succeeded = Counter.builder(prefix + "_tasks_succeeded")
                .description("Jobs finished successfully")
                .register(registry);
        this.failed = Counter.builder(prefix + "_tasks_failed")
                .description("Jobs finished with a failure")
                .register(registry);
        this.publishFailures = Counter.builder(prefix + "_publish_failures")
                .description("Result publications that failed")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("ocr_scheduler");
    }

    public void incrementSubmitted() {
        submitted.increment();
    }

    public void incrementSucceeded() {
        succeeded.increment();
    }

    /**
     * Counts a failed job, both in total and by failure kind.
     */
    public void incrementFailed(ErrorType errorType) {
        failed.increment();
        failureCounters.computeIfAbsent(errorType, type ->
                Counter.builder(prefix + "_task_failures")
                        .description("Job failures by kind")
                        .tag("kind", type.name())
                        .register(registry)
        ).increment();
    }

    public void incrementPublishFailed() {
        publishFailures.increment();
    }

    /**
     * Counts a request refused at admission.
     */
    public void incrementRejected(ErrorType reason) {
        rejectionCounters.computeIfAbsent(reason.name(), k ->
                Counter.builder(prefix + "_tasks_rejected")
                        .description("Submissions refused at admission")
                        .tag("reason", k)
                        .register(registry)
        ).increment();
    }

    /**
     * Records stage-specific latency (materialize, inference, persist, package).
     */
    public void recordStageLatency(String stage, Duration latency) {
        stageTimers.computeIfAbsent(stage, k ->
                Timer.builder(prefix + "_stage_latency")
                        .description("Pipeline stage latency")
                        .tag("stage", stage)
                        .publishPercentileHistogram()
                        .register(registry)
        ).record(latency);
    }

    /**
     * Registers a gauge whose value is pulled from {@code valueSupplier} at scrape time.
     */
    public void registerGauge(String name, String description, Supplier<Number> valueSupplier) {
        Gauge.builder(prefix + "_" + name, valueSupplier, s -> {
                    Number value = s.get();
                    return value == null ? Double.NaN : value.doubleValue();
                })
                .description(description)
                .strongReference(true)
                .register(registry);
    }

    public double getSubmittedCount() {
        return submitted.count();
    }

    public double getSucceededCount() {
        return succeeded.count();
    }

    public double getFailedCount() {
        return failed.count();
    }

    public double getPublishFailedCount() {
        return publishFailures.count();
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

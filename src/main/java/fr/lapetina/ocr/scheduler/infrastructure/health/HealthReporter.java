package fr.lapetina.ocr.scheduler.infrastructure.health;

import fr.lapetina.ocr.scheduler.infrastructure.config.SchedulerConfig;
import fr.lapetina.ocr.scheduler.queue.JobQueue;
import fr.lapetina.ocr.scheduler.resource.MemoryInfo;
import fr.lapetina.ocr.scheduler.resource.ResourceManager;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Point-in-time view of the scheduler for the health endpoint.
 *
 * Status is UP while the queue runs with every worker alive, DEGRADED when some
 * workers died and DOWN when none is left or the queue is stopped.
 */
public final class HealthReporter {

    public static final String UP = "UP";
    public static final String DEGRADED = "DEGRADED";
    public static final String DOWN = "DOWN";

    private final JobQueue jobQueue;
    private final ResourceManager resourceManager;
    private final SchedulerConfig config;
    private final Clock clock;
    private final Instant startedAt;

    public HealthReporter(JobQueue jobQueue, ResourceManager resourceManager, SchedulerConfig config, Clock clock) {
        this.jobQueue = jobQueue;
        this.resourceManager = resourceManager;
        this.config = config;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    public HealthReporter(JobQueue jobQueue, ResourceManager resourceManager, SchedulerConfig config) {
        this(jobQueue, resourceManager, config, Clock.systemUTC());
    }

    public String status() {
        int running = jobQueue.runningWorkers();
        if (!jobQueue.isRunning() || running == 0) {
            return DOWN;
        }
        return running < config.getQueue().getMaxWorkers() ? DEGRADED : UP;
    }

    public Map<String, Object> snapshot() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", status());
        health.put("timestamp", clock.millis());
        health.put("uptime_seconds", Duration.between(startedAt, clock.instant()).getSeconds());

        Map<String, Object> queue = new LinkedHashMap<>();
        queue.put("size", jobQueue.queueSize());
        queue.put("capacity", jobQueue.queueCapacity());
        queue.put("full", jobQueue.isQueueFull());
        queue.put("running_workers", jobQueue.runningWorkers());
        queue.put("active_workers", jobQueue.activeWorkers());
        queue.put("max_workers", config.getQueue().getMaxWorkers());
        health.put("queue", queue);

        Optional<MemoryInfo> gpu = resourceManager.getMemoryProbe().gpuMemory(config.getResource().getGpuIndex());
        Optional<MemoryInfo> system = resourceManager.getMemoryProbe().systemMemory();

        Map<String, Object> engine = new LinkedHashMap<>();
        engine.put("loaded", resourceManager.isLoaded());
        engine.put("backend", resourceManager.getActiveBackend());
        engine.put("device", resourceManager.getRuntimeDevice().wireName());
        engine.put("fallback_reason", resourceManager.getFallbackReason());
        engine.put("in_flight", resourceManager.getInFlight());
        engine.put("allowed_concurrency", resourceManager.allowedConcurrency());
        health.put("engine", engine);

        Map<String, Object> memory = new LinkedHashMap<>();
        memory.put("gpu", gpu.map(HealthReporter::describe).orElse(null));
        memory.put("system", system.map(HealthReporter::describe).orElse(null));
        memory.put("pressure", resourceManager.isUnderMemoryPressure());
        health.put("memory", memory);

        Map<String, Object> limits = new LinkedHashMap<>();
        limits.put("max_upload_mb", config.getPipeline().getMaxUploadMb());
        limits.put("max_pages", config.getPipeline().getMaxPages());
        limits.put("batch_page_size", config.getPipeline().getBatchPageSize());
        limits.put("auto_batch", config.getPipeline().isEnableAutoBatch());
        health.put("limits", limits);
        return health;
    }

    private static Map<String, Object> describe(MemoryInfo info) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("free_gb", info.freeGb());
        values.put("total_gb", info.totalGb());
        return values;
    }
}

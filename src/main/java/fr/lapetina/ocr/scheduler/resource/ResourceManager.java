package fr.lapetina.ocr.scheduler.resource;

import fr.lapetina.ocr.scheduler.domain.engine.EngineProvider;
import fr.lapetina.ocr.scheduler.domain.engine.InferenceEngine;
import fr.lapetina.ocr.scheduler.domain.exception.AcquisitionTimeoutException;
import fr.lapetina.ocr.scheduler.domain.exception.EngineLoadException;
import fr.lapetina.ocr.scheduler.domain.model.Device;
import fr.lapetina.ocr.scheduler.infrastructure.config.SchedulerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Owner of the single, expensive inference engine.
 *
 * <p>Acquisition through {@link #inferenceContext(Duration)} runs, in order:
 * <ol>
 *   <li>global serialization, skipped for backends flagged concurrency-safe</li>
 *   <li>lazy load, with fallback to a secondary backend</li>
 *   <li>memory gate, on the GPU path for non-concurrency-safe backends only</li>
 * </ol>
 * Every live context counts as in-flight. A background watcher unloads the engine
 * once it has been idle long enough with nothing in flight.
 *
 * <p>Thread-safe. Engine construction is guarded by {@code loadLock}; the engine
 * reference, in-flight count and last-used timestamp by {@code stateLock}.
 */
public final class ResourceManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResourceManager.class);

    private static final double MIN_PER_JOB_GB = 0.1;

    private final SchedulerConfig.ResourceConfig config;
    private final int maxWorkers;
    private final EngineProvider engineProvider;
    private final MemoryProbe memoryProbe;
    private final Clock clock;
    private final Set<String> concurrencySafeBackends;

    private final Semaphore inferenceLock = new Semaphore(1, true);
    private final Object loadLock = new Object();
    private final Object stateLock = new Object();
    private final ScheduledExecutorService idleWatcher;
    private final AtomicBoolean running = new AtomicBoolean(false);

    // Guarded by stateLock
    private InferenceEngine engine;
    private int inFlight;
    private Instant lastUsed;

    private volatile Device runtimeDevice = Device.UNKNOWN;
    private volatile String fallbackReason;
    private volatile String activeBackend;

    public ResourceManager(
            SchedulerConfig.ResourceConfig config,
            int maxWorkers,
            EngineProvider engineProvider,
            MemoryProbe memoryProbe,
            Clock clock
    ) {
        this.config = config;
        this.maxWorkers = Math.max(1, maxWorkers);
        this.engineProvider = engineProvider;
        this.memoryProbe = memoryProbe;
        this.clock = clock;
        this.concurrencySafeBackends = config.getConcurrencySafeBackends().stream()
                .map(ResourceManager::normalize)
                .collect(Collectors.toUnmodifiableSet());
        this.activeBackend = normalize(config.getBackend());
        this.lastUsed = clock.instant();
        this.idleWatcher = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "engine-idle-watcher");
            t.setDaemon(true);
            return t;
        });
        log.info("ResourceManager initialized: backend={}, fallbackBackend={}, forceCpu={}, maxWorkers={}, idleUnloadSeconds={}",
                activeBackend, config.getFallbackBackend(), config.isForceCpu(), this.maxWorkers,
                config.getIdleUnloadSeconds());
    }

    public ResourceManager(
            SchedulerConfig.ResourceConfig config,
            int maxWorkers,
            EngineProvider engineProvider,
            MemoryProbe memoryProbe
    ) {
        this(config, maxWorkers, engineProvider, memoryProbe, Clock.systemUTC());
    }

    /**
     * Starts the idle watcher.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            long interval = config.getIdleCheckIntervalMs();
            idleWatcher.scheduleWithFixedDelay(this::checkIdleSafely, interval, interval, TimeUnit.MILLISECONDS);
            log.info("Engine idle watcher started: intervalMs={}", interval);
        }
    }

    /**
     * Acquires the engine for one inference call.
     *
     * @param timeout upper bound on the wait for the lock and the memory gate;
     *                engine construction itself is not interrupted
     * @throws AcquisitionTimeoutException if the lock or a gate slot was not obtained in time
     * @throws EngineLoadException         if no backend could be constructed
     */
    public InferenceContext inferenceContext(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        boolean serialized = false;

        if (requiresSerialization()) {
            serialized = acquireInferenceLock(deadline, timeout);
        }

        try {
            long backoffMs = config.getInitialBackoffMs();
            while (true) {
                InferenceEngine current = ensureLoaded();
                String backend = activeBackend;
                boolean safe = isConcurrencySafe(backend);

                // The lock decision may predate a load that fell back to another backend
                if (!safe && !serialized) {
                    serialized = acquireInferenceLock(deadline, timeout);
                    continue;
                }
                if (safe && serialized) {
                    inferenceLock.release();
                    serialized = false;
                }

                boolean gated = runtimeDevice == Device.GPU && !safe;
                boolean pressure = gated && isUnderMemoryPressure();
                int allowed = gated ? allowedConcurrency() : Integer.MAX_VALUE;

                synchronized (stateLock) {
                    // Reload if the watcher unloaded between load and admission
                    if (engine != current) {
                        continue;
                    }
                    if (!pressure && inFlight < allowed) {
                        inFlight++;
                        lastUsed = clock.instant();
                        log.debug("Inference context acquired: backend={}, device={}, inFlight={}, allowed={}",
                                backend, runtimeDevice.wireName(), inFlight, gated ? allowed : "unbounded");
                        return new InferenceContext(this, current, serialized);
                    }
                    log.debug("Memory gate closed: inFlight={}, allowed={}, memoryPressure={}",
                            inFlight, allowed, pressure);
                }

                long remainingNanos = deadline - System.nanoTime();
                if (remainingNanos <= 0) {
                    log.warn("Timed out waiting for memory gate: timeout={}", timeout);
                    throw new AcquisitionTimeoutException("Timed out waiting for GPU memory", timeout);
                }
                sleep(Math.min(backoffMs, TimeUnit.NANOSECONDS.toMillis(remainingNanos) + 1), timeout);
                backoffMs = Math.min(config.getMaxBackoffMs(), (long) (backoffMs * config.getBackoffMultiplier()));
            }
        } catch (RuntimeException e) {
            if (serialized) {
                inferenceLock.release();
            }
            throw e;
        }
    }

    /**
     * Whether a caller must take the inference lock before loading. Until a load has
     * resolved, either configured backend may end up active.
     */
    private boolean requiresSerialization() {
        synchronized (stateLock) {
            if (engine != null) {
                return !isConcurrencySafe(activeBackend);
            }
        }
        String fallback = normalize(config.getFallbackBackend());
        return !isConcurrencySafe(normalize(config.getBackend()))
                || (fallback != null && !isConcurrencySafe(fallback));
    }

    private boolean acquireInferenceLock(long deadline, Duration timeout) {
        try {
            long remaining = deadline - System.nanoTime();
            if (!inferenceLock.tryAcquire(Math.max(0, remaining), TimeUnit.NANOSECONDS)) {
                log.warn("Timed out waiting for inference lock: timeout={}", timeout);
                throw new AcquisitionTimeoutException("Timed out waiting for the inference lock", timeout);
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AcquisitionTimeoutException("Interrupted while waiting for the inference lock", timeout);
        }
    }

    private static void sleep(long millis, Duration timeout) {
        try {
            Thread.sleep(Math.max(1, millis));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AcquisitionTimeoutException("Interrupted while waiting for GPU memory", timeout);
        }
    }

    void release(InferenceContext context) {
        synchronized (stateLock) {
            inFlight = Math.max(0, inFlight - 1);
            lastUsed = clock.instant();
            log.debug("Inference context released: inFlight={}", inFlight);
        }
        if (context.isSerialized()) {
            inferenceLock.release();
        }
    }

    private InferenceEngine ensureLoaded() {
        synchronized (loadLock) {
            synchronized (stateLock) {
                if (engine != null) {
                    return engine;
                }
            }
            InferenceEngine loaded = load();
            synchronized (stateLock) {
                engine = loaded;
                lastUsed = clock.instant();
            }
            return loaded;
        }
    }

    private InferenceEngine load() {
        Device device = selectDevice();
        String primary = normalize(config.getBackend());
        String fallback = normalize(config.getFallbackBackend());
        long started = System.nanoTime();
        try {
            InferenceEngine created;
            try {
                created = engineProvider.create(primary, device);
                activeBackend = primary;
            } catch (Exception primaryFailure) {
                if (fallback == null || fallback.equals(primary)) {
                    throw primaryFailure;
                }
                fallbackReason = primary + " init failed: " + describe(primaryFailure);
                log.warn("Primary backend failed, falling back: primary={}, fallback={}, reason={}",
                        primary, fallback, describe(primaryFailure));
                created = engineProvider.create(fallback, device);
                activeBackend = fallback;
            }
            runtimeDevice = device;
            log.info("Engine loaded: backend={}, device={}, durationMs={}",
                    activeBackend, device.wireName(), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
            return created;
        } catch (Exception e) {
            runtimeDevice = Device.UNKNOWN;
            fallbackReason = "load failed: " + describe(e);
            log.error("Engine load failed: backend={}, device={}, error={}", primary, device.wireName(), describe(e));
            throw new EngineLoadException("Engine load failed: " + describe(e), e);
        }
    }

    private Device selectDevice() {
        if (config.isForceCpu()) {
            log.info("Runtime device selected: cpu (forced)");
            return Device.CPU;
        }
        if (memoryProbe.gpuMemory(config.getGpuIndex()).isPresent()) {
            log.info("Runtime device selected: gpu, gpuIndex={}", config.getGpuIndex());
            return Device.GPU;
        }
        log.info("Runtime device selected: cpu (no gpu)");
        return Device.CPU;
    }

    /**
     * Number of concurrent engine users the current GPU headroom allows.
     * Always at least 1 and at most the worker cap.
     */
    public int allowedConcurrency() {
        if (!config.isDynamicWorkers() || runtimeDevice != Device.GPU) {
            return 1;
        }
        Optional<MemoryInfo> gpu = memoryProbe.gpuMemory(config.getGpuIndex());
        if (gpu.isEmpty()) {
            return 1;
        }
        return allowedConcurrency(gpu.get().freeGb(), config.getReserveGpuMemGb(), config.getMemPerJobGb(), maxWorkers);
    }

    /**
     * {@code max(1, min(maxWorkers, floor(max(0, free - reserve) / max(0.1, perJob))))}.
     */
    public static int allowedConcurrency(double freeGb, double reserveGb, double perJobGb, int maxWorkers) {
        double usable = Math.max(0.0, freeGb - Math.max(0.0, reserveGb));
        double perJob = Math.max(MIN_PER_JOB_GB, perJobGb);
        int allowed = (int) Math.floor(usable / perJob);
        return Math.max(1, Math.min(maxWorkers, allowed));
    }

    /**
     * True when available system memory is below the configured floor.
     * An unreadable value counts as no pressure.
     */
    public boolean isUnderMemoryPressure() {
        return memoryProbe.systemMemory()
                .map(mem -> mem.freeGb() < config.getMinSystemMemoryGb())
                .orElse(false);
    }

    /**
     * One idle-watcher tick: unloads the engine when loaded, nothing is in flight
     * and the idle threshold has elapsed.
     *
     * @return true if the engine was unloaded
     */
    public boolean checkIdle() {
        InferenceEngine toClose;
        synchronized (stateLock) {
            if (engine == null || inFlight > 0) {
                return false;
            }
            Duration idle = Duration.between(lastUsed, clock.instant());
            if (idle.getSeconds() < config.getIdleUnloadSeconds()) {
                return false;
            }
            toClose = engine;
            engine = null;
            log.info("Unloading idle engine: backend={}, idleSeconds={}", activeBackend, idle.getSeconds());
        }
        closeEngine(toClose);
        return true;
    }

    private void checkIdleSafely() {
        try {
            checkIdle();
        } catch (RuntimeException e) {
            log.warn("Idle check failed", e);
        }
    }

    /**
     * Unloads the engine if loaded, regardless of idle time. Contexts still open keep their reference.
     */
    public void unload() {
        InferenceEngine toClose;
        synchronized (stateLock) {
            toClose = engine;
            engine = null;
        }
        if (toClose != null) {
            closeEngine(toClose);
            log.info("Engine unloaded");
        }
    }

    private void closeEngine(InferenceEngine toClose) {
        try {
            toClose.close();
        } catch (RuntimeException e) {
            log.warn("Error closing engine: {}", e.getMessage(), e);
        }
    }

    public boolean isLoaded() {
        synchronized (stateLock) {
            return engine != null;
        }
    }

    public int getInFlight() {
        synchronized (stateLock) {
            return inFlight;
        }
    }

    public Instant getLastUsed() {
        synchronized (stateLock) {
            return lastUsed;
        }
    }

    public Device getRuntimeDevice() {
        return runtimeDevice;
    }

    public String getFallbackReason() {
        return fallbackReason;
    }

    public String getActiveBackend() {
        return activeBackend;
    }

    public MemoryProbe getMemoryProbe() {
        return memoryProbe;
    }

    private boolean isConcurrencySafe(String backend) {
        return concurrencySafeBackends.contains(backend) || engineProvider.isConcurrencySafe(backend);
    }

    private static String normalize(String backend) {
        return backend == null ? null : backend.trim().toLowerCase(Locale.ROOT);
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            idleWatcher.shutdown();
            try {
                if (!idleWatcher.awaitTermination(config.getStopTimeoutMs(), TimeUnit.MILLISECONDS)) {
                    idleWatcher.shutdownNow();
                }
            } catch (InterruptedException e) {
                idleWatcher.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("Engine idle watcher stopped");
        } else {
            idleWatcher.shutdownNow();
        }
        unload();
    }
}

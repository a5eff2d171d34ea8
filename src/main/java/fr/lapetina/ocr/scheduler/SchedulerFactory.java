package fr.lapetina.ocr.scheduler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.ocr.scheduler.domain.engine.EngineProvider;
import fr.lapetina.ocr.scheduler.infrastructure.config.ConfigLoader;
import fr.lapetina.ocr.scheduler.infrastructure.config.SchedulerConfig;
import fr.lapetina.ocr.scheduler.infrastructure.health.HealthReporter;
import fr.lapetina.ocr.scheduler.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.ocr.scheduler.pipeline.DocumentPipeline;
import fr.lapetina.ocr.scheduler.pipeline.InputMaterializer;
import fr.lapetina.ocr.scheduler.pipeline.PdfInspector;
import fr.lapetina.ocr.scheduler.pipeline.ResultWriter;
import fr.lapetina.ocr.scheduler.publish.LocalPublisher;
import fr.lapetina.ocr.scheduler.publish.PublishService;
import fr.lapetina.ocr.scheduler.publish.Publisher;
import fr.lapetina.ocr.scheduler.publish.RemoteObjectStore;
import fr.lapetina.ocr.scheduler.publish.RemotePublisher;
import fr.lapetina.ocr.scheduler.queue.JobQueue;
import fr.lapetina.ocr.scheduler.queue.JobSubmissionService;
import fr.lapetina.ocr.scheduler.resource.MemoryInfo;
import fr.lapetina.ocr.scheduler.resource.MemoryProbe;
import fr.lapetina.ocr.scheduler.resource.NvidiaSmiMemoryProbe;
import fr.lapetina.ocr.scheduler.resource.ResourceManager;
import fr.lapetina.ocr.scheduler.security.ApiKeyAuthenticator;
import fr.lapetina.ocr.scheduler.security.DownloadToken;
import fr.lapetina.ocr.scheduler.security.DownloadTokenService;
import fr.lapetina.ocr.scheduler.security.RateLimiter;
import fr.lapetina.ocr.scheduler.security.TokenStore;
import fr.lapetina.ocr.scheduler.storage.JobStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.ServiceLoader;

/**
 * Factory for creating a fully-wired scheduler from configuration.
 * This is the primary entry point for obtaining a configured job queue.
 *
 * <p>Usage:
 * <pre>{@code
 * try (SchedulerFactory factory = SchedulerFactory.create("config.yaml").start()) {
 *     Job job = factory.getSubmissionService().submitRemote(url, JobOptions.defaults());
 *     // wait on job.completion()...
 * }
 * }</pre>
 *
 * <p>The inference engine is discovered through {@link ServiceLoader}; subclasses may
 * pass an explicit provider, memory probe and remote store instead.
 */
public class SchedulerFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SchedulerFactory.class);

    private final SchedulerConfig config;
    private final ObjectMapper objectMapper;
    private final MetricsRegistry metricsRegistry;
    private final JobStorage storage;
    private final ResourceManager resourceManager;
    private final DocumentPipeline pipeline;
    private final Publisher publisher;
    private final JobQueue jobQueue;
    private final JobSubmissionService submissionService;
    private final TokenStore tokenStore;
    private final DownloadTokenService tokenService;
    private final PublishService publishService;
    private final ApiKeyAuthenticator authenticator;
    private final RateLimiter rateLimiter;
    private final HealthReporter healthReporter;

    protected SchedulerFactory(String configPath, EngineProvider engineProvider, MemoryProbe memoryProbe,
                               RemoteObjectStore remoteStore) {
        this(new ConfigLoader(configPath).load(), engineProvider, memoryProbe, remoteStore);
    }

    protected SchedulerFactory(SchedulerConfig config, EngineProvider engineProvider, MemoryProbe memoryProbe,
                               RemoteObjectStore remoteStore) {
        log.info("Initializing SchedulerFactory: storageRoot={}, backend={}, maxWorkers={}",
                config.getStorage().getRoot(), config.getResource().getBackend(), config.getQueue().getMaxWorkers());
        this.config = config;

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule());

        // Initialize metrics
        this.metricsRegistry = config.getMetrics().isEnabled()
                ? new MetricsRegistry(config.getMetrics().getPrefix())
                : null;

        // Storage, cleaned once at startup
        this.storage = new JobStorage(Path.of(config.getStorage().getRoot()), objectMapper);
        storage.cleanupOldJobs(config.getStorage().getMaxJobRetention());

        // Engine lifecycle (allow overrides for testing)
        this.resourceManager = new ResourceManager(
                config.getResource(),
                config.getQueue().getMaxWorkers(),
                engineProvider != null ? engineProvider : discoverEngineProvider(),
                memoryProbe != null ? memoryProbe : new NvidiaSmiMemoryProbe()
        );

        SchedulerConfig.PipelineConfig pipelineConfig = config.getPipeline();
        this.pipeline = new DocumentPipeline(
                resourceManager,
                new InputMaterializer(
                        pipelineConfig.getMaxUploadMb(),
                        pipelineConfig.getDownloadChunkMb(),
                        Duration.ofSeconds(pipelineConfig.getDownloadTimeoutSeconds())),
                new PdfInspector(),
                new ResultWriter(objectMapper),
                metricsRegistry,
                pipelineConfig,
                config.getResource()
        );

        // Publishing
        SchedulerConfig.PublishConfig publishConfig = config.getPublish();
        Duration signExpiry = Duration.ofSeconds(publishConfig.getSignExpireSeconds());
        RemotePublisher remotePublisher = null;
        if (DownloadToken.REMOTE.equals(publishConfig.getBackend())) {
            if (remoteStore == null) {
                throw new ConfigLoader.ConfigurationException(
                        "publish.backend is remote but no remote object store is available");
            }
            remotePublisher = new RemotePublisher(remoteStore, publishConfig.getRemotePrefix(), signExpiry);
        }
        this.publisher = remotePublisher != null ? remotePublisher : new LocalPublisher();

        // Build queue
        this.jobQueue = JobQueue.builder()
                .fromConfig(config)
                .processor(job -> pipeline.run(job.getSource(), job.getPaths(), job.getOptions()))
                .storage(storage)
                .metricsRegistry(metricsRegistry)
                .publisher(publisher)
                .build();
        this.submissionService = new JobSubmissionService(
                jobQueue, storage, metricsRegistry, pipelineConfig.getMaxUploadMb());

        // Download tokens
        this.tokenStore = new TokenStore(
                Path.of(config.getTokens().getStorePath()),
                storage.getRoot(),
                publisher.backend(),
                remoteStore,
                signExpiry,
                objectMapper,
                Clock.systemUTC()
        );
        this.tokenService = new DownloadTokenService(
                tokenStore,
                storage,
                remotePublisher,
                config.getTokens().getDefaultMaxDownloads(),
                config.getTokens().getDefaultTtlSeconds()
        );
        this.publishService = new PublishService(publisher, storage, metricsRegistry);
        this.authenticator = ApiKeyAuthenticator.fromConfig(config.getAuth());
        if (!authenticator.isEnabled()) {
            log.warn("No API keys configured, /v1 routes are open");
        }

        SchedulerConfig.RateLimitConfig rateLimitConfig = config.getRateLimit();
        this.rateLimiter = rateLimitConfig.isEnabled()
                ? new RateLimiter(
                        rateLimitConfig.getRatePerSecond(),
                        rateLimitConfig.getBurst(),
                        Duration.ofSeconds(rateLimitConfig.getTtlSeconds()),
                        Duration.ofSeconds(rateLimitConfig.getSweepIntervalSeconds()))
                : null;

        this.healthReporter = new HealthReporter(jobQueue, resourceManager, config);

        registerGauges();

        log.info("SchedulerFactory initialized: queueCapacity={}, publishBackend={}, rateLimit={}",
                jobQueue.queueCapacity(), publisher.backend(), rateLimitConfig.isEnabled());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static SchedulerFactory create(String configPath) {
        return new SchedulerFactory(configPath, null, null, null);
    }

    /**
     * Creates a factory from the default configuration (config.yaml).
     */
    public static SchedulerFactory create() {
        return create("config.yaml");
    }

    /**
     * Starts the workers, the engine idle watcher and the rate limiter sweep.
     */
    public SchedulerFactory start() {
        resourceManager.start();
        jobQueue.start();
        if (rateLimiter != null) {
            rateLimiter.start();
        }
        int purged = tokenStore.purgeDead();
        log.info("Scheduler started: workers={}, purgedTokens={}", config.getQueue().getMaxWorkers(), purged);
        return this;
    }

    public SchedulerConfig getConfig() {
        return config;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    /**
     * Returns the metrics registry, or null when metrics are disabled.
     */
    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public JobStorage getStorage() {
        return storage;
    }

    public ResourceManager getResourceManager() {
        return resourceManager;
    }

    public DocumentPipeline getPipeline() {
        return pipeline;
    }

    public Publisher getPublisher() {
        return publisher;
    }

    public JobQueue getJobQueue() {
        return jobQueue;
    }

    public JobSubmissionService getSubmissionService() {
        return submissionService;
    }

    public TokenStore getTokenStore() {
        return tokenStore;
    }

    public DownloadTokenService getTokenService() {
        return tokenService;
    }

    public PublishService getPublishService() {
        return publishService;
    }

    public ApiKeyAuthenticator getAuthenticator() {
        return authenticator;
    }

    /**
     * Returns the rate limiter, or null when rate limiting is disabled.
     */
    public RateLimiter getRateLimiter() {
        return rateLimiter;
    }

    public HealthReporter getHealthReporter() {
        return healthReporter;
    }

    private void registerGauges() {
        if (metricsRegistry == null) {
            return;
        }
        int gpuIndex = config.getResource().getGpuIndex();
        MemoryProbe probe = resourceManager.getMemoryProbe();

        metricsRegistry.registerGauge("queue_size", "Jobs waiting in the queue", jobQueue::queueSize);
        metricsRegistry.registerGauge("queue_capacity", "Queue capacity", jobQueue::queueCapacity);
        metricsRegistry.registerGauge("running_workers", "Worker threads alive", jobQueue::runningWorkers);
        metricsRegistry.registerGauge("active_workers", "Workers processing a job", jobQueue::activeWorkers);
        metricsRegistry.registerGauge("engine_loaded", "1 when the engine is loaded",
                () -> resourceManager.isLoaded() ? 1 : 0);
        metricsRegistry.registerGauge("engine_in_flight", "Open inference contexts", resourceManager::getInFlight);
        metricsRegistry.registerGauge("allowed_concurrency", "Concurrent engine users allowed by GPU headroom",
                resourceManager::allowedConcurrency);
        metricsRegistry.registerGauge("gpu_memory_free_gb", "Free GPU memory",
                () -> probe.gpuMemory(gpuIndex).map(MemoryInfo::freeGb).orElse(null));
        metricsRegistry.registerGauge("gpu_memory_total_gb", "Total GPU memory",
                () -> probe.gpuMemory(gpuIndex).map(MemoryInfo::totalGb).orElse(null));
        metricsRegistry.registerGauge("download_tokens", "Download tokens on record", tokenStore::size);
    }

    private static EngineProvider discoverEngineProvider() {
        Iterator<EngineProvider> providers = ServiceLoader.load(EngineProvider.class).iterator();
        if (providers.hasNext()) {
            EngineProvider provider = providers.next();
            log.info("Engine provider discovered: {}", provider.getClass().getName());
            return provider;
        }
        log.warn("No EngineProvider registered, jobs will fail with ENGINE_LOAD_ERROR");
        return (backend, device) -> {
            throw new IllegalStateException("No inference engine installed for backend " + backend);
        };
    }

    @Override
    public void close() {
        log.info("Closing SchedulerFactory...");

        try {
            jobQueue.close();
        } catch (Exception e) {
            log.warn("Error closing job queue", e);
        }

        try {
            resourceManager.close();
        } catch (Exception e) {
            log.warn("Error closing resource manager", e);
        }

        if (rateLimiter != null) {
            try {
                rateLimiter.close();
            } catch (Exception e) {
                log.warn("Error closing rate limiter", e);
            }
        }

        if (metricsRegistry != null) {
            try {
                metricsRegistry.close();
            } catch (Exception e) {
                log.warn("Error closing metrics registry", e);
            }
        }

        log.info("SchedulerFactory closed");
    }
}

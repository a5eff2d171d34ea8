package fr.lapetina.ocr.scheduler.infrastructure.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object for the scheduler.
 * Designed to be populated from YAML.
 */
public class SchedulerConfig {

    private ServerConfig server = new ServerConfig();
    private StorageConfig storage = new StorageConfig();
    private QueueConfig queue = new QueueConfig();
    private ResourceConfig resource = new ResourceConfig();
    private PipelineConfig pipeline = new PipelineConfig();
    private PublishConfig publish = new PublishConfig();
    private TokensConfig tokens = new TokensConfig();
    private RateLimitConfig rateLimit = new RateLimitConfig();
    private AuthConfig auth = new AuthConfig();
    private MetricsConfig metrics = new MetricsConfig();
    private DefaultsConfig defaults = new DefaultsConfig();

    // Getters and Setters
    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public StorageConfig getStorage() { return storage; }
    public void setStorage(StorageConfig storage) { this.storage = storage; }

    public QueueConfig getQueue() { return queue; }
    public void setQueue(QueueConfig queue) { this.queue = queue; }

    public ResourceConfig getResource() { return resource; }
    public void setResource(ResourceConfig resource) { this.resource = resource; }

    public PipelineConfig getPipeline() { return pipeline; }
    public void setPipeline(PipelineConfig pipeline) { this.pipeline = pipeline; }

    public PublishConfig getPublish() { return publish; }
    public void setPublish(PublishConfig publish) { this.publish = publish; }

    public TokensConfig getTokens() { return tokens; }
    public void setTokens(TokensConfig tokens) { this.tokens = tokens; }

    public RateLimitConfig getRateLimit() { return rateLimit; }
    public void setRateLimit(RateLimitConfig rateLimit) { this.rateLimit = rateLimit; }

    public AuthConfig getAuth() { return auth; }
    public void setAuth(AuthConfig auth) { this.auth = auth; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    public DefaultsConfig getDefaults() { return defaults; }
    public void setDefaults(DefaultsConfig defaults) { this.defaults = defaults; }

    /**
     * HTTP server configuration.
     */
    public static class ServerConfig {
        private int port = 8000;
        private String host = "0.0.0.0";
        private int backlog = 100;
        private int httpThreads = 8;

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public int getHttpThreads() { return httpThreads; }
        public void setHttpThreads(int httpThreads) { this.httpThreads = httpThreads; }
    }

    /**
     * Job storage configuration.
     */
    public static class StorageConfig {
        private String root = "data/jobs";
        private int maxJobRetention = 1000;

        public String getRoot() { return root; }
        public void setRoot(String root) { this.root = root; }

        public int getMaxJobRetention() { return maxJobRetention; }
        public void setMaxJobRetention(int maxJobRetention) { this.maxJobRetention = maxJobRetention; }
    }

    /**
     * Job queue and worker pool configuration.
     */
    public static class QueueConfig {
        private int maxWorkers = 1;
        private int maxQueueSize = 100;
        private long pollIntervalMs = 500;
        private long stopJoinTimeoutMs = 1000;

        public int getMaxWorkers() { return maxWorkers; }
        public void setMaxWorkers(int maxWorkers) { this.maxWorkers = maxWorkers; }

        public int getMaxQueueSize() { return maxQueueSize; }
        public void setMaxQueueSize(int maxQueueSize) { this.maxQueueSize = maxQueueSize; }

        public long getPollIntervalMs() { return pollIntervalMs; }
        public void setPollIntervalMs(long pollIntervalMs) { this.pollIntervalMs = pollIntervalMs; }

        public long getStopJoinTimeoutMs() { return stopJoinTimeoutMs; }
        public void setStopJoinTimeoutMs(long stopJoinTimeoutMs) { this.stopJoinTimeoutMs = stopJoinTimeoutMs; }
    }

    /**
     * Engine lifecycle and memory gate configuration.
     */
    public static class ResourceConfig {
        private String backend = "hf";
        private String fallbackBackend = "hf";
        private List<String> concurrencySafeBackends = new ArrayList<>(List.of("vllm"));
        private boolean forceCpu = false;
        private boolean dynamicWorkers = true;
        private int gpuIndex = 0;
        private double memPerJobGb = 8.0;
        private double reserveGpuMemGb = 1.0;
        private double minSystemMemoryGb = 2.0;
        private long idleUnloadSeconds = 600;
        private long idleCheckIntervalMs = 1000;
        private long loadTimeoutSeconds = 180;
        private long minAcquireTimeoutSeconds = 60;
        private long initialBackoffMs = 100;
        private long maxBackoffMs = 500;
        private double backoffMultiplier = 2.0;
        private long stopTimeoutMs = 1000;

        public String getBackend() { return backend; }
        public void setBackend(String backend) { this.backend = backend; }

        public String getFallbackBackend() { return fallbackBackend; }
        public void setFallbackBackend(String fallbackBackend) { this.fallbackBackend = fallbackBackend; }

        public List<String> getConcurrencySafeBackends() { return concurrencySafeBackends; }
        public void setConcurrencySafeBackends(List<String> backends) { this.concurrencySafeBackends = backends; }

        public boolean isForceCpu() { return forceCpu; }
        public void setForceCpu(boolean forceCpu) { this.forceCpu = forceCpu; }

        public boolean isDynamicWorkers() { return dynamicWorkers; }
        public void setDynamicWorkers(boolean dynamicWorkers) { this.dynamicWorkers = dynamicWorkers; }

        public int getGpuIndex() { return gpuIndex; }
        public void setGpuIndex(int gpuIndex) { this.gpuIndex = gpuIndex; }

        public double getMemPerJobGb() { return memPerJobGb; }
        public void setMemPerJobGb(double memPerJobGb) { this.memPerJobGb = memPerJobGb; }

        public double getReserveGpuMemGb() { return reserveGpuMemGb; }
        public void setReserveGpuMemGb(double reserveGpuMemGb) { this.reserveGpuMemGb = reserveGpuMemGb; }

        public double getMinSystemMemoryGb() { return minSystemMemoryGb; }
        public void setMinSystemMemoryGb(double minSystemMemoryGb) { this.minSystemMemoryGb = minSystemMemoryGb; }

        public long getIdleUnloadSeconds() { return idleUnloadSeconds; }
        public void setIdleUnloadSeconds(long idleUnloadSeconds) { this.idleUnloadSeconds = idleUnloadSeconds; }

        public long getIdleCheckIntervalMs() { return idleCheckIntervalMs; }
        public void setIdleCheckIntervalMs(long idleCheckIntervalMs) { this.idleCheckIntervalMs = idleCheckIntervalMs; }

        public long getLoadTimeoutSeconds() { return loadTimeoutSeconds; }
        public void setLoadTimeoutSeconds(long loadTimeoutSeconds) { this.loadTimeoutSeconds = loadTimeoutSeconds; }

        public long getMinAcquireTimeoutSeconds() { return minAcquireTimeoutSeconds; }
        public void setMinAcquireTimeoutSeconds(long seconds) { this.minAcquireTimeoutSeconds = seconds; }

        public long getInitialBackoffMs() { return initialBackoffMs; }
        public void setInitialBackoffMs(long initialBackoffMs) { this.initialBackoffMs = initialBackoffMs; }

        public long getMaxBackoffMs() { return maxBackoffMs; }
        public void setMaxBackoffMs(long maxBackoffMs) { this.maxBackoffMs = maxBackoffMs; }

        public double getBackoffMultiplier() { return backoffMultiplier; }
        public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }

        public long getStopTimeoutMs() { return stopTimeoutMs; }
        public void setStopTimeoutMs(long stopTimeoutMs) { this.stopTimeoutMs = stopTimeoutMs; }
    }

    /**
     * Document pipeline limits.
     */
    public static class PipelineConfig {
        private int maxUploadMb = 200;
        private int maxPages = 500;
        private boolean enableAutoBatch = true;
        private int batchPageSize = 50;
        private int downloadChunkMb = 4;
        private long downloadTimeoutSeconds = 60;

        public int getMaxUploadMb() { return maxUploadMb; }
        public void setMaxUploadMb(int maxUploadMb) { this.maxUploadMb = maxUploadMb; }

        public int getMaxPages() { return maxPages; }
        public void setMaxPages(int maxPages) { this.maxPages = maxPages; }

        public boolean isEnableAutoBatch() { return enableAutoBatch; }
        public void setEnableAutoBatch(boolean enableAutoBatch) { this.enableAutoBatch = enableAutoBatch; }

        public int getBatchPageSize() { return batchPageSize; }
        public void setBatchPageSize(int batchPageSize) { this.batchPageSize = batchPageSize; }

        public int getDownloadChunkMb() { return downloadChunkMb; }
        public void setDownloadChunkMb(int downloadChunkMb) { this.downloadChunkMb = downloadChunkMb; }

        public long getDownloadTimeoutSeconds() { return downloadTimeoutSeconds; }
        public void setDownloadTimeoutSeconds(long seconds) { this.downloadTimeoutSeconds = seconds; }
    }

    /**
     * Result publishing configuration.
     */
    public static class PublishConfig {
        private String backend = "local";
        private boolean autoPublish = false;
        private String remotePrefix = "ocr-results";
        private long signExpireSeconds = 3600;
        private int asyncThreads = 1;

        public String getBackend() { return backend; }
        public void setBackend(String backend) { this.backend = backend; }

        public boolean isAutoPublish() { return autoPublish; }
        public void setAutoPublish(boolean autoPublish) { this.autoPublish = autoPublish; }

        public String getRemotePrefix() { return remotePrefix; }
        public void setRemotePrefix(String remotePrefix) { this.remotePrefix = remotePrefix; }

        public long getSignExpireSeconds() { return signExpireSeconds; }
        public void setSignExpireSeconds(long signExpireSeconds) { this.signExpireSeconds = signExpireSeconds; }

        public int getAsyncThreads() { return asyncThreads; }
        public void setAsyncThreads(int asyncThreads) { this.asyncThreads = asyncThreads; }
    }

    /**
     * Download token configuration.
     */
    public static class TokensConfig {
        private String storePath = "data/tokens/tokens.json";
        private int defaultMaxDownloads = 1;
        private long defaultTtlSeconds = 3600;

        public String getStorePath() { return storePath; }
        public void setStorePath(String storePath) { this.storePath = storePath; }

        public int getDefaultMaxDownloads() { return defaultMaxDownloads; }
        public void setDefaultMaxDownloads(int defaultMaxDownloads) { this.defaultMaxDownloads = defaultMaxDownloads; }

        public long getDefaultTtlSeconds() { return defaultTtlSeconds; }
        public void setDefaultTtlSeconds(long defaultTtlSeconds) { this.defaultTtlSeconds = defaultTtlSeconds; }
    }

    /**
     * Per-client request rate limiting.
     */
    public static class RateLimitConfig {
        private boolean enabled = true;
        private double ratePerSecond = 10.0;
        private int burst = 20;
        private long ttlSeconds = 300;
        private long sweepIntervalSeconds = 60;
        private List<String> exemptPaths = new ArrayList<>(List.of("/healthz", "/metrics"));

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public double getRatePerSecond() { return ratePerSecond; }
        public void setRatePerSecond(double ratePerSecond) { this.ratePerSecond = ratePerSecond; }

        public int getBurst() { return burst; }
        public void setBurst(int burst) { this.burst = burst; }

        public long getTtlSeconds() { return ttlSeconds; }
        public void setTtlSeconds(long ttlSeconds) { this.ttlSeconds = ttlSeconds; }

        public long getSweepIntervalSeconds() { return sweepIntervalSeconds; }
        public void setSweepIntervalSeconds(long sweepIntervalSeconds) { this.sweepIntervalSeconds = sweepIntervalSeconds; }

        public List<String> getExemptPaths() { return exemptPaths; }
        public void setExemptPaths(List<String> exemptPaths) { this.exemptPaths = exemptPaths; }
    }

    /**
     * Bearer API keys for the /v1 routes. An empty key list disables authentication.
     */
    public static class AuthConfig {
        private List<String> apiKeys = new ArrayList<>();
        private String requireKeyPrefix = "";

        public List<String> getApiKeys() { return apiKeys; }
        public void setApiKeys(List<String> apiKeys) { this.apiKeys = apiKeys; }

        public String getRequireKeyPrefix() { return requireKeyPrefix; }
        public void setRequireKeyPrefix(String requireKeyPrefix) { this.requireKeyPrefix = requireKeyPrefix; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "ocr_scheduler";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }

    /**
     * Option defaults applied to submissions that leave them unset.
     */
    public static class DefaultsConfig {
        private boolean bbox = true;
        private boolean packZip = true;

        public boolean isBbox() { return bbox; }
        public void setBbox(boolean bbox) { this.bbox = bbox; }

        public boolean isPackZip() { return packZip; }
        public void setPackZip(boolean packZip) { this.packZip = packZip; }
    }
}

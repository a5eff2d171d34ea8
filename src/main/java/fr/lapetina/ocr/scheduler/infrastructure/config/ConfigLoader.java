package fr.lapetina.ocr.scheduler.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads the scheduler configuration once at startup.
 *
 * Supports:
 * - Loading from the file system, falling back to the classpath
 * - Validation of nonsensical values before any component is built
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(SchedulerConfig.class, loaderOptions));
    }

    /**
     * Loads and validates configuration from file or classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public SchedulerConfig load() {
        SchedulerConfig config = loadFromPath();
        if (config == null) {
            // Empty document
            config = createDefault();
        }
        validate(config);
        return config;
    }

    private SchedulerConfig loadFromPath() {
        // Try file system first
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        // Try classpath
        String classpathResource = configPath.toString().replace('\\', '/');
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return yaml.load(is);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private SchedulerConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return yaml.load(is);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Loads and validates configuration from an input stream.
     */
    public SchedulerConfig loadFromStream(InputStream inputStream) {
        SchedulerConfig config = yaml.load(inputStream);
        if (config == null) {
            config = createDefault();
        }
        validate(config);
        return config;
    }

    /**
     * Rejects values no component can work with.
     *
     * @throws ConfigurationException listing every problem found
     */
    public static void validate(SchedulerConfig config) {
        List<String> problems = new ArrayList<>();

        SchedulerConfig.QueueConfig queue = config.getQueue();
        if (queue.getMaxWorkers() < 1) problems.add("queue.maxWorkers must be >= 1");
        if (queue.getMaxQueueSize() < 1) problems.add("queue.maxQueueSize must be >= 1");
        if (queue.getPollIntervalMs() <= 0) problems.add("queue.pollIntervalMs must be > 0");

        SchedulerConfig.ResourceConfig resource = config.getResource();
        if (isBlank(resource.getBackend())) problems.add("resource.backend is required");
        if (resource.getReserveGpuMemGb() < 0) problems.add("resource.reserveGpuMemGb must be >= 0");
        if (resource.getMemPerJobGb() <= 0) problems.add("resource.memPerJobGb must be > 0");
        if (resource.getMinSystemMemoryGb() < 0) problems.add("resource.minSystemMemoryGb must be >= 0");
        if (resource.getIdleUnloadSeconds() < 0) problems.add("resource.idleUnloadSeconds must be >= 0");
        if (resource.getIdleCheckIntervalMs() <= 0) problems.add("resource.idleCheckIntervalMs must be > 0");
        if (resource.getInitialBackoffMs() <= 0) problems.add("resource.initialBackoffMs must be > 0");
        if (resource.getMaxBackoffMs() < resource.getInitialBackoffMs()) {
            problems.add("resource.maxBackoffMs must be >= initialBackoffMs");
        }
        if (resource.getBackoffMultiplier() < 1.0) problems.add("resource.backoffMultiplier must be >= 1.0");

        SchedulerConfig.PipelineConfig pipeline = config.getPipeline();
        if (pipeline.getMaxUploadMb() < 1) problems.add("pipeline.maxUploadMb must be >= 1");
        if (pipeline.getMaxPages() < 1) problems.add("pipeline.maxPages must be >= 1");
        if (pipeline.getBatchPageSize() < 1) problems.add("pipeline.batchPageSize must be >= 1");

        String publishBackend = config.getPublish().getBackend();
        if (!"local".equals(publishBackend) && !"remote".equals(publishBackend)) {
            problems.add("publish.backend must be 'local' or 'remote'");
        }

        SchedulerConfig.RateLimitConfig rateLimit = config.getRateLimit();
        if (rateLimit.getRatePerSecond() <= 0) problems.add("rateLimit.ratePerSecond must be > 0");
        if (rateLimit.getBurst() < 1) problems.add("rateLimit.burst must be >= 1");

        if (config.getStorage().getMaxJobRetention() < 1) {
            problems.add("storage.maxJobRetention must be >= 1");
        }

        if (!problems.isEmpty()) {
            throw new ConfigurationException("Invalid configuration: " + String.join("; ", problems));
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Creates a default configuration.
     */
    public static SchedulerConfig createDefault() {
        return new SchedulerConfig();
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}

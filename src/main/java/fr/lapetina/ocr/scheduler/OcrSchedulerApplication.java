package fr.lapetina.ocr.scheduler;

import fr.lapetina.ocr.scheduler.api.HttpServer;
import fr.lapetina.ocr.scheduler.infrastructure.config.SchedulerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process entry point: starts the scheduler core, then the HTTP front door.
 *
 * The config path comes from the first argument, else the {@code ocr.config} system
 * property, else {@code config.yaml} (file system first, then classpath).
 */
public class OcrSchedulerApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OcrSchedulerApplication.class);

    static final String CONFIG_PROPERTY = "ocr.config";
    static final String DEFAULT_CONFIG = "config.yaml";

    private final SchedulerFactory factory;
    private final HttpServer httpServer;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final CountDownLatch terminated = new CountDownLatch(1);

    public OcrSchedulerApplication(String configPath) throws IOException {
        this(SchedulerFactory.create(configPath));
    }

    OcrSchedulerApplication(SchedulerFactory factory) throws IOException {
        this.factory = factory.start();
        try {
            this.httpServer = new HttpServer(
                    factory.getConfig(),
                    factory.getSubmissionService(),
                    factory.getTokenService(),
                    factory.getPublishService(),
                    factory.getAuthenticator(),
                    factory.getHealthReporter(),
                    factory.getMetricsRegistry(),
                    factory.getRateLimiter()
            );
        } catch (IOException | RuntimeException e) {
            // Workers and the idle watcher are already running
            factory.close();
            throw e;
        }
    }

    /**
     * Opens the HTTP port and logs the effective setup with the first health snapshot.
     */
    public void start() {
        httpServer.start();
        SchedulerConfig config = factory.getConfig();
        log.info("OCR scheduler ready: port={}, storageRoot={}, backend={}, fallbackBackend={}, publish={}, "
                        + "workers={}, queueCapacity={}, apiKeys={}",
                httpServer.getPort(),
                factory.getStorage().getRoot().toAbsolutePath(),
                config.getResource().getBackend(),
                config.getResource().getFallbackBackend(),
                factory.getPublisher().backend(),
                config.getQueue().getMaxWorkers(),
                factory.getJobQueue().queueCapacity(),
                factory.getAuthenticator().isEnabled() ? "required" : "disabled");
        Map<String, Object> health = health();
        log.info("Startup health: status={}, engine={}", health.get("status"), health.get("engine"));
    }

    public Map<String, Object> health() {
        return factory.getHealthReporter().snapshot();
    }

    public SchedulerFactory getFactory() {
        return factory;
    }

    public int getPort() {
        return httpServer.getPort();
    }

    /**
     * Blocks until {@link #close()} has finished.
     */
    public void awaitTermination() throws InterruptedException {
        terminated.await();
    }

    /**
     * Stops accepting requests first, then drains the scheduler. Safe to call twice.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down OCR scheduler: queued={}, activeWorkers={}",
                factory.getJobQueue().queueSize(), factory.getJobQueue().activeWorkers());
        try {
            httpServer.close();
        } catch (RuntimeException e) {
            log.warn("Error closing HTTP server", e);
        }
        try {
            factory.close();
        } catch (RuntimeException e) {
            log.warn("Error closing scheduler", e);
        } finally {
            terminated.countDown();
        }
        log.info("OCR scheduler stopped");
    }

    static String resolveConfigPath(String[] args) {
        if (args.length > 0 && !args[0].isBlank()) {
            return args[0];
        }
        return System.getProperty(CONFIG_PROPERTY, DEFAULT_CONFIG);
    }

    public static void main(String[] args) {
        String configPath = resolveConfigPath(args);
        try {
            OcrSchedulerApplication app = new OcrSchedulerApplication(configPath);
            Runtime.getRuntime().addShutdownHook(new Thread(app::close, "shutdown"));
            app.start();
            app.awaitTermination();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.error("Failed to start OCR scheduler: config={}", configPath, e);
            System.exit(1);
        }
    }
}

package fr.lapetina.ocr.scheduler.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.ocr.scheduler.api.dto.SubmitTaskRequest;
import fr.lapetina.ocr.scheduler.api.dto.TaskResponse;
import fr.lapetina.ocr.scheduler.api.dto.TokenRequest;
import fr.lapetina.ocr.scheduler.api.dto.TokenResponse;
import fr.lapetina.ocr.scheduler.domain.exception.BackpressureException;
import fr.lapetina.ocr.scheduler.domain.exception.SchedulerException;
import fr.lapetina.ocr.scheduler.domain.model.ErrorType;
import fr.lapetina.ocr.scheduler.domain.model.Job;
import fr.lapetina.ocr.scheduler.domain.model.JobOptions;
import fr.lapetina.ocr.scheduler.domain.model.TokenKind;
import fr.lapetina.ocr.scheduler.infrastructure.config.SchedulerConfig;
import fr.lapetina.ocr.scheduler.infrastructure.health.HealthReporter;
import fr.lapetina.ocr.scheduler.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.ocr.scheduler.publish.PublishInfo;
import fr.lapetina.ocr.scheduler.publish.PublishService;
import fr.lapetina.ocr.scheduler.queue.JobSubmissionService;
import fr.lapetina.ocr.scheduler.security.ApiKeyAuthenticator;
import fr.lapetina.ocr.scheduler.security.DownloadToken;
import fr.lapetina.ocr.scheduler.security.DownloadTokenService;
import fr.lapetina.ocr.scheduler.security.RateLimiter;
import fr.lapetina.ocr.scheduler.security.TokenGrant;
import fr.lapetina.ocr.scheduler.storage.JobStatusSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLConnection;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lightweight HTTP server using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - GET /healthz - Health snapshot
 * - GET /metrics - Prometheus metrics endpoint
 * - POST /v1/tasks - Submit a task: JSON {url, options...}, or a raw document body
 * - GET /v1/tasks/{id} - Task status
 * - DELETE /v1/tasks/{id} - Remove a finished task and its artifacts
 * - POST /v1/tasks/{id}/publish - Publish results to the configured backend
 * - POST /v1/tasks/{id}/tokens - Issue a download token for a result artifact
 * - GET /v1/tasks/{id}/result.md, result.json, download.zip - Direct artifact download
 * - GET /v1/tasks/{id}/result-images/{path} - Extracted image
 * - GET /v1/download/{token} - Consume a token: file bytes or redirect to a signed link
 *
 * Every path outside the exempt list is admitted through the rate limiter, keyed
 * by client address. /v1 routes then require a bearer API key when keys are
 * configured. Error bodies are {error, kind}.
 */
public final class HttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private static final String TASKS_PATH = "/v1/tasks";
    private static final String DOWNLOAD_PATH = "/v1/download/";
    private static final String API_PREFIX = "/v1/";

    private static final Map<String, TokenKind> RESULT_FILES = Map.of(
            "result.md", TokenKind.MARKDOWN,
            "result.json", TokenKind.JSON,
            "download.zip", TokenKind.ARCHIVE);

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final JobSubmissionService submissionService;
    private final DownloadTokenService tokenService;
    private final PublishService publishService;
    private final ApiKeyAuthenticator authenticator;
    private final HealthReporter healthReporter;
    private final MetricsRegistry metricsRegistry;
    private final RateLimiter rateLimiter;
    private final List<String> exemptPaths;
    private final SchedulerConfig.DefaultsConfig defaults;

    public HttpServer(
            SchedulerConfig config,
            JobSubmissionService submissionService,
            DownloadTokenService tokenService,
            PublishService publishService,
            ApiKeyAuthenticator authenticator,
            HealthReporter healthReporter,
            MetricsRegistry metricsRegistry,
            RateLimiter rateLimiter
    ) throws IOException {
        this.submissionService = submissionService;
        this.tokenService = tokenService;
        this.publishService = publishService;
        this.authenticator = authenticator;
        this.healthReporter = healthReporter;
        this.metricsRegistry = metricsRegistry;
        this.rateLimiter = rateLimiter;
        this.exemptPaths = List.copyOf(config.getRateLimit().getExemptPaths());
        this.defaults = config.getDefaults();

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule());

        SchedulerConfig.ServerConfig serverConfig = config.getServer();
        this.server = com.sun.net.httpserver.HttpServer.create(
                new InetSocketAddress(serverConfig.getHost(), serverConfig.getPort()),
                serverConfig.getBacklog()
        );

        AtomicInteger threadCounter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(1, serverConfig.getHttpThreads()), r -> {
            Thread t = new Thread(r, "http-handler-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        // Register handlers
        server.createContext("/healthz", new HealthHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext(TASKS_PATH, new TasksHandler());
        server.createContext(DOWNLOAD_PATH, new DownloadHandler());

        log.info("HTTP server configured: host={}, port={}, threads={}",
                serverConfig.getHost(), serverConfig.getPort(), serverConfig.getHttpThreads());
    }

    public void start() {
        server.start();
        log.info("HTTP server started: port={}", getPort());
    }

    /**
     * Port actually bound, useful when configured with port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(1);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("HTTP server stopped");
    }

    /**
     * Common request handling: request id, rate limiting and error mapping.
     */
    private abstract class ApiHandler implements HttpHandler {

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            MDC.put("requestId", UUID.randomUUID().toString());
            try {
                String path = exchange.getRequestURI().getPath();
                if (!isExempt(path) && !admit(exchange)) {
                    log.warn("Rate limited: client={}, path={}", clientKey(exchange), path);
                    if (metricsRegistry != null) {
                        metricsRegistry.incrementRejected(ErrorType.RATE_LIMITED);
                    }
                    sendError(exchange, 429, new BackpressureException(
                            BackpressureException.BackpressureReason.RATE_LIMITED));
                    return;
                }
                if (path.startsWith(API_PREFIX)) {
                    authenticator.authenticate(exchange.getRequestHeaders().getFirst("Authorization"));
                }
                doHandle(exchange, path);
            } catch (SchedulerException e) {
                int status = statusOf(e.getErrorType());
                if (e instanceof BackpressureException) {
                    log.warn("Backpressure: {}", e.getMessage());
                } else if (status >= 500) {
                    log.error("Request failed: kind={}", e.getErrorType(), e);
                } else {
                    log.info("Request refused: status={}, kind={}, message={}", status, e.getErrorType(), e.getMessage());
                }
                sendError(exchange, status, e);
            } catch (JsonProcessingException e) {
                sendError(exchange, 400, "Malformed JSON body", ErrorType.VALIDATION_ERROR);
            } catch (Exception e) {
                log.error("Error handling request", e);
                sendError(exchange, 500, "Internal server error: " + e.getMessage(), ErrorType.INTERNAL_ERROR);
            } finally {
                exchange.close();
                MDC.clear();
            }
        }

        abstract void doHandle(HttpExchange exchange, String path) throws IOException;
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler extends ApiHandler {
        @Override
        void doHandle(HttpExchange exchange, String path) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed", ErrorType.VALIDATION_ERROR);
                return;
            }
            Map<String, Object> health = healthReporter.snapshot();
            int statusCode = HealthReporter.DOWN.equals(health.get("status")) ? 503 : 200;
            sendJson(exchange, statusCode, health);
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler extends ApiHandler {
        @Override
        void doHandle(HttpExchange exchange, String path) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed", ErrorType.VALIDATION_ERROR);
                return;
            }
            if (metricsRegistry == null) {
                sendError(exchange, 404, "Metrics disabled", ErrorType.NOT_FOUND);
                return;
            }
            String metrics = metricsRegistry.scrape();
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== TASKS HANDLER ====================

    private class TasksHandler extends ApiHandler {
        @Override
        void doHandle(HttpExchange exchange, String path) throws IOException {
            String method = exchange.getRequestMethod();
            String[] parts = trimSlashes(path).split("/");

            if (parts.length == 2 && "POST".equalsIgnoreCase(method)) {
                handleSubmit(exchange);
            } else if (parts.length == 3 && "GET".equalsIgnoreCase(method)) {
                handleStatus(exchange, parts[2]);
            } else if (parts.length == 3 && "DELETE".equalsIgnoreCase(method)) {
                handleDelete(exchange, parts[2]);
            } else if (parts.length == 4 && "tokens".equals(parts[3]) && "POST".equalsIgnoreCase(method)) {
                handleIssueToken(exchange, parts[2]);
            } else if (parts.length == 4 && "publish".equals(parts[3]) && "POST".equalsIgnoreCase(method)) {
                handlePublish(exchange, parts[2]);
            } else if (parts.length == 4 && RESULT_FILES.containsKey(parts[3]) && "GET".equalsIgnoreCase(method)) {
                handleResultFile(exchange, parts[2], RESULT_FILES.get(parts[3]));
            } else if (parts.length >= 5 && "result-images".equals(parts[3]) && "GET".equalsIgnoreCase(method)) {
                handleImage(exchange, parts[2], String.join("/", Arrays.asList(parts).subList(4, parts.length)));
            } else {
                sendError(exchange, 404, "Not Found", ErrorType.NOT_FOUND);
            }
        }

        private void handleSubmit(HttpExchange exchange) throws IOException {
            String contentType = exchange.getRequestHeaders().getFirst("Content-Type");
            Job job;
            if (contentType != null && contentType.toLowerCase(Locale.ROOT).startsWith("application/json")) {
                SubmitTaskRequest request;
                try (InputStream is = exchange.getRequestBody()) {
                    request = objectMapper.readValue(is, SubmitTaskRequest.class);
                }
                job = submissionService.submitRemote(request.getUrl(), request.toJobOptions(defaults));
            } else {
                // Raw document body; options take their defaults
                String filename = queryParam(exchange, "filename").orElse(null);
                JobOptions options = new SubmitTaskRequest().toJobOptions(defaults);
                try (InputStream is = exchange.getRequestBody()) {
                    job = submissionService.submitUpload(is, filename, options);
                }
            }
            sendJson(exchange, 202, TaskResponse.of(job));
        }

        private void handleStatus(HttpExchange exchange, String taskId) throws IOException {
            Optional<JobStatusSnapshot> status = submissionService.status(taskId);
            if (status.isEmpty()) {
                sendError(exchange, 404, "Task not found: " + taskId, ErrorType.NOT_FOUND);
                return;
            }
            sendJson(exchange, 200, status.get());
        }

        private void handleDelete(HttpExchange exchange, String taskId) throws IOException {
            if (!submissionService.delete(taskId)) {
                sendError(exchange, 404, "Task not found: " + taskId, ErrorType.NOT_FOUND);
                return;
            }
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("task_id", taskId);
            body.put("deleted", true);
            sendJson(exchange, 200, body);
        }

        private void handlePublish(HttpExchange exchange, String taskId) throws IOException {
            Optional<PublishInfo> info = publishService.publish(taskId);
            if (info.isEmpty()) {
                sendError(exchange, 404, "Task not found: " + taskId, ErrorType.NOT_FOUND);
                return;
            }
            sendJson(exchange, 200, info.get().toMap());
        }

        private void handleResultFile(HttpExchange exchange, String taskId, TokenKind kind) throws IOException {
            Optional<Path> artifact = tokenService.artifact(taskId, kind);
            if (artifact.isEmpty()) {
                sendError(exchange, 404, "Result not generated yet: " + taskId, ErrorType.NOT_FOUND);
                return;
            }
            String fileName = kind == TokenKind.ARCHIVE ? taskId + ".zip" : artifact.get().getFileName().toString();
            sendFile(exchange, artifact.get(), kind.contentType(), fileName);
        }

        private void handleImage(HttpExchange exchange, String taskId, String relativePath) throws IOException {
            Optional<Path> image = tokenService.image(taskId, relativePath);
            if (image.isEmpty()) {
                sendError(exchange, 404, "Image not found: " + relativePath, ErrorType.NOT_FOUND);
                return;
            }
            String contentType = URLConnection.guessContentTypeFromName(image.get().getFileName().toString());
            sendFile(exchange, image.get(), contentType != null ? contentType : "application/octet-stream", null);
        }

        private void handleIssueToken(HttpExchange exchange, String taskId) throws IOException {
            TokenRequest request;
            try (InputStream is = exchange.getRequestBody()) {
                byte[] body = is.readAllBytes();
                request = body.length == 0 ? new TokenRequest() : objectMapper.readValue(body, TokenRequest.class);
            }
            TokenKind kind;
            try {
                kind = request.getKind() == null ? TokenKind.ARCHIVE : TokenKind.fromWireName(request.getKind());
            } catch (IllegalArgumentException e) {
                sendError(exchange, 400, e.getMessage(), ErrorType.VALIDATION_ERROR);
                return;
            }

            Optional<DownloadToken> token = tokenService.issue(
                    taskId, kind, request.getMaxDownloads(), request.getTtlSeconds());
            if (token.isEmpty()) {
                sendError(exchange, 404, "Task not found: " + taskId, ErrorType.NOT_FOUND);
                return;
            }
            sendJson(exchange, 201, TokenResponse.of(token.get()));
        }
    }

    // ==================== DOWNLOAD HANDLER ====================

    private class DownloadHandler extends ApiHandler {
        @Override
        void doHandle(HttpExchange exchange, String path) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed", ErrorType.VALIDATION_ERROR);
                return;
            }
            String token = path.substring(DOWNLOAD_PATH.length());
            Optional<TokenGrant> grant = tokenService.consume(token);
            if (grant.isEmpty()) {
                sendError(exchange, 404, "Token invalid or expired", ErrorType.TOKEN_INVALID);
                return;
            }

            TokenGrant granted = grant.get();
            exchange.getResponseHeaders().set("X-Downloads-Remaining", String.valueOf(granted.remaining()));
            if (granted.isRedirect()) {
                exchange.getResponseHeaders().set("Location", granted.signedUrl());
                exchange.sendResponseHeaders(302, -1);
                return;
            }

            if (!Files.isRegularFile(granted.localPath())) {
                sendError(exchange, 404, "Artifact no longer available", ErrorType.NOT_FOUND);
                return;
            }
            sendFile(exchange, granted.localPath(), granted.token().kind().contentType(),
                    granted.localPath().getFileName().toString());
        }
    }

    // ==================== HELPER METHODS ====================

    private boolean isExempt(String path) {
        return rateLimiter == null || exemptPaths.contains(path);
    }

    private boolean admit(HttpExchange exchange) {
        return rateLimiter.allow(clientKey(exchange));
    }

    private static String clientKey(HttpExchange exchange) {
        InetSocketAddress remote = exchange.getRemoteAddress();
        if (remote == null || remote.getAddress() == null) {
            return "unknown";
        }
        return remote.getAddress().getHostAddress();
    }

    static int statusOf(ErrorType errorType) {
        return switch (errorType) {
            case VALIDATION_ERROR, PAGE_LIMIT, PATH_VIOLATION -> 400;
            case UNAUTHORIZED -> 401;
            case FORBIDDEN -> 403;
            case TOKEN_INVALID, NOT_FOUND -> 404;
            case CONFLICT -> 409;
            case SIZE_LIMIT -> 413;
            case RATE_LIMITED -> 429;
            case QUEUE_FULL -> 503;
            case TIMEOUT -> 504;
            default -> 500;
        };
    }

    private static String trimSlashes(String path) {
        int start = 0;
        int end = path.length();
        while (start < end && path.charAt(start) == '/') start++;
        while (end > start && path.charAt(end - 1) == '/') end--;
        return path.substring(start, end);
    }

    private static Optional<String> queryParam(HttpExchange exchange, String name) {
        String query = exchange.getRequestURI().getRawQuery();
        if (query == null) {
            return Optional.empty();
        }
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            if (eq > 0 && name.equals(pair.substring(0, eq))) {
                return Optional.of(URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8));
            }
        }
        return Optional.empty();
    }

    private static void sendFile(HttpExchange exchange, Path file, String contentType, String fileName)
            throws IOException {
        exchange.getResponseHeaders().set("Content-Type", contentType);
        if (fileName != null) {
            exchange.getResponseHeaders().set("Content-Disposition", "attachment; filename=\"" + fileName + "\"");
        }
        exchange.sendResponseHeaders(200, Files.size(file));
        try (OutputStream os = exchange.getResponseBody()) {
            Files.copy(file, os);
        }
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, SchedulerException error) throws IOException {
        sendError(exchange, statusCode, error.getMessage(), error.getErrorType());
    }

    private void sendError(HttpExchange exchange, int statusCode, String message, ErrorType kind) throws IOException {
        Map<String, String> error = new LinkedHashMap<>();
        error.put("error", message);
        error.put("kind", kind.name());
        sendJson(exchange, statusCode, error);
    }
}

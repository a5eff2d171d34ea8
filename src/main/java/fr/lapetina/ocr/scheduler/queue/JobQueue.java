package fr.lapetina.ocr.scheduler.queue;

import fr.lapetina.ocr.scheduler.domain.exception.ErrorDescription;
import fr.lapetina.ocr.scheduler.domain.model.ErrorType;
import fr.lapetina.ocr.scheduler.domain.model.Job;
import fr.lapetina.ocr.scheduler.domain.model.JobOptions;
import fr.lapetina.ocr.scheduler.domain.model.JobSource;
import fr.lapetina.ocr.scheduler.domain.model.JobStatus;
import fr.lapetina.ocr.scheduler.infrastructure.config.SchedulerConfig;
import fr.lapetina.ocr.scheduler.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.ocr.scheduler.publish.PublishInfo;
import fr.lapetina.ocr.scheduler.publish.Publisher;
import fr.lapetina.ocr.scheduler.storage.JobPaths;
import fr.lapetina.ocr.scheduler.storage.JobStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded FIFO of jobs drained by a fixed pool of worker threads.
 *
 * SUBMISSION: a job is tracked and its QUEUED status is written before it is
 * offered to the queue, so no worker can pick it up before the status file exists.
 * A full queue rejects immediately; the caller owns the cleanup of the rejected job.
 *
 * WORKERS: each worker polls with a short timeout so it notices shutdown even when
 * idle. A job goes QUEUED -> PROCESSING -> SUCCEEDED | FAILED, and every state is
 * persisted before listeners are told and before {@link Job#completion()} completes.
 * Failures while persisting are handled at the worker loop boundary; the worker
 * itself never dies from a job. A finished job is untracked once its terminal
 * status is durable; later queries read the status file.
 *
 * PUBLISHING: with auto-publish enabled, results of a succeeded job are published
 * on a separate executor once the SUCCEEDED status is durable. A publishing failure
 * is logged and never changes the job status.
 */
public final class JobQueue implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JobQueue.class);

    // Wakes a worker blocked in poll during shutdown
    private static final Job STOP = new Job(
            "stop",
            JobSource.local("stop"),
            JobPaths.of(Path.of("stop"), "input.pdf"),
            JobOptions.defaults());

    private final BlockingQueue<Job> queue;
    private final Map<String, Job> jobs = new ConcurrentHashMap<>();
    private final List<Thread> workers = new ArrayList<>();
    private final List<JobStatusListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final AtomicInteger activeWorkers = new AtomicInteger();

    private final int capacity;
    private final int workerCount;
    private final Duration pollInterval;
    private final Duration stopJoinTimeout;
    private final JobProcessor processor;
    private final JobStorage storage;
    private final MetricsRegistry metricsRegistry;
    private final Publisher publisher;
    private final boolean autoPublish;
    private final ExecutorService publishExecutor;

    private JobQueue(Builder builder) {
        this.capacity = builder.capacity;
        this.workerCount = builder.workers;
        this.pollInterval = builder.pollInterval;
        this.stopJoinTimeout = builder.stopJoinTimeout;
        this.processor = builder.processor;
        this.storage = builder.storage;
        this.metricsRegistry = builder.metricsRegistry;
        this.publisher = builder.publisher;
        this.autoPublish = builder.autoPublish && builder.publisher != null;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.publishExecutor = autoPublish
                ? Executors.newFixedThreadPool(builder.publishThreads, new NamedThreadFactory("job-publisher"))
                : null;

        log.info("JobQueue created: capacity={}, workers={}, autoPublish={}",
                capacity, workerCount, autoPublish);
    }

    /**
     * Starts the worker threads. Jobs submitted before this wait in the queue.
     */
    public void start() {
        if (stopped.get()) {
            throw new IllegalStateException("JobQueue has been stopped");
        }
        if (running.compareAndSet(false, true)) {
            ThreadFactory factory = new NamedThreadFactory("job-worker");
            synchronized (workers) {
                for (int i = 0; i < workerCount; i++) {
                    Thread worker = factory.newThread(this::workerLoop);
                    workers.add(worker);
                    worker.start();
                }
            }
            log.info("JobQueue started: workers={}", workerCount);
        }
    }

    /**
     * Tracks, persists and enqueues a job without blocking.
     *
     * @return false if the queue is full; the job is then no longer tracked
     * @throws IllegalStateException if the queue has been stopped
     * @throws fr.lapetina.ocr.scheduler.domain.exception.StorageException if the
     *         initial status cannot be written; the job is then no longer tracked
     */
    public boolean submit(Job job) {
        if (stopped.get()) {
            throw new IllegalStateException("JobQueue has been stopped");
        }
        String taskId = job.getTaskId();
        jobs.put(taskId, job);
        try {
            persist(job);
        } catch (RuntimeException e) {
            jobs.remove(taskId);
            throw e;
        }

        if (!queue.offer(job)) {
            jobs.remove(taskId);
            log.warn("Job rejected, queue full: taskId={}, capacity={}", taskId, capacity);
            return false;
        }

        if (metricsRegistry != null) {
            metricsRegistry.incrementSubmitted();
        }
        log.info("Job queued: taskId={}, remote={}, queueSize={}",
                taskId, job.getSource().remote(), queue.size());
        notifyStatusChanged(job);
        return true;
    }

    public Optional<Job> get(String taskId) {
        return Optional.ofNullable(jobs.get(taskId));
    }

    public void addListener(JobStatusListener listener) {
        listeners.add(listener);
    }

    public void removeListener(JobStatusListener listener) {
        listeners.remove(listener);
    }

    public int queueSize() {
        return queue.size();
    }

    public int queueCapacity() {
        return capacity;
    }

    public boolean isQueueFull() {
        return queue.remainingCapacity() == 0;
    }

    public int trackedJobs() {
        return jobs.size();
    }

    /**
     * Number of worker threads currently alive.
     */
    public int runningWorkers() {
        synchronized (workers) {
            return (int) workers.stream().filter(Thread::isAlive).count();
        }
    }

    /**
     * Number of workers currently processing a job.
     */
    public int activeWorkers() {
        return activeWorkers.get();
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Signals the workers to stop and waits a bounded time for each.
     * A worker busy with a long job is left to finish in the background.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        running.set(false);
        log.info("Stopping JobQueue: pending={}", queue.size());

        List<Thread> snapshot;
        synchronized (workers) {
            snapshot = new ArrayList<>(workers);
        }
        for (int i = 0; i < snapshot.size(); i++) {
            // Full queue is fine: workers also check the running flag after each poll
            queue.offer(STOP);
        }
        for (Thread worker : snapshot) {
            try {
                worker.join(stopJoinTimeout.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (worker.isAlive()) {
                log.warn("Worker still busy after stop timeout: thread={}", worker.getName());
            }
        }

        if (publishExecutor != null) {
            publishExecutor.shutdown();
            try {
                if (!publishExecutor.awaitTermination(stopJoinTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    publishExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                publishExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("JobQueue stopped: runningWorkers={}", runningWorkers());
    }

    @Override
    public void close() {
        stop();
    }

    // ==================== WORKER ====================

    private void workerLoop() {
        log.debug("Worker started");
        while (running.get()) {
            Job job;
            try {
                job = queue.poll(pollInterval.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (job == null || job == STOP) {
                continue;
            }

            activeWorkers.incrementAndGet();
            MDC.put("taskId", job.getTaskId());
            try {
                process(job);
            } catch (RuntimeException e) {
                log.error("Job bookkeeping failed: taskId={}", job.getTaskId(), e);
                abandon(job, e);
            } finally {
                activeWorkers.decrementAndGet();
                MDC.remove("taskId");
            }
        }
        log.debug("Worker exiting");
    }

    private void process(Job job) {
        job.markProcessing();
        persist(job);
        notifyStatusChanged(job);
        log.info("Job processing: taskId={}", job.getTaskId());

        try {
            processor.process(job);
            job.markSucceeded();
        } catch (Exception e) {
            ErrorDescription error = ErrorDescription.of(e);
            job.markFailed(error.kind(), error.message());
            if (error.kind() == ErrorType.INTERNAL_ERROR) {
                log.error("Job failed: taskId={}, kind={}", job.getTaskId(), error.kind(), e);
            } else {
                log.warn("Job failed: taskId={}, kind={}, message={}",
                        job.getTaskId(), error.kind(), error.message());
            }
        }

        persist(job);
        recordOutcome(job);
        jobs.remove(job.getTaskId());
        job.signalCompletion();
        notifyStatusChanged(job);

        if (job.getStatus() == JobStatus.SUCCEEDED) {
            Duration elapsed = Duration.between(job.getStartedAt(), job.getFinishedAt());
            log.info("Job succeeded: taskId={}, durationMs={}", job.getTaskId(), elapsed.toMillis());
            if (autoPublish) {
                publishExecutor.execute(() -> publish(job));
            }
        }
    }

    /**
     * Settles a job whose status could not be persisted so that waiters are released.
     */
    private void abandon(Job job, RuntimeException cause) {
        try {
            if (!job.getStatus().isTerminal()) {
                ErrorDescription error = ErrorDescription.of(cause);
                job.markFailed(error.kind(), error.message());
                recordOutcome(job);
            }
            // Stays tracked: the status file may still show an earlier state
            job.signalCompletion();
        } catch (RuntimeException e) {
            log.error("Cannot settle job: taskId={}", job.getTaskId(), e);
        }
    }

    private void recordOutcome(Job job) {
        if (metricsRegistry == null) {
            return;
        }
        if (job.getStatus() == JobStatus.SUCCEEDED) {
            metricsRegistry.incrementSucceeded();
        } else {
            metricsRegistry.incrementFailed(job.getErrorType());
        }
    }

    private void publish(Job job) {
        MDC.put("taskId", job.getTaskId());
        try {
            PublishInfo info = publisher.publish(job.getTaskId(), job.getPaths());
            job.setPublished(info.toMap());
            if (!Files.isDirectory(job.getPaths().root())) {
                // Deleted while publishing; writing the status would recreate the directory
                log.info("Job deleted before publish completed: taskId={}", job.getTaskId());
                return;
            }
            persist(job);
            log.info("Job published: taskId={}, backend={}", job.getTaskId(), info.backend());
            for (JobStatusListener listener : listeners) {
                try {
                    listener.onPublished(job, info);
                } catch (RuntimeException e) {
                    log.warn("Listener failed on publish: taskId={}", job.getTaskId(), e);
                }
            }
        } catch (Exception e) {
            log.warn("Publishing failed, job stays succeeded: taskId={}, backend={}",
                    job.getTaskId(), publisher.backend(), e);
            if (metricsRegistry != null) {
                metricsRegistry.incrementPublishFailed();
            }
            for (JobStatusListener listener : listeners) {
                try {
                    listener.onPublishFailed(job, e);
                } catch (RuntimeException listenerError) {
                    log.warn("Listener failed on publish error: taskId={}", job.getTaskId(), listenerError);
                }
            }
        } finally {
            MDC.remove("taskId");
        }
    }

    private void persist(Job job) {
        storage.saveStatus(job.getPaths(), job.toSnapshot());
    }

    private void notifyStatusChanged(Job job) {
        for (JobStatusListener listener : listeners) {
            try {
                listener.onStatusChanged(job);
            } catch (RuntimeException e) {
                log.warn("Listener failed: taskId={}, status={}", job.getTaskId(), job.getStatus(), e);
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Daemon thread factory with numbered names.
     */
    private static class NamedThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        NamedThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }

    /**
     * Builder for JobQueue.
     */
    public static final class Builder {
        private int capacity = 100;
        private int workers = 1;
        private Duration pollInterval = Duration.ofMillis(500);
        private Duration stopJoinTimeout = Duration.ofSeconds(1);
        private boolean autoPublish = false;
        private int publishThreads = 1;
        private JobProcessor processor;
        private JobStorage storage;
        private MetricsRegistry metricsRegistry;
        private Publisher publisher;

        public Builder capacity(int capacity) {
            if (capacity < 1) {
                throw new IllegalArgumentException("Queue capacity must be at least 1");
            }
            this.capacity = capacity;
            return this;
        }

        public Builder workers(int workers) {
            if (workers < 1) {
                throw new IllegalArgumentException("Worker count must be at least 1");
            }
            this.workers = workers;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder stopJoinTimeout(Duration stopJoinTimeout) {
            this.stopJoinTimeout = stopJoinTimeout;
            return this;
        }

        public Builder autoPublish(boolean autoPublish) {
            this.autoPublish = autoPublish;
            return this;
        }

        public Builder publishThreads(int publishThreads) {
            this.publishThreads = Math.max(1, publishThreads);
            return this;
        }

        public Builder processor(JobProcessor processor) {
            this.processor = processor;
            return this;
        }

        public Builder storage(JobStorage storage) {
            this.storage = storage;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public Builder publisher(Publisher publisher) {
            this.publisher = publisher;
            return this;
        }

        public Builder fromConfig(SchedulerConfig config) {
            capacity(config.getQueue().getMaxQueueSize());
            workers(config.getQueue().getMaxWorkers());
            this.pollInterval = Duration.ofMillis(config.getQueue().getPollIntervalMs());
            this.stopJoinTimeout = Duration.ofMillis(config.getQueue().getStopJoinTimeoutMs());
            this.autoPublish = config.getPublish().isAutoPublish();
            publishThreads(config.getPublish().getAsyncThreads());
            return this;
        }

        public JobQueue build() {
            if (processor == null) {
                throw new IllegalStateException("JobProcessor is required");
            }
            if (storage == null) {
                throw new IllegalStateException("JobStorage is required");
            }
            if (autoPublish && publisher == null) {
                throw new IllegalStateException("Publisher is required when auto-publish is enabled");
            }
            return new JobQueue(this);
        }
    }
}

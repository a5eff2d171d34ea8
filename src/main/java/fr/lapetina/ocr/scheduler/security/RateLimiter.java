package fr.lapetina.ocr.scheduler.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;

/**
 * Per-key token bucket.
 *
 * Each key refills at {@code ratePerSecond} up to {@code burst} tokens; a call is admitted
 * when a whole token (or {@code cost} tokens) is available. Buckets untouched for longer
 * than the TTL are swept by a background thread.
 */
public final class RateLimiter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private static final double MIN_RATE = 0.1;
    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private final double ratePerSecond;
    private final int burst;
    private final long ttlNanos;
    private final Duration sweepInterval;
    private final LongSupplier nanoClock;
    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();
    private final ScheduledExecutorService sweeper;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public RateLimiter(double ratePerSecond, int burst, Duration ttl, Duration sweepInterval, LongSupplier nanoClock) {
        this.ratePerSecond = Math.max(MIN_RATE, ratePerSecond);
        this.burst = Math.max(1, burst);
        this.ttlNanos = ttl.toNanos();
        this.sweepInterval = sweepInterval;
        this.nanoClock = nanoClock;
        this.sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "rate-limit-sweeper");
            t.setDaemon(true);
            return t;
        });
        log.info("RateLimiter initialized: ratePerSecond={}, burst={}, ttl={}",
                this.ratePerSecond, this.burst, ttl);
    }

    public RateLimiter(double ratePerSecond, int burst, Duration ttl, Duration sweepInterval) {
        this(ratePerSecond, burst, ttl, sweepInterval, System::nanoTime);
    }

    /**
     * Starts the periodic sweep of idle buckets.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            sweeper.scheduleWithFixedDelay(this::sweepSafely,
                    sweepInterval.toMillis(), sweepInterval.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Rate limit sweeper started: interval={}", sweepInterval);
        }
    }

    public boolean allow(String key) {
        return allow(key, 1.0);
    }

    /**
     * Refills the key's bucket, then debits {@code cost} tokens if available.
     */
    public boolean allow(String key, double cost) {
        long now = nanoClock.getAsLong();
        Bucket bucket = buckets.computeIfAbsent(key, k -> new Bucket(burst, now));
        boolean allowed = bucket.tryConsume(now, cost, ratePerSecond, burst);
        if (!allowed) {
            log.debug("Rate limited: key={}", key);
        }
        return allowed;
    }

    /**
     * Removes buckets idle for longer than the TTL.
     *
     * @return number of buckets removed
     */
    public int sweep() {
        long now = nanoClock.getAsLong();
        int before = buckets.size();
        buckets.values().removeIf(bucket -> bucket.idleNanos(now) > ttlNanos);
        int removed = before - buckets.size();
        if (removed > 0) {
            log.debug("Idle rate-limit buckets swept: removed={}, remaining={}", removed, buckets.size());
        }
        return removed;
    }

    private void sweepSafely() {
        try {
            sweep();
        } catch (RuntimeException e) {
            log.warn("Rate limit sweep failed", e);
        }
    }

    public int trackedKeys() {
        return buckets.size();
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            sweeper.shutdown();
            try {
                if (!sweeper.awaitTermination(5, TimeUnit.SECONDS)) {
                    sweeper.shutdownNow();
                }
            } catch (InterruptedException e) {
                sweeper.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("Rate limit sweeper stopped");
        } else {
            sweeper.shutdownNow();
        }
    }

    private static final class Bucket {
        private double tokens;
        private long lastRefill;

        Bucket(double tokens, long now) {
            this.tokens = tokens;
            this.lastRefill = now;
        }

        synchronized boolean tryConsume(long now, double cost, double rate, int burst) {
            double elapsedSeconds = Math.max(0, now - lastRefill) / NANOS_PER_SECOND;
            tokens = Math.min(burst, tokens + rate * elapsedSeconds);
            lastRefill = Math.max(lastRefill, now);
            if (tokens >= cost) {
                tokens -= cost;
                return true;
            }
            return false;
        }

        synchronized long idleNanos(long now) {
            return now - lastRefill;
        }
    }
}

package fr.lapetina.ocr.scheduler.security;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class RateLimiterTest {

    private AtomicLong nanos;
    private RateLimiter limiter;

    @BeforeEach
    void setUp() {
        nanos = new AtomicLong(TimeUnit.SECONDS.toNanos(1000));
        limiter = new RateLimiter(2.0, 3, Duration.ofSeconds(60), Duration.ofSeconds(30), nanos::get);
    }

    @AfterEach
    void tearDown() {
        limiter.close();
    }

    private void advanceMillis(long millis) {
        nanos.addAndGet(TimeUnit.MILLISECONDS.toNanos(millis));
    }

    @Test
    @DisplayName("should admit a burst then reject")
    void shouldAdmitBurst() {
        assertThat(limiter.allow("10.0.0.1")).isTrue();
        assertThat(limiter.allow("10.0.0.1")).isTrue();
        assertThat(limiter.allow("10.0.0.1")).isTrue();
        assertThat(limiter.allow("10.0.0.1")).isFalse();
    }

    @Test
    @DisplayName("should refill at the configured rate")
    void shouldRefill() {
        for (int i = 0; i < 3; i++) {
            limiter.allow("client");
        }
        assertThat(limiter.allow("client")).isFalse();

        advanceMillis(250);
        assertThat(limiter.allow("client")).isFalse();

        advanceMillis(250);
        assertThat(limiter.allow("client")).isTrue();
        assertThat(limiter.allow("client")).isFalse();
    }

    @Test
    @DisplayName("should never refill beyond the burst size")
    void shouldCapAtBurst() {
        limiter.allow("client");
        advanceMillis(60_000);

        assertThat(limiter.allow("client", 3)).isTrue();
        assertThat(limiter.allow("client")).isFalse();
    }

    @Test
    @DisplayName("should keep separate buckets per key")
    void shouldIsolateKeys() {
        assertThat(limiter.allow("a", 3)).isTrue();
        assertThat(limiter.allow("a")).isFalse();

        assertThat(limiter.allow("b")).isTrue();
        assertThat(limiter.trackedKeys()).isEqualTo(2);
    }

    @Test
    @DisplayName("should sweep buckets idle past the ttl")
    void shouldSweepIdleBuckets() {
        limiter.allow("stale");
        advanceMillis(30_000);
        limiter.allow("fresh");
        advanceMillis(30_001);

        assertThat(limiter.sweep()).isEqualTo(1);
        assertThat(limiter.trackedKeys()).isEqualTo(1);

        // a swept key starts over with a full bucket
        assertThat(limiter.allow("stale", 3)).isTrue();
    }
}

package fr.lapetina.ocr.scheduler.infrastructure.metrics;

import fr.lapetina.ocr.scheduler.domain.model.ErrorType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsRegistryTest {

    private MetricsRegistry metrics;

    @BeforeEach
    void setUp() {
        metrics = new MetricsRegistry("metrics_test");
    }

    @AfterEach
    void tearDown() {
        metrics.close();
    }

    @Test
    @DisplayName("should count job outcomes")
    void shouldCountOutcomes() {
        metrics.incrementSubmitted();
        metrics.incrementSubmitted();
        metrics.incrementSucceeded();
        metrics.incrementFailed(ErrorType.TIMEOUT);
        metrics.incrementPublishFailed();

        assertThat(metrics.getSubmittedCount()).isEqualTo(2.0);
        assertThat(metrics.getSucceededCount()).isEqualTo(1.0);
        assertThat(metrics.getFailedCount()).isEqualTo(1.0);
        assertThat(metrics.getPublishFailedCount()).isEqualTo(1.0);
        assertThat(metrics.scrape()).contains("metrics_test_task_failures_total{kind=\"TIMEOUT\"");
    }

    @Test
    @DisplayName("should tag rejections by reason")
    void shouldTagRejections() {
        metrics.incrementRejected(ErrorType.QUEUE_FULL);
        metrics.incrementRejected(ErrorType.RATE_LIMITED);

        assertThat(metrics.scrape())
                .contains("metrics_test_tasks_rejected_total{reason=\"QUEUE_FULL\"")
                .contains("metrics_test_tasks_rejected_total{reason=\"RATE_LIMITED\"");
    }

    @Test
    @DisplayName("should read gauges at scrape time")
    void shouldPullGaugeValues() {
        AtomicInteger depth = new AtomicInteger(3);
        metrics.registerGauge("queue_size", "Jobs waiting", depth::get);

        assertThat(metrics.scrape()).contains("metrics_test_queue_size 3.0");

        depth.set(7);
        assertThat(metrics.scrape()).contains("metrics_test_queue_size 7.0");
    }

    @Test
    @DisplayName("should expose stage timers")
    void shouldRecordStages() {
        metrics.recordStageLatency("inference", Duration.ofMillis(120));

        assertThat(metrics.scrape()).contains("metrics_test_stage_latency_seconds_count{stage=\"inference\"");
    }
}

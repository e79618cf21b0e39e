package fr.lapetina.batchinference.infrastructure.metrics;

import fr.lapetina.batchinference.domain.model.BatchResult;
import fr.lapetina.batchinference.domain.model.ErrorType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsRegistryTest {

    private MetricsRegistry metricsRegistry;

    @BeforeEach
    void setUp() {
        metricsRegistry = new MetricsRegistry("test_engine");
    }

    @AfterEach
    void tearDown() {
        metricsRegistry.close();
    }

    @Test
    @DisplayName("should count request outcomes by tag")
    void shouldCountOutcomes() {
        metricsRegistry.recordCompleted(3);
        metricsRegistry.recordFailed(ErrorType.BACKEND_ERROR, 2);
        metricsRegistry.recordExpired(1);
        metricsRegistry.recordRejected(4);

        assertThat(counter("completed")).isEqualTo(3.0);
        assertThat(counter("failed")).isEqualTo(2.0);
        assertThat(counter("expired")).isEqualTo(1.0);
        assertThat(counter("rejected")).isEqualTo(4.0);
    }

    @Test
    @DisplayName("should record batch size and duration per client")
    void shouldRecordBatch() {
        metricsRegistry.recordBatch(new BatchResult("b1", 0, "client-a", 8, 8, 0,
                Duration.ofMillis(120), Duration.ofMillis(15)));
        metricsRegistry.recordBatch(new BatchResult("b2", 1, "client-b", 4, 3, 1,
                Duration.ofMillis(80), Duration.ofMillis(5)));

        assertThat(metricsRegistry.getRegistry().get("test_engine_batch_size").summary().count())
                .isEqualTo(2);
        assertThat(metricsRegistry.getRegistry().get("test_engine_batch_size").summary().totalAmount())
                .isEqualTo(12.0);
        assertThat(metricsRegistry.getRegistry().get("test_engine_batch_duration")
                .tag("client", "client-a").timer().count()).isEqualTo(1);
    }

    @Test
    @DisplayName("should expose meters in Prometheus scrape output")
    void shouldExposeMetersInScrape() {
        metricsRegistry.recordCompleted(1);
        metricsRegistry.setQueueDepth(5);
        metricsRegistry.setActiveBatches(2);
        metricsRegistry.setThroughput(7.5);

        String scrape = metricsRegistry.scrape();

        assertThat(scrape)
                .contains("test_engine_requests_total")
                .contains("test_engine_queue_depth 5.0")
                .contains("test_engine_active_batches 2.0")
                .contains("test_engine_throughput_rps 7.5")
                .contains("jvm_memory_used_bytes");
    }

    private double counter(String outcome) {
        return metricsRegistry.getRegistry().get("test_engine_requests_total")
                .tag("outcome", outcome)
                .counter()
                .count();
    }
}

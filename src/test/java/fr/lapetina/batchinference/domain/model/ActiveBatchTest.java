package fr.lapetina.batchinference.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ActiveBatchTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private static BatchRequest createdAt(Instant createdAt) {
        return BatchRequest.builder()
                .prompt("p")
                .createdAt(createdAt)
                .timeout(Duration.ofSeconds(30))
                .build();
    }

    @Test
    @DisplayName("should be claimable once")
    void shouldBeClaimableOnce() {
        ActiveBatch batch = new ActiveBatch(List.of(createdAt(NOW)));

        assertThat(batch.isClaimed()).isFalse();
        assertThat(batch.getAssignedWorker()).isNull();

        assertThat(batch.claim(2)).isTrue();
        assertThat(batch.claim(3)).isFalse();

        assertThat(batch.isClaimed()).isTrue();
        assertThat(batch.getAssignedWorker()).isEqualTo(2);
    }

    @Test
    @DisplayName("should reject empty batches")
    void shouldRejectEmptyBatches() {
        assertThatThrownBy(() -> new ActiveBatch(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should average queue wait up to batch start")
    void shouldAverageQueueWait() {
        ActiveBatch batch = new ActiveBatch("b1", List.of(
                createdAt(NOW.minusMillis(100)),
                createdAt(NOW.minusMillis(300))
        ), NOW);

        assertThat(batch.averageWaitTime()).isEqualTo(Duration.ofMillis(200));
        assertThat(batch.size()).isEqualTo(2);
    }
}

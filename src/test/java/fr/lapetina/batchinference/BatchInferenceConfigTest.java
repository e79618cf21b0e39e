package fr.lapetina.batchinference;

import fr.lapetina.batchinference.infrastructure.config.BatchEngineConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchInferenceConfigTest {

    @Test
    @DisplayName("should expose documented defaults")
    void shouldExposeDefaults() {
        BatchInferenceConfig config = BatchInferenceConfig.defaults();

        assertThat(config.maxBatchSize()).isEqualTo(32);
        assertThat(config.minBatchSize()).isEqualTo(4);
        assertThat(config.optimalBatchSize()).isEqualTo(16);
        assertThat(config.batchTimeout()).isEqualTo(Duration.ofMillis(100));
        assertThat(config.requestTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.workerCount()).isEqualTo(4);
        assertThat(config.enableDynamicBatching()).isTrue();
        assertThat(config.urgencyThreshold()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.maxQueueDepth()).isZero();
        assertThat(config.clientSelection()).isEqualTo("worker-affinity");
    }

    @Test
    @DisplayName("should reject inconsistent batch sizes")
    void shouldRejectInconsistentSizes() {
        assertThatThrownBy(() -> BatchInferenceConfig.builder().minBatchSize(40).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("minBatchSize");
        assertThatThrownBy(() -> BatchInferenceConfig.builder().optimalBatchSize(64).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("optimalBatchSize");
        assertThatThrownBy(() -> BatchInferenceConfig.builder().workerCount(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BatchInferenceConfig.builder().requestTimeout(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should copy settings from YAML model")
    void shouldCopyFromYamlModel() {
        BatchEngineConfig yaml = new BatchEngineConfig();
        yaml.getBatching().setMaxBatchSize(10);
        yaml.getBatching().setMinBatchSize(2);
        yaml.getBatching().setOptimalBatchSize(5);
        yaml.getBatching().setDynamic(false);
        yaml.getWorkers().setCount(3);
        yaml.getWorkers().setClientSelection("round-robin");
        yaml.getQueue().setMaxDepth(100);

        BatchInferenceConfig config = BatchInferenceConfig.builder().fromConfig(yaml).build();

        assertThat(config.maxBatchSize()).isEqualTo(10);
        assertThat(config.minBatchSize()).isEqualTo(2);
        assertThat(config.optimalBatchSize()).isEqualTo(5);
        assertThat(config.enableDynamicBatching()).isFalse();
        assertThat(config.workerCount()).isEqualTo(3);
        assertThat(config.clientSelection()).isEqualTo("round-robin");
        assertThat(config.maxQueueDepth()).isEqualTo(100);
    }

    @Test
    @DisplayName("should round-trip through toBuilder")
    void shouldCopyWithToBuilder() {
        BatchInferenceConfig original = BatchInferenceConfig.builder().maxBatchSize(64).build();

        assertThat(original.toBuilder().build()).isEqualTo(original);
        assertThat(original.toBuilder().workerCount(8).build().maxBatchSize()).isEqualTo(64);
    }
}

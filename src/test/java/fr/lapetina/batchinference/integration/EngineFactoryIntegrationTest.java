package fr.lapetina.batchinference.integration;

import fr.lapetina.batchinference.BatchInferenceConfig;
import fr.lapetina.batchinference.EngineState;
import fr.lapetina.batchinference.domain.model.InferenceResponse;
import fr.lapetina.batchinference.domain.model.RequestPriority;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests through {@link TestEngineFactory}, wired from test-config.yaml.
 */
class EngineFactoryIntegrationTest {

    private TestEngineFactory factory;

    @BeforeEach
    void setUp() {
        factory = TestEngineFactory.create();
    }

    @AfterEach
    void tearDown() {
        factory.close();
    }

    @Nested
    @DisplayName("Wiring")
    class WiringTests {

        @Test
        @DisplayName("should build engine settings from YAML")
        void shouldBuildEngineSettings() {
            BatchInferenceConfig config = factory.getEngine().getConfig();

            assertThat(config.maxBatchSize()).isEqualTo(8);
            assertThat(config.minBatchSize()).isEqualTo(2);
            assertThat(config.workerCount()).isEqualTo(2);
            assertThat(config.clientSelection()).isEqualTo("round-robin");
            assertThat(factory.getClients()).hasSize(2);
            assertThat(factory.getEngine().state()).isEqualTo(EngineState.RUNNING);
        }
    }

    @Nested
    @DisplayName("Request flow")
    class FlowTests {

        @Test
        @DisplayName("should answer every request and spread batches over clients")
        void shouldAnswerAndSpreadBatches() throws Exception {
            List<CompletableFuture<InferenceResponse>> futures = new ArrayList<>();
            for (int round = 0; round < 10; round++) {
                for (int i = 0; i < 4; i++) {
                    futures.add(factory.getEngine().submit("r" + round + "-" + i, RequestPriority.NORMAL));
                }
                Thread.sleep(30);
            }

            for (CompletableFuture<InferenceResponse> future : futures) {
                InferenceResponse response = future.get(5, TimeUnit.SECONDS);
                assertThat(response.isSuccess()).isTrue();
                assertThat(response.text()).endsWith("-response");
            }
            assertThat(factory.getStub(0).getCallCount()).isPositive();
            assertThat(factory.getStub(1).getCallCount()).isPositive();
            assertThat(factory.getStub(0).getCallCount() + factory.getStub(1).getCallCount()).isEqualTo(40);
        }

        @Test
        @DisplayName("should report batches to the listener and to Prometheus")
        void shouldReportBatches() throws Exception {
            CompletableFuture.allOf(
                    factory.getEngine().submit("x"),
                    factory.getEngine().submit("y")
            ).get(5, TimeUnit.SECONDS);

            long deadline = System.currentTimeMillis() + 2000;
            while (factory.getBatchResults().isEmpty() && System.currentTimeMillis() < deadline) {
                Thread.sleep(5);
            }

            assertThat(factory.getBatchResults()).isNotEmpty();
            String scrape = factory.getMetricsRegistry().scrape();
            assertThat(scrape).contains("test_batch_requests_total");
            assertThat(scrape).contains("test_batch_queue_depth");
            assertThat(scrape).contains("test_batch_batch_size");
        }
    }

    @Nested
    @DisplayName("Configuration reload")
    class ReloadTests {

        @Test
        @DisplayName("should push reloaded batching settings to the running engine")
        void shouldApplyReloadedSettings() {
            String yaml = "batching:\n"
                    + "  maxBatchSize: 16\n"
                    + "  minBatchSize: 1\n"
                    + "  optimalBatchSize: 8\n"
                    + "workers:\n"
                    + "  count: 2\n"
                    + "  clientSelection: round-robin\n";

            factory.getConfigLoader().loadFromStream(
                    new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));

            BatchInferenceConfig config = factory.getEngine().getConfig();
            assertThat(config.maxBatchSize()).isEqualTo(16);
            assertThat(config.minBatchSize()).isEqualTo(1);
            assertThat(config.optimalBatchSize()).isEqualTo(8);
        }

        @Test
        @DisplayName("should keep settings when reloaded values are inconsistent")
        void shouldKeepSettingsOnInconsistentReload() {
            String yaml = "batching:\n"
                    + "  maxBatchSize: 4\n"
                    + "  minBatchSize: 10\n";

            factory.getConfigLoader().loadFromStream(
                    new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));

            assertThat(factory.getEngine().getConfig().maxBatchSize()).isEqualTo(8);
        }
    }
}

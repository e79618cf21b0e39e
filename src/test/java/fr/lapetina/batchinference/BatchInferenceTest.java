package fr.lapetina.batchinference;

import fr.lapetina.batchinference.domain.model.ErrorType;
import fr.lapetina.batchinference.domain.model.InferenceResponse;
import fr.lapetina.batchinference.integration.StubInferenceClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BatchInferenceTest {

    private static BatchInferenceConfig config() {
        return BatchInferenceConfig.builder()
                .batchTimeout(Duration.ofMillis(10))
                .scheduleInterval(Duration.ofMillis(2))
                .workerIdleInterval(Duration.ofMillis(1))
                .build();
    }

    @Test
    @DisplayName("should return responses in prompt order")
    void shouldReturnResponsesInOrder() {
        StubInferenceClient client = new StubInferenceClient().respondWith(String::toUpperCase);

        List<InferenceResponse> responses = BatchInference.run(client, List.of("a", "b", "c", "d", "e"), config());

        assertThat(responses).extracting(InferenceResponse::text).containsExactly("A", "B", "C", "D", "E");
        assertThat(client.getCallCount()).isEqualTo(5);
    }

    @Test
    @DisplayName("should keep failures in place")
    void shouldKeepFailuresInPlace() {
        StubInferenceClient client = new StubInferenceClient().failWhen("bad"::equals);

        List<InferenceResponse> responses = BatchInference.run(client, List.of("ok", "bad", "fine"), config());

        assertThat(responses).hasSize(3);
        assertThat(responses.get(0).isSuccess()).isTrue();
        assertThat(responses.get(1).errorType()).isEqualTo(ErrorType.BACKEND_ERROR);
        assertThat(responses.get(2).text()).isEqualTo("fine-response");
    }

    @Test
    @DisplayName("should return an empty list for no prompts")
    void shouldHandleNoPrompts() {
        assertThat(BatchInference.run(new StubInferenceClient(), List.of(), null)).isEmpty();
    }
}

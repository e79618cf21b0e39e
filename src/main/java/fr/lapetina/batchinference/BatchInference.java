package fr.lapetina.batchinference;

import fr.lapetina.batchinference.client.InferenceClient;
import fr.lapetina.batchinference.domain.model.ErrorType;
import fr.lapetina.batchinference.domain.model.InferenceResponse;
import fr.lapetina.batchinference.domain.model.RequestPriority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One-shot helpers around {@link BatchInferenceEngine}.
 */
public final class BatchInference {

    private static final Logger log = LoggerFactory.getLogger(BatchInference.class);

    private BatchInference() {
        // Utility class
    }

    /**
     * Runs a list of prompts through a throwaway engine and returns the
     * responses in prompt order.
     *
     * Each wait is bounded by the configured request timeout plus the
     * shutdown timeout; a prompt that exceeds it gets a TIMEOUT response.
     */
    public static List<InferenceResponse> run(
            InferenceClient client,
            List<String> prompts,
            BatchInferenceConfig config
    ) {
        Objects.requireNonNull(client, "client");
        Objects.requireNonNull(prompts, "prompts");

        try (BatchInferenceEngine engine = BatchInferenceEngine.builder()
                .client(client)
                .config(config != null ? config : BatchInferenceConfig.defaults())
                .build()) {
            engine.start();

            List<CompletableFuture<InferenceResponse>> futures = new ArrayList<>(prompts.size());
            for (String prompt : prompts) {
                futures.add(engine.submit(prompt, RequestPriority.NORMAL));
            }

            long waitMillis = engine.getConfig().requestTimeout()
                    .plus(engine.getConfig().shutdownTimeout()).toMillis();
            List<InferenceResponse> responses = new ArrayList<>(futures.size());
            for (CompletableFuture<InferenceResponse> future : futures) {
                responses.add(await(future, waitMillis));
            }

            log.info("Batch run finished: prompts={}, succeeded={}, failed={}",
                    prompts.size(),
                    responses.stream().filter(InferenceResponse::isSuccess).count(),
                    responses.stream().filter(InferenceResponse::isError).count());
            return responses;
        }
    }

    private static InferenceResponse await(CompletableFuture<InferenceResponse> future, long waitMillis) {
        try {
            return future.get(waitMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            return syntheticError(ErrorType.TIMEOUT, "No response within " + waitMillis + "ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return syntheticError(ErrorType.SHUTDOWN, "Interrupted while waiting for response");
        } catch (ExecutionException e) {
            return syntheticError(ErrorType.INTERNAL_ERROR, String.valueOf(e.getCause()));
        }
    }

    private static InferenceResponse syntheticError(ErrorType errorType, String message) {
        return new InferenceResponse(UUID.randomUUID().toString(), null, null, null,
                null, null, errorType, message);
    }
}

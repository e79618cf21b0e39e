package fr.lapetina.batchinference.client;

import fr.lapetina.batchinference.domain.model.InferenceParameters;

import java.util.concurrent.CompletableFuture;

/**
 * Backend capability the engine dispatches prompts to.
 *
 * Implementations must be thread-safe: a single client may serve several
 * workers, each with many requests in flight at once. A failure is reported
 * by completing the returned future exceptionally; a synchronous throw is
 * treated the same way by the engine.
 */
@FunctionalInterface
public interface InferenceClient {

    /**
     * Generates text for one prompt.
     *
     * @param prompt     the input text
     * @param parameters generation settings, never null
     * @return future completing with the generated text
     */
    CompletableFuture<String> complete(String prompt, InferenceParameters parameters);

    /**
     * Identifier used in logs, metrics and responses.
     */
    default String getId() {
        return getClass().getSimpleName();
    }
}

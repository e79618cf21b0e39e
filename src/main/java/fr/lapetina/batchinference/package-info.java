/**
 * Batch Inference Engine - dynamic request batching in front of LLM inference backends.
 *
 * <p>Callers submit individual prompts; the engine groups them into batches sized for
 * throughput while honouring priorities and deadlines, and dispatches each batch to a
 * backend {@link fr.lapetina.batchinference.client.InferenceClient}.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.batchinference.BatchInferenceEngine} - Engine facade and lifecycle</li>
 *   <li>{@link fr.lapetina.batchinference.EngineFactory} - Fully-wired engine from YAML configuration</li>
 *   <li>{@link fr.lapetina.batchinference.BatchInference} - One-shot helper for a list of prompts</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (EngineFactory factory = EngineFactory.create("batch-engine.yaml").start()) {
 *     BatchInferenceEngine engine = factory.getEngine();
 *
 *     CompletableFuture<InferenceResponse> future =
 *             engine.submit("Hello!", RequestPriority.HIGH);
 *
 *     InferenceResponse response = future.get();
 *     System.out.println(response.text());
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Priority queue with FIFO ordering inside a priority tier</li>
 *   <li>Latency-aware dynamic batch sizing, or fixed-size batching</li>
 *   <li>Per-request deadlines with TIMEOUT replies</li>
 *   <li>Hot-reload of batching thresholds</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 * </ul>
 *
 * @see fr.lapetina.batchinference.BatchInferenceEngine
 * @see fr.lapetina.batchinference.EngineFactory
 */
package fr.lapetina.batchinference;

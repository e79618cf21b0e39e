/**
 * Domain model classes for requests, batches and their outcomes.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.batchinference.domain.model.BatchRequest} - A submitted prompt with priority and deadline</li>
 *   <li>{@link fr.lapetina.batchinference.domain.model.ReplyChannel} - Write-once channel carrying the outcome</li>
 *   <li>{@link fr.lapetina.batchinference.domain.model.ActiveBatch} - A scheduled group of requests</li>
 *   <li>{@link fr.lapetina.batchinference.domain.model.InferenceResponse} - Immutable terminal outcome</li>
 *   <li>{@link fr.lapetina.batchinference.domain.model.EngineMetrics} - Live counters and moving averages</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Records are immutable. {@code ActiveBatch} claim state is only touched under the
 * lock of the registry holding it; {@code EngineMetrics} uses atomics plus one monitor.
 */
package fr.lapetina.batchinference.domain.model;

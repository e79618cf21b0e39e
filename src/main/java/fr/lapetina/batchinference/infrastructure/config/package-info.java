/**
 * Configuration loading and hot-reload support.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.batchinference.infrastructure.config.BatchEngineConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.batchinference.infrastructure.config.ConfigLoader} - YAML loading and file watching</li>
 *   <li>{@link fr.lapetina.batchinference.infrastructure.config.ConfigChangeListener} - Callback for configuration changes</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code batching} - Batch sizes, batch and request timeouts, dynamic flag, urgency threshold</li>
 *   <li>{@code workers} - Worker count, client selection strategy, idle interval</li>
 *   <li>{@code queue} - Queue capacity and expiration sweep interval</li>
 *   <li>{@code clients} - Ollama backends</li>
 *   <li>{@code metrics} - Prometheus prefix and sampling interval</li>
 * </ul>
 */
package fr.lapetina.batchinference.infrastructure.config;

package fr.lapetina.batchinference;

import fr.lapetina.batchinference.client.InferenceClient;
import fr.lapetina.batchinference.infrastructure.config.BatchEngineConfig;
import fr.lapetina.batchinference.infrastructure.config.ConfigLoader;
import fr.lapetina.batchinference.infrastructure.config.ConfigurationException;
import fr.lapetina.batchinference.infrastructure.http.OllamaInferenceClient;
import fr.lapetina.batchinference.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Factory for creating a fully-wired engine from YAML configuration.
 * This is the primary entry point when running against Ollama servers.
 *
 * <p>Usage:
 * <pre>{@code
 * try (EngineFactory factory = EngineFactory.create("batch-engine.yaml").start()) {
 *     BatchInferenceEngine engine = factory.getEngine();
 *     // use engine...
 * }
 * }</pre>
 */
public class EngineFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EngineFactory.class);

    private final ConfigLoader configLoader;
    private final BatchEngineConfig config;
    private final MetricsRegistry metricsRegistry;
    private final List<InferenceClient> clients;
    private final BatchInferenceEngine engine;

    protected EngineFactory(
            String configPath,
            List<? extends InferenceClient> clientOverrides,
            BatchResultListener listener
    ) {
        log.info("Initializing EngineFactory from config: {}", configPath);

        this.configLoader = new ConfigLoader(configPath);
        this.config = configLoader.load();

        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());

        // Allow override for testing
        this.clients = clientOverrides != null ? List.copyOf(clientOverrides) : createClients(config);

        this.engine = BatchInferenceEngine.builder()
                .config(toEngineConfig(config))
                .clients(clients)
                .metricsRegistry(metricsRegistry)
                .listener(listener)
                .build();

        configLoader.addListener(this::onConfigChanged);

        log.info("EngineFactory initialized with {} clients", clients.size());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static EngineFactory create(String configPath) {
        return new EngineFactory(configPath, null, null);
    }

    /**
     * Creates a factory from the default configuration (batch-engine.yaml).
     */
    public static EngineFactory create() {
        return create("batch-engine.yaml");
    }

    /**
     * Starts the engine and the configuration watcher.
     */
    public EngineFactory start() {
        engine.start();
        configLoader.startWatching();
        log.info("Engine started");
        return this;
    }

    public BatchInferenceEngine getEngine() {
        return engine;
    }

    public List<InferenceClient> getClients() {
        return clients;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public BatchEngineConfig getConfig() {
        return config;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    static BatchInferenceConfig toEngineConfig(BatchEngineConfig config) {
        try {
            return BatchInferenceConfig.builder().fromConfig(config).build();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid engine configuration: " + e.getMessage(), e);
        }
    }

    private static List<InferenceClient> createClients(BatchEngineConfig config) {
        List<InferenceClient> created = new ArrayList<>();
        for (BatchEngineConfig.ClientConfig clientConfig : config.getClients()) {
            if (!clientConfig.isEnabled()) {
                log.info("Skipping disabled client: {}", clientConfig.getId());
                continue;
            }
            created.add(new OllamaInferenceClient(
                    clientConfig.getId(),
                    clientConfig.getUrl(),
                    clientConfig.getModel(),
                    Duration.ofMillis(clientConfig.getConnectTimeoutMs()),
                    Duration.ofMillis(clientConfig.getRequestTimeoutMs())
            ));
            log.debug("Registered client: id={}, url={}, model={}",
                    clientConfig.getId(), clientConfig.getUrl(), clientConfig.getModel());
        }
        return created;
    }

    private void onConfigChanged(BatchEngineConfig oldConfig, BatchEngineConfig newConfig) {
        if (oldConfig == null) {
            return;
        }
        log.info("Configuration changed, applying updates...");
        try {
            engine.updateBatchingConfig(toEngineConfig(newConfig));
        } catch (ConfigurationException e) {
            log.error("Rejected configuration update, keeping current settings", e);
            return;
        }
        if (newConfig.getClients().size() != oldConfig.getClients().size()) {
            log.warn("Client list changes require a restart: configured={}, active={}",
                    newConfig.getClients().size(), clients.size());
        }
        log.info("Configuration updates applied");
    }

    @Override
    public void close() {
        log.info("Shutting down EngineFactory...");

        try {
            configLoader.close();
        } catch (Exception e) {
            log.warn("Error closing config loader", e);
        }

        try {
            engine.close();
        } catch (Exception e) {
            log.warn("Error closing engine", e);
        }

        for (InferenceClient client : clients) {
            if (client instanceof AutoCloseable) {
                try {
                    ((AutoCloseable) client).close();
                } catch (Exception e) {
                    log.warn("Error closing client: {}", client.getId(), e);
                }
            }
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("EngineFactory shut down");
    }
}

package fr.lapetina.batchinference.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * YAML configuration loader with hot-reload support.
 *
 * Looks for the file on disk first, then on the classpath. When watching is
 * enabled, modifications to the file are picked up once per second and pushed
 * to registered listeners.
 */
public final class ConfigLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final AtomicReference<BatchEngineConfig> currentConfig = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Path configPath;
    private final Yaml yaml;

    private WatchService watchService;
    private ScheduledExecutorService watchExecutor;
    private volatile long lastModified;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        this.yaml = new Yaml(new Constructor(BatchEngineConfig.class, new LoaderOptions()));
    }

    /**
     * Loads configuration from file or classpath and notifies listeners.
     *
     * @throws ConfigurationException if the file is missing, unreadable or invalid
     */
    public BatchEngineConfig load() {
        BatchEngineConfig config = validate(read());
        BatchEngineConfig previous = currentConfig.getAndSet(config);
        notifyListeners(previous, config);
        return config;
    }

    /**
     * Loads configuration from an input stream and notifies listeners.
     */
    public BatchEngineConfig loadFromStream(InputStream inputStream) {
        BatchEngineConfig config = validate(parse(inputStream, "stream"));
        BatchEngineConfig previous = currentConfig.getAndSet(config);
        notifyListeners(previous, config);
        return config;
    }

    public BatchEngineConfig getCurrentConfig() {
        return currentConfig.get();
    }

    private BatchEngineConfig read() {
        if (Files.exists(configPath)) {
            log.info("Loading configuration from file: {}", configPath);
            try (InputStream is = Files.newInputStream(configPath)) {
                lastModified = Files.getLastModifiedTime(configPath).toMillis();
                return parse(is, configPath.toString());
            } catch (IOException e) {
                throw new ConfigurationException("Failed to load configuration from: " + configPath, e);
            }
        }

        String resource = configPath.toString();
        if (resource.startsWith("/")) {
            resource = resource.substring(1);
        }
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(resource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", resource);
                return parse(is, resource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + resource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private BatchEngineConfig parse(InputStream inputStream, String source) {
        try {
            BatchEngineConfig config = yaml.load(inputStream);
            // An empty document yields null
            return config != null ? config : new BatchEngineConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid YAML in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Structural checks that do not depend on the engine itself.
     * Batch-size consistency is checked when engine settings are built.
     */
    static BatchEngineConfig validate(BatchEngineConfig config) {
        Set<String> ids = new HashSet<>();
        for (BatchEngineConfig.ClientConfig client : config.getClients()) {
            if (client.getId() == null || client.getId().isBlank()) {
                throw new ConfigurationException("Client id is required");
            }
            if (!ids.add(client.getId())) {
                throw new ConfigurationException("Duplicate client id: " + client.getId());
            }
            if (client.isEnabled() && (client.getUrl() == null || client.getUrl().isBlank())) {
                throw new ConfigurationException("Client " + client.getId() + " has no url");
            }
            if (client.isEnabled() && (client.getModel() == null || client.getModel().isBlank())) {
                throw new ConfigurationException("Client " + client.getId() + " has no model");
            }
        }
        if (config.getWorkers().getCount() < 1) {
            throw new ConfigurationException("workers.count must be >= 1");
        }
        return config;
    }

    /**
     * Starts watching the configuration file for changes.
     * No-op when the configuration came from the classpath.
     */
    public void startWatching() {
        if (!Files.exists(configPath)) {
            log.warn("Config file does not exist on disk, hot reload disabled: {}", configPath);
            return;
        }

        try {
            watchService = FileSystems.getDefault().newWatchService();
            Path parent = configPath.toAbsolutePath().getParent();
            parent.register(watchService, StandardWatchEventKinds.ENTRY_MODIFY);

            watchExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "config-watcher");
                t.setDaemon(true);
                return t;
            });
            watchExecutor.scheduleWithFixedDelay(this::checkForChanges, 1, 1, TimeUnit.SECONDS);

            log.info("Configuration hot-reload enabled for: {}", configPath);
        } catch (IOException e) {
            log.error("Failed to start config watcher", e);
        }
    }

    private void checkForChanges() {
        try {
            WatchKey key = watchService.poll();
            if (key == null) {
                return;
            }

            boolean touched = false;
            for (WatchEvent<?> event : key.pollEvents()) {
                if (configPath.getFileName().equals(event.context())) {
                    touched = true;
                }
            }
            key.reset();

            // Editors often emit several events per save
            if (touched && Files.getLastModifiedTime(configPath).toMillis() > lastModified) {
                log.info("Configuration file changed, reloading...");
                reload();
            }
        } catch (Exception e) {
            log.error("Error checking for config changes", e);
        }
    }

    /**
     * Forces a reload. Keeps the current configuration if the new one is invalid.
     */
    public BatchEngineConfig reload() {
        try {
            return load();
        } catch (ConfigurationException e) {
            log.error("Failed to reload configuration, keeping current", e);
            return currentConfig.get();
        }
    }

    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    private void notifyListeners(BatchEngineConfig oldConfig, BatchEngineConfig newConfig) {
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(oldConfig, newConfig);
            } catch (Exception e) {
                log.error("Error notifying config change listener", e);
            }
        }
    }

    @Override
    public void close() {
        if (watchExecutor != null) {
            watchExecutor.shutdown();
            try {
                watchExecutor.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                log.warn("Error closing watch service", e);
            }
        }
    }
}

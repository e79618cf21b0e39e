package fr.lapetina.batchinference.infrastructure.config;

/**
 * Callback invoked by {@link ConfigLoader} after every successful load.
 */
@FunctionalInterface
public interface ConfigChangeListener {

    /**
     * @param oldConfig previous configuration, null on the first load
     * @param newConfig configuration now in effect
     */
    void onConfigChanged(BatchEngineConfig oldConfig, BatchEngineConfig newConfig);
}

package fr.lapetina.batchinference.integration;

import fr.lapetina.batchinference.BatchResultListener;
import fr.lapetina.batchinference.EngineFactory;
import fr.lapetina.batchinference.domain.model.BatchResult;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Test extension of EngineFactory that wires stub clients instead of Ollama.
 */
public final class TestEngineFactory extends EngineFactory {

    private final List<StubInferenceClient> stubs;
    private final List<BatchResult> batchResults;

    private TestEngineFactory(String configPath, List<StubInferenceClient> stubs, List<BatchResult> batchResults) {
        super(configPath, List.copyOf(stubs), batchResults::add);
        this.stubs = stubs;
        this.batchResults = batchResults;
    }

    /**
     * Creates and starts a test factory from the default test configuration.
     */
    public static TestEngineFactory create() {
        return create("test-config.yaml");
    }

    /**
     * Creates and starts a test factory with two stub clients.
     */
    public static TestEngineFactory create(String configPath) {
        TestEngineFactory factory = new TestEngineFactory(
                configPath,
                List.of(new StubInferenceClient("test-client-1"), new StubInferenceClient("test-client-2")),
                new CopyOnWriteArrayList<>());
        factory.start();
        return factory;
    }

    public StubInferenceClient getStub(int index) {
        return stubs.get(index);
    }

    public List<StubInferenceClient> getStubs() {
        return stubs;
    }

    /**
     * Results reported through the {@link BatchResultListener} hook.
     */
    public List<BatchResult> getBatchResults() {
        return batchResults;
    }
}

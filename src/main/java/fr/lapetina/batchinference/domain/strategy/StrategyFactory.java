package fr.lapetina.batchinference.domain.strategy;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Name-based registry for batch sizing and client selection strategies.
 */
public final class StrategyFactory {

    private static final Map<String, Supplier<BatchSizingStrategy>> SIZING = new ConcurrentHashMap<>();
    private static final Map<String, Supplier<ClientSelectionStrategy>> SELECTION = new ConcurrentHashMap<>();

    static {
        registerSizing("dynamic", LatencyAwareSizingStrategy::new);
        registerSizing("fixed", FixedSizingStrategy::new);

        registerSelection("worker-affinity", WorkerAffinityStrategy::new);
        registerSelection("round-robin", RoundRobinStrategy::new);
    }

    private StrategyFactory() {
        // Utility class
    }

    public static void registerSizing(String name, Supplier<BatchSizingStrategy> supplier) {
        SIZING.put(name.toLowerCase(), supplier);
    }

    public static void registerSelection(String name, Supplier<ClientSelectionStrategy> supplier) {
        SELECTION.put(name.toLowerCase(), supplier);
    }

    public static Optional<BatchSizingStrategy> createSizing(String name) {
        Supplier<BatchSizingStrategy> supplier = SIZING.get(name.toLowerCase());
        return supplier == null ? Optional.empty() : Optional.of(supplier.get());
    }

    /**
     * Sizing strategy matching the {@code enableDynamicBatching} flag.
     */
    public static BatchSizingStrategy sizingFor(boolean dynamic) {
        return createSizing(dynamic ? "dynamic" : "fixed").orElseThrow();
    }

    public static Optional<ClientSelectionStrategy> createSelection(String name) {
        Supplier<ClientSelectionStrategy> supplier = SELECTION.get(name.toLowerCase());
        return supplier == null ? Optional.empty() : Optional.of(supplier.get());
    }

    public static Set<String> getSelectionNames() {
        return Set.copyOf(SELECTION.keySet());
    }
}

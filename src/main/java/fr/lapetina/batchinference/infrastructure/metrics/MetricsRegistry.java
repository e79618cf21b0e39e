package fr.lapetina.batchinference.infrastructure.metrics;

import fr.lapetina.batchinference.domain.model.BatchResult;
import fr.lapetina.batchinference.domain.model.ErrorType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer meters for the batch engine, exposed in Prometheus format.
 *
 * Provides:
 * - Request outcome counters (completed, failed by error type, expired, rejected)
 * - Batch size distribution and batch duration per backend client
 * - Queue wait timer
 * - Queue depth, active batch and throughput gauges
 * - JVM and system metrics
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    private final ConcurrentHashMap<String, Counter> outcomeCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> batchTimers = new ConcurrentHashMap<>();
    private final DistributionSummary batchSize;
    private final Timer queueWait;

    private final AtomicInteger queueDepth = new AtomicInteger(0);
    private final AtomicInteger activeBatches = new AtomicInteger(0);
    private volatile double throughput;

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        Gauge.builder(prefix + "_queue_depth", queueDepth, AtomicInteger::get)
                .description("Requests waiting to be batched")
                .register(registry);

        Gauge.builder(prefix + "_active_batches", activeBatches, AtomicInteger::get)
                .description("Batches scheduled or being dispatched")
                .register(registry);

        Gauge.builder(prefix + "_throughput_rps", this, r -> r.throughput)
                .description("Completed requests per second over the last sample")
                .register(registry);

        this.batchSize = DistributionSummary.builder(prefix + "_batch_size")
                .description("Requests per dispatched batch")
                .publishPercentiles(0.5, 0.9, 0.99)
                .register(registry);

        this.queueWait = Timer.builder(prefix + "_queue_wait")
                .description("Average time requests spent queued before batching")
                .publishPercentiles(0.5, 0.9, 0.99)
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("batch_inference");
    }

    public void recordCompleted(int count) {
        outcomeCounter("completed", "none").increment(count);
    }

    public void recordFailed(ErrorType errorType, int count) {
        outcomeCounter("failed", errorType.name()).increment(count);
    }

    public void recordExpired(int count) {
        outcomeCounter("expired", ErrorType.TIMEOUT.name()).increment(count);
    }

    public void recordRejected(int count) {
        outcomeCounter("rejected", ErrorType.SHUTDOWN.name()).increment(count);
    }

    /**
     * Records size, duration and queue wait of a finished batch.
     */
    public void recordBatch(BatchResult result) {
        batchSize.record(result.batchSize());
        queueWait.record(result.averageWaitTime());
        batchTimers.computeIfAbsent(result.clientId(), clientId ->
                Timer.builder(prefix + "_batch_duration")
                        .description("Wall-clock time to dispatch a whole batch")
                        .tag("client", clientId)
                        .publishPercentileHistogram()
                        .register(registry)
        ).record(result.processingTime());
    }

    public void setQueueDepth(int value) {
        queueDepth.set(value);
    }

    public void setActiveBatches(int value) {
        activeBatches.set(value);
    }

    public void setThroughput(double requestsPerSecond) {
        this.throughput = requestsPerSecond;
    }

    private Counter outcomeCounter(String outcome, String errorType) {
        return outcomeCounters.computeIfAbsent(outcome + ":" + errorType, k ->
                Counter.builder(prefix + "_requests_total")
                        .description("Requests by terminal outcome")
                        .tag("outcome", outcome)
                        .tag("error_type", errorType)
                        .register(registry)
        );
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}

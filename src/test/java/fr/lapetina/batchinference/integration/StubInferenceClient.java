package fr.lapetina.batchinference.integration;

import fr.lapetina.batchinference.client.BackendException;
import fr.lapetina.batchinference.client.InferenceClient;
import fr.lapetina.batchinference.domain.model.InferenceParameters;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Stub backend for tests. Echoes {@code prompt + "-response"} unless told otherwise.
 */
public final class StubInferenceClient implements InferenceClient {

    private final String id;
    private final List<String> prompts = new CopyOnWriteArrayList<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();

    private volatile Function<String, String> responseGenerator = prompt -> prompt + "-response";
    private volatile Predicate<String> failWhen = prompt -> false;
    private volatile Supplier<Duration> delay = () -> Duration.ZERO;

    public StubInferenceClient(String id) {
        this.id = id;
    }

    public StubInferenceClient() {
        this("stub-client");
    }

    @Override
    public String getId() {
        return id;
    }

    /**
     * Sets the response generator for successful calls.
     */
    public StubInferenceClient respondWith(Function<String, String> generator) {
        this.responseGenerator = generator;
        return this;
    }

    /**
     * Fails every call whose prompt matches with a {@link BackendException}.
     */
    public StubInferenceClient failWhen(Predicate<String> predicate) {
        this.failWhen = predicate;
        return this;
    }

    /**
     * Completes each call asynchronously after the given delay.
     */
    public StubInferenceClient withDelay(Duration delay) {
        this.delay = () -> delay;
        return this;
    }

    /**
     * Completes each call after a random delay between zero and {@code max}.
     */
    public StubInferenceClient withRandomDelay(Duration max) {
        this.delay = () -> Duration.ofMillis(ThreadLocalRandom.current().nextLong(max.toMillis() + 1));
        return this;
    }

    @Override
    public CompletableFuture<String> complete(String prompt, InferenceParameters parameters) {
        prompts.add(prompt);
        int current = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(current, Math::max);

        CompletableFuture<String> result = new CompletableFuture<>();
        Runnable finish = () -> {
            inFlight.decrementAndGet();
            if (failWhen.test(prompt)) {
                result.completeExceptionally(new BackendException(id, "stub failure for " + prompt));
            } else {
                result.complete(responseGenerator.apply(prompt));
            }
        };

        Duration callDelay = delay.get();
        if (callDelay.isZero()) {
            finish.run();
        } else {
            Executor delayed = CompletableFuture.delayedExecutor(callDelay.toMillis(), TimeUnit.MILLISECONDS);
            delayed.execute(finish);
        }
        return result;
    }

    public List<String> getPrompts() {
        return List.copyOf(prompts);
    }

    public int getCallCount() {
        return prompts.size();
    }

    public int getMaxInFlight() {
        return maxInFlight.get();
    }
}

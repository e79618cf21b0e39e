package fr.lapetina.batchinference.scheduler;

import fr.lapetina.batchinference.domain.model.BatchRequest;
import fr.lapetina.batchinference.domain.model.RequestPriority;
import fr.lapetina.batchinference.scheduler.exception.BackpressureException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestQueueTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private final AtomicLong sequence = new AtomicLong();
    private RequestQueue queue;

    @BeforeEach
    void setUp() {
        queue = new RequestQueue();
    }

    private BatchRequest request(RequestPriority priority) {
        return request(priority, Duration.ofSeconds(30));
    }

    private BatchRequest request(RequestPriority priority, Duration timeout) {
        long seq = sequence.getAndIncrement();
        return BatchRequest.builder()
                .prompt(priority + "-" + seq)
                .priority(priority)
                .createdAt(NOW)
                .timeout(timeout)
                .sequence(seq)
                .build();
    }

    @Nested
    @DisplayName("Ordering")
    class OrderingTests {

        @Test
        @DisplayName("should order by priority and keep FIFO within a tier")
        void shouldOrderByPriorityThenFifo() {
            BatchRequest normal1 = request(RequestPriority.NORMAL);
            BatchRequest low = request(RequestPriority.LOW);
            BatchRequest critical = request(RequestPriority.CRITICAL);
            BatchRequest normal2 = request(RequestPriority.NORMAL);
            BatchRequest high = request(RequestPriority.HIGH);

            for (BatchRequest r : List.of(normal1, low, critical, normal2, high)) {
                queue.enqueue(r);
            }

            assertThat(queue.snapshot()).containsExactly(critical, high, normal1, normal2, low);
        }

        @Test
        @DisplayName("should hand out critical before older normal requests")
        void shouldHandOutCriticalFirst() {
            BatchRequest normal = request(RequestPriority.NORMAL);
            BatchRequest critical = request(RequestPriority.CRITICAL);
            queue.enqueue(normal);
            queue.enqueue(critical);

            assertThat(queue.drainUpTo(1)).containsExactly(critical);
            assertThat(queue.drainUpTo(1)).containsExactly(normal);
        }
    }

    @Nested
    @DisplayName("Draining")
    class DrainingTests {

        @Test
        @DisplayName("should drain at most n requests from the front")
        void shouldDrainUpToN() {
            for (int i = 0; i < 5; i++) {
                queue.enqueue(request(RequestPriority.NORMAL));
            }

            assertThat(queue.drainUpTo(3)).hasSize(3);
            assertThat(queue.size()).isEqualTo(2);
            assertThat(queue.drainUpTo(10)).hasSize(2);
            assertThat(queue.isEmpty()).isTrue();
            assertThat(queue.drainUpTo(1)).isEmpty();
        }

        @Test
        @DisplayName("should remove only expired requests")
        void shouldRemoveOnlyExpired() {
            BatchRequest shortLived = request(RequestPriority.HIGH, Duration.ofMillis(50));
            BatchRequest longLived = request(RequestPriority.HIGH, Duration.ofSeconds(10));
            queue.enqueue(shortLived);
            queue.enqueue(longLived);

            assertThat(queue.removeExpired(NOW.plusMillis(49))).isEmpty();
            assertThat(queue.removeExpired(NOW.plusMillis(50))).containsExactly(shortLived);
            assertThat(queue.snapshot()).containsExactly(longLived);
        }

        @Test
        @DisplayName("should refuse requests once closed")
        void shouldRefuseRequestsOnceClosed() {
            queue.enqueue(request(RequestPriority.LOW));

            assertThat(queue.closeAndDrain()).hasSize(1);
            assertThat(queue.enqueue(request(RequestPriority.CRITICAL))).isFalse();
            assertThat(queue.isEmpty()).isTrue();
        }
    }

    @Test
    @DisplayName("should apply backpressure at max depth")
    void shouldApplyBackpressure() {
        RequestQueue bounded = new RequestQueue(2);
        bounded.enqueue(request(RequestPriority.NORMAL));
        bounded.enqueue(request(RequestPriority.NORMAL));

        assertThatThrownBy(() -> bounded.enqueue(request(RequestPriority.CRITICAL)))
                .isInstanceOf(BackpressureException.class)
                .extracting(e -> ((BackpressureException) e).getReason())
                .isEqualTo(BackpressureException.BackpressureReason.QUEUE_FULL);
        assertThat(bounded.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("should not lose requests under concurrent enqueue and drain")
    void shouldNotLoseRequestsConcurrently() throws Exception {
        int producers = 4;
        int perProducer = 500;
        ExecutorService executor = Executors.newFixedThreadPool(producers + 1);
        CountDownLatch done = new CountDownLatch(producers);
        AtomicLong drained = new AtomicLong();

        for (int p = 0; p < producers; p++) {
            executor.submit(() -> {
                for (int i = 0; i < perProducer; i++) {
                    queue.enqueue(request(RequestPriority.values()[i % 4]));
                }
                done.countDown();
            });
        }
        executor.submit(() -> {
            while (done.getCount() > 0 || !queue.isEmpty()) {
                drained.addAndGet(queue.drainUpTo(7).size());
            }
        });

        executor.shutdown();
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        assertThat(drained.get() + queue.size()).isEqualTo((long) producers * perProducer);
    }
}

package fr.lapetina.batchinference.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ReplyChannelTest {

    private static InferenceResponse response(String text) {
        return new InferenceResponse("req-1", text, null, null, Instant.now(), Instant.now(), null, null);
    }

    @Test
    @DisplayName("should complete future on first delivery only")
    void shouldCompleteOnFirstDeliveryOnly() {
        ReplyChannel channel = new ReplyChannel();
        CompletableFuture<InferenceResponse> future = channel.future();

        assertThat(channel.deliver(response("first"))).isTrue();
        assertThat(channel.deliver(response("second"))).isFalse();

        assertThat(channel.isDelivered()).isTrue();
        assertThat(future.join().text()).isEqualTo("first");
    }

    @Test
    @DisplayName("should not let callers complete the channel")
    void shouldNotLetCallersCompleteChannel() {
        ReplyChannel channel = new ReplyChannel();

        channel.future().complete(response("forged"));

        assertThat(channel.isDelivered()).isFalse();
        assertThat(channel.future()).isNotDone();
        assertThat(channel.deliver(response("real"))).isTrue();
        assertThat(channel.future().join().text()).isEqualTo("real");
    }

    @Test
    @DisplayName("should run accounting before the submitter sees the reply")
    void shouldRunAccountingBeforeCompletion() {
        ReplyChannel channel = new ReplyChannel();
        CompletableFuture<InferenceResponse> future = channel.future();
        AtomicBoolean doneDuringCallback = new AtomicBoolean(true);

        channel.deliver(response("ok"), () -> doneDuringCallback.set(future.isDone()));

        assertThat(doneDuringCallback).isFalse();
        assertThat(future).isDone();
    }

    @Test
    @DisplayName("should skip accounting for a rejected delivery")
    void shouldSkipAccountingForRejectedDelivery() {
        ReplyChannel channel = new ReplyChannel();
        AtomicInteger accepted = new AtomicInteger();

        channel.deliver(response("first"), accepted::incrementAndGet);
        channel.deliver(response("second"), accepted::incrementAndGet);

        assertThat(accepted).hasValue(1);
    }
}

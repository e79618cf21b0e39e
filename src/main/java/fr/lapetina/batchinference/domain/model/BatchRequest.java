package fr.lapetina.batchinference.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;
import java.util.UUID;

/**
 * One unit of work submitted by a caller.
 *
 * Identity and scheduling fields are immutable. The only mutable part is the
 * {@link ReplyChannel}, which is itself write-once.
 */
public final class BatchRequest {

    /**
     * Queue order: highest priority first, then insertion order.
     */
    public static final Comparator<BatchRequest> QUEUE_ORDER =
            Comparator.comparing(BatchRequest::getPriority, Comparator.reverseOrder())
                    .thenComparingLong(BatchRequest::getSequence);

    private final String id;
    private final String prompt;
    private final InferenceParameters parameters;
    private final RequestPriority priority;
    private final Instant createdAt;
    private final Instant deadline;
    private final long sequence;
    private final ReplyChannel replyChannel;

    private BatchRequest(Builder builder) {
        this.prompt = Objects.requireNonNull(builder.prompt, "Prompt is required");
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.parameters = builder.parameters != null ? builder.parameters : InferenceParameters.defaults();
        this.priority = builder.priority != null ? builder.priority : RequestPriority.NORMAL;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.deadline = Objects.requireNonNull(builder.deadline, "Deadline is required");
        this.sequence = builder.sequence;
        this.replyChannel = new ReplyChannel();
    }

    public String getId() {
        return id;
    }

    public String getPrompt() {
        return prompt;
    }

    public InferenceParameters getParameters() {
        return parameters;
    }

    public RequestPriority getPriority() {
        return priority;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getDeadline() {
        return deadline;
    }

    public long getSequence() {
        return sequence;
    }

    public ReplyChannel getReplyChannel() {
        return replyChannel;
    }

    public boolean isExpired(Instant now) {
        return !deadline.isAfter(now);
    }

    /**
     * True when less than {@code threshold} remains before the deadline.
     */
    public boolean isUrgent(Instant now, Duration threshold) {
        return Duration.between(now, deadline).compareTo(threshold) < 0;
    }

    /**
     * Delivers this request's terminal outcome.
     *
     * @return false if an outcome had already been delivered
     */
    public boolean reply(InferenceResponse response) {
        return replyChannel.deliver(response);
    }

    /**
     * Replies, running {@code onAccepted} only if this call wins the channel.
     */
    public boolean reply(InferenceResponse response, Runnable onAccepted) {
        return replyChannel.deliver(response, onAccepted);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "BatchRequest{" +
                "id='" + id + '\'' +
                ", priority=" + priority +
                ", sequence=" + sequence +
                ", deadline=" + deadline +
                '}';
    }

    public static final class Builder {
        private String id;
        private String prompt;
        private InferenceParameters parameters;
        private RequestPriority priority;
        private Instant createdAt;
        private Instant deadline;
        private long sequence;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder prompt(String prompt) {
            this.prompt = prompt;
            return this;
        }

        public Builder parameters(InferenceParameters parameters) {
            this.parameters = parameters;
            return this;
        }

        public Builder priority(RequestPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder deadline(Instant deadline) {
            this.deadline = deadline;
            return this;
        }

        /**
         * Convenience for {@code deadline = createdAt + timeout}.
         */
        public Builder timeout(Duration timeout) {
            if (createdAt == null) {
                createdAt = Instant.now();
            }
            this.deadline = createdAt.plus(timeout);
            return this;
        }

        public Builder sequence(long sequence) {
            this.sequence = sequence;
            return this;
        }

        public BatchRequest build() {
            return new BatchRequest(this);
        }
    }
}

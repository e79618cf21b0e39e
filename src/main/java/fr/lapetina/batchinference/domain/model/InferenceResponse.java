package fr.lapetina.batchinference.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Terminal outcome of a submitted request: generated text, or an error.
 * Immutable and thread-safe.
 */
public record InferenceResponse(
        String requestId,
        String text,
        String batchId,
        String clientId,
        Instant createdAt,
        Instant completedAt,
        ErrorType errorType,
        String errorMessage
) {
    public InferenceResponse {
        Objects.requireNonNull(requestId, "Request ID is required");
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (completedAt == null) {
            completedAt = Instant.now();
        }
    }

    public boolean isSuccess() {
        return errorType == null;
    }

    public boolean isError() {
        return errorType != null;
    }

    /**
     * Creates a successful response.
     */
    public static InferenceResponse success(
            BatchRequest request,
            String text,
            String batchId,
            String clientId
    ) {
        return new InferenceResponse(
                request.getId(), text, batchId, clientId,
                request.getCreatedAt(), Instant.now(), null, null
        );
    }

    /**
     * Creates an error response for a request that was placed in a batch.
     */
    public static InferenceResponse error(
            BatchRequest request,
            String batchId,
            String clientId,
            ErrorType errorType,
            String errorMessage
    ) {
        return new InferenceResponse(
                request.getId(), null, batchId, clientId,
                request.getCreatedAt(), Instant.now(), errorType, errorMessage
        );
    }

    /**
     * Creates an error response for a request that never reached a batch.
     */
    public static InferenceResponse error(
            BatchRequest request,
            ErrorType errorType,
            String errorMessage
    ) {
        return error(request, null, null, errorType, errorMessage);
    }
}

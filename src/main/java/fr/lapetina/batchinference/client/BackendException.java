package fr.lapetina.batchinference.client;

/**
 * Raised by an {@link InferenceClient} when the backend cannot produce a result.
 */
public class BackendException extends RuntimeException {

    private final String clientId;
    private final int statusCode;

    public BackendException(String clientId, String message) {
        this(clientId, message, -1, null);
    }

    public BackendException(String clientId, String message, Throwable cause) {
        this(clientId, message, -1, cause);
    }

    public BackendException(String clientId, String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.clientId = clientId;
        this.statusCode = statusCode;
    }

    public String getClientId() {
        return clientId;
    }

    /**
     * HTTP status reported by the backend, or -1 when not applicable.
     */
    public int getStatusCode() {
        return statusCode;
    }
}

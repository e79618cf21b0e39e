package fr.lapetina.batchinference.infrastructure.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.batchinference.client.BackendException;
import fr.lapetina.batchinference.client.InferenceClient;
import fr.lapetina.batchinference.domain.model.InferenceParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * {@link InferenceClient} backed by an Ollama server's {@code /api/generate}
 * endpoint, non-streaming.
 *
 * Uses java.net.http.HttpClient for non-blocking I/O. Non-2xx statuses and
 * transport failures complete the returned future exceptionally with a
 * {@link BackendException}.
 */
public class OllamaInferenceClient implements InferenceClient, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OllamaInferenceClient.class);

    private final String id;
    private final URI generateUri;
    private final String model;
    private final Duration requestTimeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public OllamaInferenceClient(
            String id,
            String baseUrl,
            String model,
            Duration connectTimeout,
            Duration requestTimeout
    ) {
        this.id = Objects.requireNonNull(id, "Client ID is required");
        this.model = Objects.requireNonNull(model, "Model is required");
        this.generateUri = buildUri(Objects.requireNonNull(baseUrl, "Base URL is required"));
        this.requestTimeout = requestTimeout;

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        this.objectMapper = new ObjectMapper()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public OllamaInferenceClient(String id, String baseUrl, String model) {
        this(id, baseUrl, model, Duration.ofSeconds(10), Duration.ofMinutes(2));
    }

    @Override
    public String getId() {
        return id;
    }

    public String getModel() {
        return model;
    }

    @Override
    public CompletableFuture<String> complete(String prompt, InferenceParameters parameters) {
        HttpRequest httpRequest;
        try {
            httpRequest = HttpRequest.newBuilder()
                    .uri(generateUri)
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(buildRequestBody(prompt, parameters)))
                    .build();
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(
                    new BackendException(id, "Failed to build request: " + e.getMessage(), e));
        }

        Instant start = Instant.now();
        log.debug("Sending request: clientId={}, model={}, endpoint={}", id, model, generateUri);

        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
                .handle((response, error) -> {
                    long latencyMs = Duration.between(start, Instant.now()).toMillis();
                    if (error != null) {
                        Throwable cause = error instanceof CompletionException && error.getCause() != null
                                ? error.getCause() : error;
                        log.warn("Request failed with transport error: clientId={}, latencyMs={}, error={}",
                                id, latencyMs, cause.toString());
                        throw new BackendException(id, "Transport error: " + cause.getMessage(), cause);
                    }
                    return handleResponse(response, latencyMs);
                });
    }

    String buildRequestBody(String prompt, InferenceParameters parameters) throws JsonProcessingException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("prompt", prompt);
        body.put("stream", false);

        Map<String, Object> options = toOptions(parameters);
        if (!options.isEmpty()) {
            body.put("options", options);
        }
        return objectMapper.writeValueAsString(body);
    }

    private static Map<String, Object> toOptions(InferenceParameters parameters) {
        Map<String, Object> options = new LinkedHashMap<>();
        if (parameters == null) {
            return options;
        }
        putIfPresent(options, "temperature", parameters.temperature());
        putIfPresent(options, "num_predict", parameters.maxTokens());
        putIfPresent(options, "top_p", parameters.topP());
        putIfPresent(options, "top_k", parameters.topK());
        putIfPresent(options, "repeat_penalty", parameters.repetitionPenalty());
        if (parameters.stopSequences() != null && !parameters.stopSequences().isEmpty()) {
            options.put("stop", parameters.stopSequences());
        }
        return options;
    }

    private static void putIfPresent(Map<String, Object> options, String key, Object value) {
        if (value != null) {
            options.put(key, value);
        }
    }

    private String handleResponse(HttpResponse<String> response, long latencyMs) {
        int statusCode = response.statusCode();
        if (statusCode < 200 || statusCode >= 300) {
            log.warn("Request failed with HTTP error: clientId={}, status={}, latencyMs={}",
                    id, statusCode, latencyMs);
            throw new BackendException(id, "HTTP " + statusCode + ": " + extractError(response.body()),
                    statusCode, null);
        }

        try {
            JsonNode json = objectMapper.readTree(response.body());
            JsonNode text = json.get("response");
            if (text == null || text.isNull()) {
                throw new BackendException(id, "Response has no 'response' field");
            }
            log.debug("Request successful: clientId={}, status={}, latencyMs={}", id, statusCode, latencyMs);
            return text.asText();
        } catch (JsonProcessingException e) {
            throw new BackendException(id, "Malformed response: " + e.getOriginalMessage(), e);
        }
    }

    private String extractError(String body) {
        if (body == null || body.isBlank()) {
            return "empty body";
        }
        try {
            JsonNode json = objectMapper.readTree(body);
            if (json.has("error")) {
                return json.get("error").asText();
            }
        } catch (JsonProcessingException e) {
            log.debug("Error body is not JSON: clientId={}", id);
        }
        return body;
    }

    private static URI buildUri(String baseUrl) {
        String base = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
        return URI.create(base + "api/generate");
    }

    @Override
    public void close() {
        // HttpClient doesn't need explicit closing on JDK 17
    }
}

package fr.lapetina.llmmanager.infrastructure.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.llmmanager.domain.backend.Backend;
import fr.lapetina.llmmanager.domain.backend.BackendException;
import fr.lapetina.llmmanager.domain.model.BackendConfig;
import fr.lapetina.llmmanager.domain.model.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Base class for backends that speak a JSON chat API over HTTP.
 *
 * Uses java.net.http.HttpClient for non-blocking I/O. Configuration is read
 * on every call, so updates to the instance's {@link BackendConfig} apply to
 * the next request. Any failure completes the returned future with a
 * {@link BackendException}.
 */
public abstract class HttpChatBackend implements Backend {

    private static final Logger log = LoggerFactory.getLogger(HttpChatBackend.class);

    public static final String BASE_URL = "base_url";
    public static final String API_KEY = "api_key";
    public static final String MODEL = "model";
    public static final String TIMEOUT_MS = "timeout_ms";
    public static final String CONNECT_TIMEOUT_MS = "connect_timeout_ms";

    static final long DEFAULT_TIMEOUT_MS = 60_000;
    static final long DEFAULT_CONNECT_TIMEOUT_MS = 10_000;

    protected final BackendConfig config;
    protected final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final String defaultBaseUrl;

    protected HttpChatBackend(BackendConfig config, String defaultBaseUrl) {
        this.config = Objects.requireNonNull(config, "Backend config is required");
        this.defaultBaseUrl = Objects.requireNonNull(defaultBaseUrl, "Default base URL is required");

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(config.getLong(CONNECT_TIMEOUT_MS, DEFAULT_CONNECT_TIMEOUT_MS)))
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        this.objectMapper = new ObjectMapper()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Path appended to the configured base URL, without a leading slash.
     */
    protected abstract String endpointPath();

    /**
     * Builds the JSON payload for the given conversation.
     */
    protected abstract Map<String, Object> buildPayload(List<Message> messages);

    /**
     * Extracts the response text from a successful body.
     *
     * @throws BackendException if the body does not have the expected shape
     */
    protected abstract String extractContent(JsonNode body);

    /**
     * Adds API specific headers, such as authentication.
     */
    protected void addHeaders(HttpRequest.Builder builder) {
        // no extra headers by default
    }

    @Override
    public CompletableFuture<String> generate(List<Message> messages) {
        HttpRequest httpRequest;
        try {
            httpRequest = buildHttpRequest(messages);
        } catch (Exception e) {
            log.error("Failed to build request: backend={}", getClass().getSimpleName(), e);
            return CompletableFuture.failedFuture(
                    new BackendException("Failed to build request: " + e.getMessage(), e));
        }

        Instant startTime = Instant.now();
        log.debug("Sending request: backend={}, uri={}, messages={}",
                getClass().getSimpleName(), httpRequest.uri(), messages.size());

        CompletableFuture<String> result = new CompletableFuture<>();
        httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
                .whenComplete((response, throwable) -> {
                    long latencyMs = Duration.between(startTime, Instant.now()).toMillis();
                    try {
                        if (throwable != null) {
                            result.completeExceptionally(handleException(httpRequest, throwable, latencyMs));
                        } else {
                            result.complete(handleResponse(httpRequest, response, latencyMs));
                        }
                    } catch (BackendException e) {
                        result.completeExceptionally(e);
                    } catch (RuntimeException e) {
                        result.completeExceptionally(
                                new BackendException("Failed to handle response: " + e.getMessage(), e));
                    }
                });
        return result;
    }

    protected URI endpoint() {
        String base = config.getString(BASE_URL, defaultBaseUrl);
        if (!base.endsWith("/")) {
            base += "/";
        }
        return URI.create(base + endpointPath());
    }

    protected String model(String defaultModel) {
        return config.getString(MODEL, defaultModel);
    }

    protected List<Map<String, String>> toWireMessages(List<Message> messages) {
        return messages.stream()
                .map(m -> Map.of("role", m.role(), "content", m.content()))
                .toList();
    }

    private HttpRequest buildHttpRequest(List<Message> messages) throws JsonProcessingException {
        String body = objectMapper.writeValueAsString(buildPayload(messages));

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(endpoint())
                .timeout(Duration.ofMillis(config.getLong(TIMEOUT_MS, DEFAULT_TIMEOUT_MS)))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body));
        addHeaders(builder);
        return builder.build();
    }

    private String handleResponse(HttpRequest request, HttpResponse<String> response, long latencyMs) {
        int statusCode = response.statusCode();

        if (statusCode < 200 || statusCode >= 300) {
            String detail = extractErrorMessage(response.body());
            log.warn("Request failed with HTTP error: uri={}, status={}, latencyMs={}, error={}",
                    request.uri(), statusCode, latencyMs, detail);
            throw new BackendException("HTTP " + statusCode + ": " + detail, statusCode);
        }

        JsonNode body;
        try {
            body = objectMapper.readTree(response.body());
        } catch (IOException e) {
            throw new BackendException("Failed to parse response: " + e.getMessage(), statusCode, e);
        }

        String content = extractContent(body);
        log.debug("Request successful: uri={}, status={}, latencyMs={}", request.uri(), statusCode, latencyMs);
        return content;
    }

    private String extractErrorMessage(String body) {
        if (body == null || body.isBlank()) {
            return "empty body";
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            JsonNode error = node.get("error");
            if (error != null) {
                if (error.isTextual()) {
                    return error.asText();
                }
                JsonNode message = error.get("message");
                if (message != null && message.isTextual()) {
                    return message.asText();
                }
            }
        } catch (IOException e) {
            log.debug("Error body is not JSON: {}", e.getMessage());
        }
        return body.length() > 200 ? body.substring(0, 200) : body;
    }

    private BackendException handleException(HttpRequest request, Throwable throwable, long latencyMs) {
        Throwable cause = throwable instanceof CompletionException && throwable.getCause() != null
                ? throwable.getCause()
                : throwable;

        if (cause instanceof HttpTimeoutException) {
            log.error("Request timeout: uri={}, latencyMs={}, error={}", request.uri(), latencyMs, cause.getMessage());
            return new BackendException("Request timed out after " + latencyMs + "ms", cause);
        }
        if (cause instanceof IOException) {
            log.error("Connection error: uri={}, errorType={}, error={}",
                    request.uri(), cause.getClass().getSimpleName(), cause.getMessage());
            return new BackendException("Connection error: " + cause.getMessage(), cause);
        }
        log.error("Request failed unexpectedly: uri={}, errorType={}",
                request.uri(), cause.getClass().getSimpleName(), cause);
        return new BackendException("Request failed: " + cause.getMessage(), cause);
    }

    protected static BackendException malformed(String expected) {
        return new BackendException("Malformed response: missing " + expected);
    }
}

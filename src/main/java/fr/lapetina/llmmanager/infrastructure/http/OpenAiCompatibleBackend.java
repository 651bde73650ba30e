package fr.lapetina.llmmanager.infrastructure.http;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.llmmanager.domain.model.BackendConfig;
import fr.lapetina.llmmanager.domain.model.Message;

import java.net.http.HttpRequest;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Backend for OpenAI-style {@code /chat/completions} APIs (OpenRouter, Together, ...).
 *
 * Config keys: {@code base_url}, {@code api_key}, {@code model},
 * {@code temperature} (0.7), {@code max_tokens} (512), {@code timeout_ms}.
 */
public class OpenAiCompatibleBackend extends HttpChatBackend {

    public static final String TEMPERATURE = "temperature";
    public static final String MAX_TOKENS = "max_tokens";

    static final double DEFAULT_TEMPERATURE = 0.7;
    static final int DEFAULT_MAX_TOKENS = 512;

    private final String defaultModel;

    public OpenAiCompatibleBackend(BackendConfig config, String defaultBaseUrl, String defaultModel) {
        super(config, defaultBaseUrl);
        this.defaultModel = defaultModel;
    }

    @Override
    protected String endpointPath() {
        return "chat/completions";
    }

    @Override
    protected void addHeaders(HttpRequest.Builder builder) {
        String apiKey = config.getString(API_KEY, null);
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
    }

    @Override
    protected Map<String, Object> buildPayload(List<Message> messages) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model(defaultModel));
        body.put("messages", toWireMessages(messages));
        body.put("temperature", config.getDouble(TEMPERATURE, DEFAULT_TEMPERATURE));
        body.put("max_tokens", config.getInt(MAX_TOKENS, DEFAULT_MAX_TOKENS));
        return body;
    }

    @Override
    protected String extractContent(JsonNode body) {
        JsonNode choices = body.get("choices");
        if (choices == null || !choices.isArray() || choices.isEmpty()) {
            throw malformed("choices");
        }
        JsonNode content = choices.get(0).path("message").get("content");
        if (content == null || content.isNull()) {
            throw malformed("choices[0].message.content");
        }
        return content.asText();
    }
}

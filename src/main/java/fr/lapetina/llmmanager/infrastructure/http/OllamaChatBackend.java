package fr.lapetina.llmmanager.infrastructure.http;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.llmmanager.domain.model.BackendConfig;
import fr.lapetina.llmmanager.domain.model.Message;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Backend for an Ollama server's {@code /api/chat} endpoint, non-streaming.
 *
 * Config keys: {@code base_url}, {@code model}, {@code options} (map passed through),
 * {@code timeout_ms}.
 */
public class OllamaChatBackend extends HttpChatBackend {

    public static final String OPTIONS = "options";

    static final String DEFAULT_BASE_URL = "http://localhost:11434";
    static final String DEFAULT_MODEL = "llama3";

    public OllamaChatBackend(BackendConfig config) {
        super(config, DEFAULT_BASE_URL);
    }

    @Override
    protected String endpointPath() {
        return "api/chat";
    }

    @Override
    protected Map<String, Object> buildPayload(List<Message> messages) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model(DEFAULT_MODEL));
        body.put("messages", toWireMessages(messages));
        body.put("stream", false);

        Object options = config.get(OPTIONS);
        if (options instanceof Map && !((Map<?, ?>) options).isEmpty()) {
            body.put("options", options);
        }
        return body;
    }

    @Override
    protected String extractContent(JsonNode body) {
        JsonNode content = body.path("message").get("content");
        if (content == null || content.isNull()) {
            throw malformed("message.content");
        }
        return content.asText();
    }
}

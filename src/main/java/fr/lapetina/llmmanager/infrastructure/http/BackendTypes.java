package fr.lapetina.llmmanager.infrastructure.http;

import fr.lapetina.llmmanager.registry.InstanceRegistry;

import java.util.List;

/**
 * Built-in backend types shipped with the manager.
 */
public final class BackendTypes {

    public static final String OPEN_ROUTER = "OpenRouterLLM";
    public static final String TOGETHER = "TogetherLLM";
    public static final String OLLAMA = "Ollama";

    static final String OPEN_ROUTER_URL = "https://openrouter.ai/api/v1";
    static final String OPEN_ROUTER_MODEL = "openrouter/gpt-4o-mini";
    static final String TOGETHER_URL = "https://api.together.xyz/v1";
    static final String TOGETHER_MODEL = "mistralai/Mixtral-8x7B-Instruct-v0.1";

    private BackendTypes() {
        // Utility class
    }

    /**
     * Registers every built-in type in the given registry.
     */
    public static void registerBuiltIns(InstanceRegistry registry) {
        registry.registerBackendType(OPEN_ROUTER,
                config -> new OpenAiCompatibleBackend(config, OPEN_ROUTER_URL, OPEN_ROUTER_MODEL));
        registry.registerBackendType(TOGETHER,
                config -> new OpenAiCompatibleBackend(config, TOGETHER_URL, TOGETHER_MODEL));
        registry.registerBackendType(OLLAMA, OllamaChatBackend::new);
    }

    public static List<String> names() {
        return List.of(OPEN_ROUTER, TOGETHER, OLLAMA);
    }
}

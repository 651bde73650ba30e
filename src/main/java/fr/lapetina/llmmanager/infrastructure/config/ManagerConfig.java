package fr.lapetina.llmmanager.infrastructure.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration object for the manager.
 * Designed to be populated from YAML.
 */
public class ManagerConfig {

    private String secretsFile;
    private List<InstanceConfig> instances = new ArrayList<>();
    private DispatchConfig dispatch = new DispatchConfig();
    private MetricsConfig metrics = new MetricsConfig();

    public String getSecretsFile() { return secretsFile; }
    public void setSecretsFile(String secretsFile) { this.secretsFile = secretsFile; }

    public List<InstanceConfig> getInstances() { return instances; }
    public void setInstances(List<InstanceConfig> instances) { this.instances = instances; }

    public DispatchConfig getDispatch() { return dispatch; }
    public void setDispatch(DispatchConfig dispatch) { this.dispatch = dispatch; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * One model instance to create at startup.
     */
    public static class InstanceConfig {
        private String id;
        private String type;
        private String apiKeySecret;
        private Map<String, Object> config = new LinkedHashMap<>();

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        /** Name of the secret copied into the {@code api_key} config entry. */
        public String getApiKeySecret() { return apiKeySecret; }
        public void setApiKeySecret(String apiKeySecret) { this.apiKeySecret = apiKeySecret; }

        public Map<String, Object> getConfig() { return config; }
        public void setConfig(Map<String, Object> config) { this.config = config; }
    }

    /**
     * Context policy used by the application entry point.
     */
    public static class DispatchConfig {
        private String role = "user";
        private boolean saveContext = true;
        private boolean appendPromptBeforeCall = true;

        public String getRole() { return role; }
        public void setRole(String role) { this.role = role; }

        public boolean isSaveContext() { return saveContext; }
        public void setSaveContext(boolean saveContext) { this.saveContext = saveContext; }

        public boolean isAppendPromptBeforeCall() { return appendPromptBeforeCall; }
        public void setAppendPromptBeforeCall(boolean appendPromptBeforeCall) {
            this.appendPromptBeforeCall = appendPromptBeforeCall;
        }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private String prefix = "llm_manager";

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}

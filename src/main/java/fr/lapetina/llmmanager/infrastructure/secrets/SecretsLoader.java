package fr.lapetina.llmmanager.infrastructure.secrets;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.llmmanager.infrastructure.config.ConfigLoader.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Reads API keys from a flat JSON object, e.g. {@code {"openrouter_api_key": "..."}}.
 */
public final class SecretsLoader {

    private static final Logger log = LoggerFactory.getLogger(SecretsLoader.class);

    private final ObjectMapper objectMapper = new ObjectMapper();

    public Secrets load(Path path) {
        if (!Files.exists(path)) {
            throw new ConfigurationException("Secrets file not found: " + path);
        }
        try (InputStream is = Files.newInputStream(path)) {
            Map<String, String> values = objectMapper.readValue(is, new TypeReference<Map<String, String>>() {});
            log.info("Loaded {} secrets from {}", values.size(), path);
            return new Secrets(values);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read secrets from: " + path, e);
        }
    }

    /**
     * Loaded secret values. Never logged.
     */
    public static final class Secrets {

        private static final Secrets EMPTY = new Secrets(Map.of());

        private final Map<String, String> values;

        Secrets(Map<String, String> values) {
            Map<String, String> copy = new HashMap<>();
            values.forEach((name, value) -> {
                if (value != null) {
                    copy.put(name, value);
                }
            });
            this.values = Map.copyOf(copy);
        }

        public static Secrets empty() {
            return EMPTY;
        }

        /**
         * @throws ConfigurationException if the secret is not defined
         */
        public String require(String name) {
            String value = values.get(name);
            if (value == null) {
                throw new ConfigurationException("Secret not defined: " + name);
            }
            return value;
        }

        public boolean contains(String name) {
            return values.containsKey(name);
        }

        public int size() {
            return values.size();
        }

        @Override
        public String toString() {
            return "Secrets{count=" + values.size() + "}";
        }
    }
}

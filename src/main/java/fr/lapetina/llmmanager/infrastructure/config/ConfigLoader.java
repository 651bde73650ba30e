package fr.lapetina.llmmanager.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;

/**
 * Loads the manager configuration from the file system or the classpath.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(ManagerConfig.class, loaderOptions));
    }

    /**
     * Loads configuration, trying the file system first and then the classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading fails
     */
    public ManagerConfig load() {
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private ManagerConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Loads configuration from an input stream.
     */
    public ManagerConfig loadFromStream(InputStream inputStream) {
        return parse(inputStream, "stream");
    }

    private ManagerConfig parse(InputStream is, String source) {
        ManagerConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
        // an empty document yields null
        config = config != null ? config : createDefault();
        validate(config, source);
        return config;
    }

    private void validate(ManagerConfig config, String source) {
        // a section header with no body is set to null by SnakeYAML
        if (config.getInstances() == null) {
            config.setInstances(new ArrayList<>());
        }
        if (config.getDispatch() == null) {
            config.setDispatch(new ManagerConfig.DispatchConfig());
        }
        if (config.getMetrics() == null) {
            config.setMetrics(new ManagerConfig.MetricsConfig());
        }
        if (config.getDispatch().getRole() == null || config.getDispatch().getRole().isBlank()) {
            throw new ConfigurationException("dispatch.role must not be empty in " + source);
        }
        if (config.getMetrics().getPrefix() == null || config.getMetrics().getPrefix().isBlank()) {
            throw new ConfigurationException("metrics.prefix must not be empty in " + source);
        }

        for (ManagerConfig.InstanceConfig instance : config.getInstances()) {
            if (instance == null) {
                throw new ConfigurationException("Empty instance entry in " + source);
            }
            if (instance.getConfig() == null) {
                instance.setConfig(new LinkedHashMap<>());
            }
            if (instance.getId() == null || instance.getId().isBlank()) {
                throw new ConfigurationException("Instance without id in " + source);
            }
            if (instance.getType() == null || instance.getType().isBlank()) {
                throw new ConfigurationException("Instance '" + instance.getId() + "' has no type in " + source);
            }
        }
    }

    public Path getConfigPath() {
        return configPath;
    }

    /**
     * Creates a default configuration.
     */
    public static ManagerConfig createDefault() {
        return new ManagerConfig();
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}

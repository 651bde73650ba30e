package fr.lapetina.llmmanager;

import fr.lapetina.llmmanager.dispatch.DispatchOptions;
import fr.lapetina.llmmanager.dispatch.Dispatcher;
import fr.lapetina.llmmanager.domain.model.BackendConfig;
import fr.lapetina.llmmanager.infrastructure.config.ConfigLoader;
import fr.lapetina.llmmanager.infrastructure.config.ManagerConfig;
import fr.lapetina.llmmanager.infrastructure.http.BackendTypes;
import fr.lapetina.llmmanager.infrastructure.http.HttpChatBackend;
import fr.lapetina.llmmanager.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.llmmanager.infrastructure.secrets.SecretsLoader;
import fr.lapetina.llmmanager.registry.InstanceRegistry;
import fr.lapetina.llmmanager.report.HistoryReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.util.List;
import java.util.function.Consumer;

/**
 * Factory for creating a fully-wired manager from configuration.
 *
 * <p>Usage:
 * <pre>{@code
 * try (ManagerFactory factory = ManagerFactory.create("config.yaml")) {
 *     FanOutResult result = factory.getDispatcher()
 *             .dispatchMany(factory.getConfiguredInstanceIds(), "Hello!", factory.getDispatchOptions())
 *             .join();
 * }
 * }</pre>
 */
public class ManagerFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ManagerFactory.class);

    private final ManagerConfig config;
    private final MetricsRegistry metricsRegistry;
    private final InstanceRegistry instanceRegistry;
    private final Dispatcher dispatcher;
    private final HistoryReporter historyReporter;
    private final List<String> configuredInstanceIds;

    protected ManagerFactory(String configPath, Consumer<InstanceRegistry> extraBackendTypes) {
        log.info("Initializing ManagerFactory from config: {}", configPath);

        // Load configuration
        this.config = new ConfigLoader(configPath).load();

        // Initialize metrics
        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());

        // Initialize registry with the built-in catalog
        this.instanceRegistry = new InstanceRegistry();
        metricsRegistry.bindTo(instanceRegistry);
        BackendTypes.registerBuiltIns(instanceRegistry);
        if (extraBackendTypes != null) {
            extraBackendTypes.accept(instanceRegistry);
        }

        this.dispatcher = new Dispatcher(instanceRegistry, metricsRegistry);
        this.historyReporter = new HistoryReporter(instanceRegistry);

        this.configuredInstanceIds = loadInstances();

        log.info("ManagerFactory initialized: types={}, instances={}",
                instanceRegistry.typeCount(), instanceRegistry.instanceCount());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static ManagerFactory create(String configPath) {
        return new ManagerFactory(configPath, null);
    }

    /**
     * Creates a factory from the default configuration (config.yaml).
     */
    public static ManagerFactory create() {
        return create("config.yaml");
    }

    public ManagerConfig getConfig() {
        return config;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public InstanceRegistry getInstanceRegistry() {
        return instanceRegistry;
    }

    public Dispatcher getDispatcher() {
        return dispatcher;
    }

    public HistoryReporter getHistoryReporter() {
        return historyReporter;
    }

    /**
     * Ids of the instances declared in configuration, in declaration order.
     */
    public List<String> getConfiguredInstanceIds() {
        return configuredInstanceIds;
    }

    /**
     * Context policy from the {@code dispatch} section.
     */
    public DispatchOptions getDispatchOptions() {
        ManagerConfig.DispatchConfig dispatch = config.getDispatch();
        return DispatchOptions.builder()
                .role(dispatch.getRole())
                .saveContext(dispatch.isSaveContext())
                .appendPromptBeforeCall(dispatch.isAppendPromptBeforeCall())
                .build();
    }

    private List<String> loadInstances() {
        SecretsLoader.Secrets secrets = config.getSecretsFile() != null
                ? new SecretsLoader().load(Paths.get(config.getSecretsFile()))
                : SecretsLoader.Secrets.empty();

        for (ManagerConfig.InstanceConfig instanceConfig : config.getInstances()) {
            BackendConfig backendConfig = BackendConfig.of(instanceConfig.getConfig());
            if (instanceConfig.getApiKeySecret() != null) {
                backendConfig.set(HttpChatBackend.API_KEY, secrets.require(instanceConfig.getApiKeySecret()));
            }
            instanceRegistry.instantiate(instanceConfig.getId(), instanceConfig.getType(), backendConfig);
            log.debug("Configured instance loaded: instanceId={}, type={}, config={}",
                    instanceConfig.getId(), instanceConfig.getType(), backendConfig);
        }

        return config.getInstances().stream()
                .map(ManagerConfig.InstanceConfig::getId)
                .toList();
    }

    @Override
    public void close() {
        log.info("Shutting down ManagerFactory...");

        instanceRegistry.clear();

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("ManagerFactory shut down");
    }
}

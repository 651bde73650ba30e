package fr.lapetina.llmmanager.registry;

import fr.lapetina.llmmanager.domain.backend.Backend;
import fr.lapetina.llmmanager.domain.backend.BackendFactory;
import fr.lapetina.llmmanager.domain.exception.DuplicateBackendTypeException;
import fr.lapetina.llmmanager.domain.exception.DuplicateInstanceException;
import fr.lapetina.llmmanager.domain.exception.InstanceNotFoundException;
import fr.lapetina.llmmanager.domain.exception.UnknownBackendTypeException;
import fr.lapetina.llmmanager.domain.model.BackendConfig;
import fr.lapetina.llmmanager.domain.model.ModelInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Catalog of instantiable backend types and map of live model instances.
 *
 * Thread-safe. Instance ids are unique among live instances; an id becomes
 * available again once the instance holding it has been removed.
 * Listing methods return snapshots, so later mutations never show up in a
 * list already handed out.
 */
public final class InstanceRegistry {

    private static final Logger log = LoggerFactory.getLogger(InstanceRegistry.class);

    private final Map<String, BackendFactory> catalog = new ConcurrentHashMap<>();
    private final Map<String, ModelInstance> instances = new ConcurrentHashMap<>();
    private final List<Consumer<RegistryEvent>> listeners = new CopyOnWriteArrayList<>();

    /**
     * Adds a backend type to the catalog.
     *
     * @throws DuplicateBackendTypeException if the name is already registered
     */
    public void registerBackendType(String typeName, BackendFactory factory) {
        Objects.requireNonNull(typeName, "Type name is required");
        Objects.requireNonNull(factory, "Backend factory is required");

        if (catalog.putIfAbsent(typeName, factory) != null) {
            throw new DuplicateBackendTypeException(typeName);
        }
        log.info("Backend type registered: type={}", typeName);
        notifyListeners(new RegistryEvent(RegistryEvent.Type.TYPE_REGISTERED, typeName));
    }

    /**
     * Builds a backend of the given type and stores it as a new instance with empty context.
     *
     * @throws UnknownBackendTypeException if the type is not in the catalog
     * @throws DuplicateInstanceException  if the id is already live
     */
    public ModelInstance instantiate(String instanceId, String typeName, BackendConfig config) {
        Objects.requireNonNull(instanceId, "Instance ID is required");
        Objects.requireNonNull(typeName, "Type name is required");

        BackendFactory factory = catalog.get(typeName);
        if (factory == null) {
            throw new UnknownBackendTypeException(typeName);
        }
        if (instances.containsKey(instanceId)) {
            throw new DuplicateInstanceException(instanceId);
        }

        BackendConfig instanceConfig = config != null ? config : BackendConfig.empty();
        Backend backend = factory.create(instanceConfig);
        ModelInstance instance = new ModelInstance(instanceId, typeName, instanceConfig, backend);

        // a concurrent instantiate may have claimed the id while the backend was built
        if (instances.putIfAbsent(instanceId, instance) != null) {
            throw new DuplicateInstanceException(instanceId);
        }

        log.info("Instance created: instanceId={}, type={}", instanceId, typeName);
        notifyListeners(new RegistryEvent(RegistryEvent.Type.INSTANCE_ADDED, instanceId));
        return instance;
    }

    /**
     * Clears the instance's context and releases its id. No-op when the id is absent.
     *
     * @return true if an instance was removed
     */
    public boolean remove(String instanceId) {
        if (instanceId == null) {
            return false;
        }
        ModelInstance removed = instances.remove(instanceId);
        if (removed == null) {
            log.debug("Remove ignored, instance not found: instanceId={}", instanceId);
            return false;
        }
        removed.resetContext();
        log.info("Instance removed: instanceId={}", instanceId);
        notifyListeners(new RegistryEvent(RegistryEvent.Type.INSTANCE_REMOVED, instanceId));
        return true;
    }

    /**
     * Returns the live instance for an id.
     *
     * @throws InstanceNotFoundException if no live instance holds the id
     */
    public ModelInstance resolve(String instanceId) {
        return find(instanceId).orElseThrow(() -> new InstanceNotFoundException(instanceId));
    }

    public Optional<ModelInstance> find(String instanceId) {
        if (instanceId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(instances.get(instanceId));
    }

    public boolean hasBackendType(String typeName) {
        return typeName != null && catalog.containsKey(typeName);
    }

    /**
     * Returns a snapshot of the registered backend type names.
     */
    public List<String> listTypes() {
        return new ArrayList<>(catalog.keySet());
    }

    /**
     * Returns a snapshot of the live instance ids.
     */
    public List<String> listInstances() {
        return new ArrayList<>(instances.keySet());
    }

    public int instanceCount() {
        return instances.size();
    }

    public int typeCount() {
        return catalog.size();
    }

    /**
     * Removes every live instance.
     */
    public void clear() {
        for (String instanceId : listInstances()) {
            remove(instanceId);
        }
    }

    /**
     * Adds a listener for registry events.
     */
    public void addListener(Consumer<RegistryEvent> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<RegistryEvent> listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(RegistryEvent event) {
        for (Consumer<RegistryEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.error("Error notifying registry listener: event={}", event, e);
            }
        }
    }

    /**
     * Event for catalog and instance changes.
     *
     * @param type kind of change
     * @param name backend type name or instance id
     */
    public record RegistryEvent(Type type, String name) {
        public enum Type {
            TYPE_REGISTERED,
            INSTANCE_ADDED,
            INSTANCE_REMOVED
        }
    }
}

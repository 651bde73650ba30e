package fr.lapetina.llmmanager.domain.model;

import fr.lapetina.llmmanager.domain.backend.Backend;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A live, named binding of a backend, its configuration and its conversation history.
 *
 * The live context is never handed out: readers receive copies, and every
 * append happens under the instance monitor so that a prompt/response pair
 * stays adjacent even when several rounds complete on different threads.
 */
public final class ModelInstance {

    private final String id;
    private final String typeName;
    private final BackendConfig config;
    private final Backend backend;
    private final List<Message> context = new ArrayList<>();

    public ModelInstance(String id, String typeName, BackendConfig config, Backend backend) {
        this.id = Objects.requireNonNull(id, "Instance ID is required");
        this.typeName = Objects.requireNonNull(typeName, "Type name is required");
        this.config = config != null ? config : BackendConfig.empty();
        this.backend = Objects.requireNonNull(backend, "Backend is required");
    }

    public String getId() {
        return id;
    }

    public String getTypeName() {
        return typeName;
    }

    public BackendConfig getConfig() {
        return config;
    }

    public Backend getBackend() {
        return backend;
    }

    /**
     * Returns a point-in-time copy of the conversation history.
     */
    public synchronized List<Message> snapshotContext() {
        return new ArrayList<>(context);
    }

    public synchronized int contextSize() {
        return context.size();
    }

    public synchronized void append(Message message) {
        context.add(Objects.requireNonNull(message, "Message is required"));
    }

    /**
     * Appends the messages of one completed round as a single atomic step.
     */
    public synchronized void appendAll(List<Message> messages) {
        for (Message message : messages) {
            context.add(Objects.requireNonNull(message, "Message is required"));
        }
    }

    public synchronized void resetContext() {
        context.clear();
    }

    public void updateConfig(Map<String, ?> values) {
        config.update(values);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ModelInstance that = (ModelInstance) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ModelInstance{" +
                "id='" + id + '\'' +
                ", type=" + typeName +
                ", contextSize=" + contextSize() +
                '}';
    }
}

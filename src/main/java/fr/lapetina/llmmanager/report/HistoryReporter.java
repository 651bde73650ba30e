package fr.lapetina.llmmanager.report;

import fr.lapetina.llmmanager.domain.exception.InstanceNotFoundException;
import fr.lapetina.llmmanager.domain.model.Message;
import fr.lapetina.llmmanager.domain.model.ModelInstance;
import fr.lapetina.llmmanager.registry.InstanceRegistry;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only view of instance conversation histories.
 *
 * {@link #renderAll()} walks the live ids one by one without isolating
 * itself from concurrent removals: an instance removed mid-walk is skipped.
 */
public final class HistoryReporter {

    private final InstanceRegistry registry;

    public HistoryReporter(InstanceRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "InstanceRegistry is required");
    }

    /**
     * Returns the instance's history in context order with uppercased roles.
     *
     * @throws InstanceNotFoundException if the id is not live
     */
    public List<HistoryLine> render(String instanceId) {
        return render(registry.resolve(instanceId));
    }

    /**
     * Renders every live instance, keyed by id.
     */
    public Map<String, List<HistoryLine>> renderAll() {
        Map<String, List<HistoryLine>> histories = new LinkedHashMap<>();
        for (String instanceId : registry.listInstances()) {
            registry.find(instanceId).ifPresent(instance -> histories.put(instanceId, render(instance)));
        }
        return histories;
    }

    /**
     * Formats one history as a readable dialogue.
     *
     * @throws InstanceNotFoundException if the id is not live
     */
    public String formatTranscript(String instanceId) {
        return formatTranscript(instanceId, render(instanceId));
    }

    /**
     * Formats every live history, separated by blank lines.
     */
    public String formatAllTranscripts() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, List<HistoryLine>> entry : renderAll().entrySet()) {
            sb.append(formatTranscript(entry.getKey(), entry.getValue())).append(System.lineSeparator());
        }
        return sb.toString();
    }

    private List<HistoryLine> render(ModelInstance instance) {
        return instance.snapshotContext().stream()
                .map(HistoryLine::of)
                .toList();
    }

    private String formatTranscript(String instanceId, List<HistoryLine> lines) {
        String nl = System.lineSeparator();
        StringBuilder sb = new StringBuilder();
        sb.append("--- CONVERSATION HISTORY FOR '").append(instanceId).append("' ---").append(nl);
        for (HistoryLine line : lines) {
            sb.append(line.role()).append(": ").append(line.content()).append(nl);
        }
        sb.append("--- END CONVERSATION ---").append(nl);
        return sb.toString();
    }

    /**
     * One rendered history entry.
     *
     * @param role    uppercased message role
     * @param content message text
     */
    public record HistoryLine(String role, String content) {
        static HistoryLine of(Message message) {
            return new HistoryLine(message.role().toUpperCase(Locale.ROOT), message.content());
        }
    }
}

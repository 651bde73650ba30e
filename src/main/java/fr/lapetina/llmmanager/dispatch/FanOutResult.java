package fr.lapetina.llmmanager.dispatch;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Settled outcomes of a fan-out round, one per requested id, in request order.
 *
 * A duplicated id yields one entry per occurrence in {@link #results()};
 * keyed views keep the entry of its last occurrence.
 */
public record FanOutResult(List<DispatchResult> results) {

    public FanOutResult {
        results = results != null ? List.copyOf(results) : List.of();
    }

    public Optional<DispatchResult> get(String instanceId) {
        DispatchResult found = null;
        for (DispatchResult result : results) {
            if (result.instanceId().equals(instanceId)) {
                found = result;
            }
        }
        return Optional.ofNullable(found);
    }

    /**
     * Keyed view in request order.
     */
    public Map<String, DispatchResult> asMap() {
        Map<String, DispatchResult> map = new LinkedHashMap<>();
        for (DispatchResult result : results) {
            map.put(result.instanceId(), result);
        }
        return map;
    }

    /**
     * Keyed view of response texts, failures rendered as {@code "ERROR: <detail>"}.
     */
    public Map<String, String> asDisplayMap() {
        Map<String, String> map = new LinkedHashMap<>();
        for (DispatchResult result : results) {
            map.put(result.instanceId(), result.toDisplayString());
        }
        return map;
    }

    public List<DispatchResult> successes() {
        return results.stream().filter(DispatchResult::isSuccess).toList();
    }

    public List<DispatchResult> failures() {
        return results.stream().filter(DispatchResult::isError).toList();
    }

    public boolean allSucceeded() {
        return results.stream().allMatch(DispatchResult::isSuccess);
    }

    public int size() {
        return results.size();
    }
}

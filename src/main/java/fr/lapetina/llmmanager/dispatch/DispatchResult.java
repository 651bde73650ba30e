package fr.lapetina.llmmanager.dispatch;

import fr.lapetina.llmmanager.domain.model.ErrorType;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of one target within a fan-out round: either the response text
 * or a failure marker carrying the error detail.
 * Immutable and thread-safe.
 */
public record DispatchResult(
        String instanceId,
        String response,
        ErrorType errorType,
        String errorMessage,
        Duration latency
) {
    public DispatchResult {
        Objects.requireNonNull(instanceId, "Instance ID is required");
        if (latency == null) {
            latency = Duration.ZERO;
        }
    }

    public boolean isSuccess() {
        return errorType == null;
    }

    public boolean isError() {
        return errorType != null;
    }

    /**
     * Response text, or {@code "ERROR: <detail>"} for a failure.
     */
    public String toDisplayString() {
        return isSuccess() ? response : "ERROR: " + errorMessage;
    }

    public static DispatchResult success(String instanceId, String response, Duration latency) {
        return new DispatchResult(instanceId, response, null, null, latency);
    }

    public static DispatchResult failure(
            String instanceId,
            ErrorType errorType,
            String errorMessage,
            Duration latency
    ) {
        return new DispatchResult(
                instanceId, null, Objects.requireNonNull(errorType, "Error type is required"),
                errorMessage, latency
        );
    }
}

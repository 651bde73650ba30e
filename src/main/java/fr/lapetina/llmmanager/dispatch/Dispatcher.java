package fr.lapetina.llmmanager.dispatch;

import fr.lapetina.llmmanager.domain.backend.BackendException;
import fr.lapetina.llmmanager.domain.exception.InstanceNotFoundException;
import fr.lapetina.llmmanager.domain.model.ErrorType;
import fr.lapetina.llmmanager.domain.model.Message;
import fr.lapetina.llmmanager.domain.model.ModelInstance;
import fr.lapetina.llmmanager.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.llmmanager.registry.InstanceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Executes prompt rounds against one or many model instances.
 *
 * A round is strictly sequential for its own target: resolve the instance,
 * copy its context, call the backend, then update the live context. The
 * backend call is the only point where a round waits; everything else runs
 * on the calling thread or on the thread completing the backend future.
 *
 * Fan-out rounds launch every target independently and join on all of them.
 * A failing target becomes a failure entry in the {@link FanOutResult}; it
 * never cancels or delays its siblings.
 *
 * Two rounds running at the same time against the same instance may
 * interleave their appended messages in either order. Each round's
 * messages are appended as one atomic step, so a prompt always stays
 * directly before its response.
 */
public final class Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final InstanceRegistry registry;
    private final MetricsRegistry metricsRegistry;

    public Dispatcher(InstanceRegistry registry, MetricsRegistry metricsRegistry) {
        this.registry = Objects.requireNonNull(registry, "InstanceRegistry is required");
        this.metricsRegistry = Objects.requireNonNull(metricsRegistry, "MetricsRegistry is required");
    }

    public CompletableFuture<String> dispatchOne(String instanceId, String prompt) {
        return dispatchOne(instanceId, prompt, DispatchOptions.defaults());
    }

    /**
     * Sends a prompt to a single instance.
     *
     * @return future completing with the response text, or exceptionally with
     *         {@link BackendException} if the backend failed; the live context
     *         is untouched on failure
     * @throws InstanceNotFoundException if the id is not live
     */
    public CompletableFuture<String> dispatchOne(String instanceId, String prompt, DispatchOptions options) {
        Objects.requireNonNull(prompt, "Prompt is required");
        Objects.requireNonNull(options, "Dispatch options are required");

        ModelInstance instance = registry.resolve(instanceId);
        Message promptMessage = new Message(options.role(), prompt);

        List<Message> workingContext = instance.snapshotContext();
        if (options.appendPromptBeforeCall()) {
            workingContext.add(promptMessage);
        }

        log.debug("Dispatching prompt: instanceId={}, type={}, contextSize={}, saveContext={}, appendPrompt={}",
                instanceId, instance.getTypeName(), workingContext.size(),
                options.saveContext(), options.appendPromptBeforeCall());

        Instant startTime = Instant.now();
        CompletableFuture<String> result = new CompletableFuture<>();

        invokeBackend(instance, Collections.unmodifiableList(workingContext))
                .whenComplete((response, throwable) -> {
                    Duration latency = Duration.between(startTime, Instant.now());
                    try {
                        if (throwable != null) {
                            result.completeExceptionally(handleError(instance, throwable, latency));
                        } else if (response == null) {
                            result.completeExceptionally(handleError(
                                    instance, new BackendException("Backend returned no response"), latency));
                        } else {
                            handleSuccess(instance, promptMessage, response, options, latency);
                            result.complete(response);
                        }
                    } catch (RuntimeException e) {
                        log.error("Failed to settle dispatch: instanceId={}", instanceId, e);
                        result.completeExceptionally(e);
                    }
                });

        return result;
    }

    public CompletableFuture<FanOutResult> dispatchMany(List<String> instanceIds, String prompt) {
        return dispatchMany(instanceIds, prompt, DispatchOptions.defaults());
    }

    /**
     * Sends the same prompt to every listed instance concurrently.
     *
     * The returned future completes once every target has settled and never
     * completes exceptionally. Duplicate ids are dispatched once per occurrence.
     */
    public CompletableFuture<FanOutResult> dispatchMany(
            List<String> instanceIds,
            String prompt,
            DispatchOptions options
    ) {
        Objects.requireNonNull(instanceIds, "Instance IDs are required");
        Objects.requireNonNull(prompt, "Prompt is required");
        Objects.requireNonNull(options, "Dispatch options are required");

        log.info("Fanning out prompt: targets={}", instanceIds.size());

        List<CompletableFuture<DispatchResult>> futures = new ArrayList<>(instanceIds.size());
        for (String instanceId : instanceIds) {
            futures.add(dispatchIsolated(instanceId, prompt, options));
        }

        return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> {
                    List<DispatchResult> results = futures.stream()
                            .map(CompletableFuture::join)
                            .toList();
                    FanOutResult fanOut = new FanOutResult(results);
                    log.info("Fan-out settled: targets={}, succeeded={}, failed={}",
                            fanOut.size(), fanOut.successes().size(), fanOut.failures().size());
                    return fanOut;
                });
    }

    private CompletableFuture<DispatchResult> dispatchIsolated(
            String instanceId,
            String prompt,
            DispatchOptions options
    ) {
        Instant startTime = Instant.now();
        CompletableFuture<String> call;
        try {
            call = dispatchOne(instanceId, prompt, options);
        } catch (InstanceNotFoundException e) {
            log.warn("Fan-out target not found: instanceId={}", instanceId);
            metricsRegistry.incrementNotFoundCount();
            return CompletableFuture.completedFuture(DispatchResult.failure(
                    String.valueOf(instanceId), ErrorType.INSTANCE_NOT_FOUND, e.getMessage(), Duration.ZERO));
        } catch (RuntimeException e) {
            log.error("Fan-out target could not be dispatched: instanceId={}", instanceId, e);
            return CompletableFuture.completedFuture(DispatchResult.failure(
                    String.valueOf(instanceId), ErrorType.INTERNAL_ERROR, describe(e), Duration.ZERO));
        }

        return call.handle((response, throwable) -> {
            Duration latency = Duration.between(startTime, Instant.now());
            if (throwable == null) {
                return DispatchResult.success(instanceId, response, latency);
            }
            Throwable cause = unwrap(throwable);
            ErrorType errorType = cause instanceof BackendException
                    ? ErrorType.BACKEND_ERROR
                    : ErrorType.INTERNAL_ERROR;
            return DispatchResult.failure(instanceId, errorType, describe(cause), latency);
        });
    }

    private CompletableFuture<String> invokeBackend(ModelInstance instance, List<Message> workingContext) {
        try {
            CompletableFuture<String> future = instance.getBackend().generate(workingContext);
            if (future == null) {
                return CompletableFuture.failedFuture(new BackendException("Backend returned no future"));
            }
            return future;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void handleSuccess(
            ModelInstance instance,
            Message promptMessage,
            String response,
            DispatchOptions options,
            Duration latency
    ) {
        if (options.saveContext()) {
            List<Message> round = new ArrayList<>(2);
            if (options.appendPromptBeforeCall()) {
                round.add(promptMessage);
            }
            round.add(Message.assistant(response));
            instance.appendAll(round);
        }

        metricsRegistry.recordDispatch(
                instance.getId(), instance.getTypeName(), MetricsRegistry.OUTCOME_SUCCESS, latency);

        log.info("Dispatch completed: instanceId={}, type={}, latencyMs={}, contextSize={}",
                instance.getId(), instance.getTypeName(), latency.toMillis(), instance.contextSize());
    }

    private BackendException handleError(ModelInstance instance, Throwable throwable, Duration latency) {
        Throwable cause = unwrap(throwable);
        BackendException error = cause instanceof BackendException
                ? (BackendException) cause
                : new BackendException(describe(cause), cause);

        metricsRegistry.recordDispatch(
                instance.getId(), instance.getTypeName(), MetricsRegistry.OUTCOME_FAILURE, latency);
        metricsRegistry.incrementErrorCount(instance.getId(), instance.getTypeName(), ErrorType.BACKEND_ERROR);

        log.warn("Dispatch failed: instanceId={}, type={}, latencyMs={}, error={}",
                instance.getId(), instance.getTypeName(), latency.toMillis(), error.getMessage());
        return error;
    }

    private static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable throwable) {
        String message = throwable.getMessage();
        return message != null ? message : throwable.getClass().getSimpleName();
    }
}

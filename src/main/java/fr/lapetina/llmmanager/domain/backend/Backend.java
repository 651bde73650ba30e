package fr.lapetina.llmmanager.domain.backend;

import fr.lapetina.llmmanager.domain.model.Message;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Capability implemented once per remote conversational-model API.
 *
 * Implementations must be thread-safe: the same backend may serve several
 * rounds at once when its instance is targeted concurrently.
 */
public interface Backend {

    /**
     * Generates a response for the given conversation.
     *
     * @param messages ordered conversation, owned by the caller for the duration of the call
     * @return future completing with the response text, or exceptionally with
     *         {@link BackendException} when the remote call fails
     */
    CompletableFuture<String> generate(List<Message> messages);
}

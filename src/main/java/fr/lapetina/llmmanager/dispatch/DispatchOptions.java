package fr.lapetina.llmmanager.dispatch;

import fr.lapetina.llmmanager.domain.model.Message;

import java.util.Objects;

/**
 * Context policy applied to one prompt round.
 *
 * @param role                   role recorded for the prompt message
 * @param saveContext            record the round in the instance's live context
 * @param appendPromptBeforeCall include the prompt in the context sent to the backend;
 *                               the prompt is only saved when this and {@code saveContext} are both set
 */
public record DispatchOptions(
        String role,
        boolean saveContext,
        boolean appendPromptBeforeCall
) {
    private static final DispatchOptions DEFAULTS = new DispatchOptions(Message.USER, false, false);

    public DispatchOptions {
        Objects.requireNonNull(role, "Role is required");
    }

    /**
     * Role "user", nothing appended, nothing saved.
     */
    public static DispatchOptions defaults() {
        return DEFAULTS;
    }

    /**
     * Sends the prompt and records both prompt and response.
     */
    public static DispatchOptions conversational() {
        return new DispatchOptions(Message.USER, true, true);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String role = Message.USER;
        private boolean saveContext;
        private boolean appendPromptBeforeCall;

        public Builder role(String role) {
            this.role = role;
            return this;
        }

        public Builder saveContext(boolean saveContext) {
            this.saveContext = saveContext;
            return this;
        }

        public Builder appendPromptBeforeCall(boolean appendPromptBeforeCall) {
            this.appendPromptBeforeCall = appendPromptBeforeCall;
            return this;
        }

        public DispatchOptions build() {
            return new DispatchOptions(role, saveContext, appendPromptBeforeCall);
        }
    }
}

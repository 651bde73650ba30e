package fr.lapetina.llmmanager.domain.model;

import java.util.Objects;

/**
 * A single conversational message.
 * Immutable and thread-safe.
 *
 * @param role    free-form sender tag, e.g. "user", "assistant", "system"
 * @param content message text
 */
public record Message(String role, String content) {

    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";
    public static final String SYSTEM = "system";

    public Message {
        Objects.requireNonNull(role, "Role is required");
        Objects.requireNonNull(content, "Content is required");
    }

    public static Message user(String content) {
        return new Message(USER, content);
    }

    public static Message assistant(String content) {
        return new Message(ASSISTANT, content);
    }

    public static Message system(String content) {
        return new Message(SYSTEM, content);
    }
}

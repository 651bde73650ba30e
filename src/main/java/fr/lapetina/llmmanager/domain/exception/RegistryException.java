package fr.lapetina.llmmanager.domain.exception;

/**
 * Base class for caller-input errors raised by the instance registry.
 *
 * These are never retried and abort only the call that raised them.
 */
public abstract class RegistryException extends RuntimeException {

    private final String subject;

    protected RegistryException(String message, String subject) {
        super(message);
        this.subject = subject;
    }

    /**
     * The backend type name or instance id the error is about.
     */
    public String getSubject() {
        return subject;
    }
}

package fr.lapetina.llmmanager.domain.exception;

/**
 * Thrown when an instance id is already held by a live instance.
 */
public final class DuplicateInstanceException extends RegistryException {

    public DuplicateInstanceException(String instanceId) {
        super("Instance id already exists: " + instanceId, instanceId);
    }
}

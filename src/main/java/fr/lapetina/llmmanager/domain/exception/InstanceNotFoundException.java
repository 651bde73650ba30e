package fr.lapetina.llmmanager.domain.exception;

/**
 * Thrown when an operation targets an instance id that is not live.
 */
public final class InstanceNotFoundException extends RegistryException {

    public InstanceNotFoundException(String instanceId) {
        super("Instance not found: " + instanceId, instanceId);
    }
}

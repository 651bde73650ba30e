package fr.lapetina.llmmanager.domain.exception;

/**
 * Thrown when a backend type name is registered twice.
 */
public final class DuplicateBackendTypeException extends RegistryException {

    public DuplicateBackendTypeException(String typeName) {
        super("Backend type already registered: " + typeName, typeName);
    }
}

package fr.lapetina.llmmanager.domain.exception;

/**
 * Thrown when instantiating a backend type that is not in the catalog.
 */
public final class UnknownBackendTypeException extends RegistryException {

    public UnknownBackendTypeException(String typeName) {
        super("Backend type is not registered: " + typeName, typeName);
    }
}

package fr.lapetina.llmmanager.domain.model;

/**
 * Error taxonomy for dispatch outcomes.
 * Used to categorize fan-out failures and for metrics.
 */
public enum ErrorType {
    /** The requested instance id is not live in the registry */
    INSTANCE_NOT_FOUND,

    /** The backend failed to produce a response (network, HTTP status, payload) */
    BACKEND_ERROR,

    /** Unexpected failure outside the backend contract */
    INTERNAL_ERROR
}

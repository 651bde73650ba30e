package fr.lapetina.llmmanager.domain.backend;

/**
 * Failure of a backend call: network error, non-2xx status or malformed payload.
 */
public class BackendException extends RuntimeException {

    private final int statusCode;

    public BackendException(String message) {
        this(message, -1, null);
    }

    public BackendException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public BackendException(String message, int statusCode) {
        this(message, statusCode, null);
    }

    public BackendException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status returned by the remote API, or -1 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }

    public boolean hasStatusCode() {
        return statusCode >= 0;
    }
}

package io.quorumesh.error;

/**
 * Malformed envelope, payload or request. Rejected before persistence and never retried.
 */
public final class ValidationException extends QuorumMeshException {
    public ValidationException(String message) {
        super("validation", message);
    }

    public ValidationException(String message, Throwable cause) {
        super("validation", message, cause);
    }
}

package io.quorumesh.error;

/**
 * Root of the domain error taxonomy. Storage and I/O failures stay plain {@link RuntimeException}s.
 */
public abstract class QuorumMeshException extends RuntimeException {
    private final String code;

    protected QuorumMeshException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected QuorumMeshException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}

package io.quorumesh.error;

/**
 * Publish or delivery failure. Retry with the unchanged idempotency key.
 */
public final class TransportException extends QuorumMeshException {
    private final String topic;

    public TransportException(String topic, String message, Throwable cause) {
        super("transport", message, cause);
        this.topic = topic;
    }

    public String topic() {
        return topic;
    }
}

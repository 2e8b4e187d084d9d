package io.quorumesh.bus;

/**
 * At-least-once publish side of the pub/sub transport.
 */
public interface EnvelopeTransport {
    /**
     * Publishes one record. Throws {@link io.quorumesh.error.TransportException} when the record was not
     * acknowledged; the caller retries with the same payload and idempotency key.
     */
    void produce(String topic, String key, String payload);
}

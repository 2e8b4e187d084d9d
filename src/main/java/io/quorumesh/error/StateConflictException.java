package io.quorumesh.error;

/**
 * Optimistic compare-and-set mismatch. The caller re-reads and decides between retrying and treating the
 * change as already applied.
 */
public final class StateConflictException extends QuorumMeshException {
    private final String expected;
    private final String actual;

    public StateConflictException(String message, String expected, String actual) {
        super("state_conflict", message);
        this.expected = expected;
        this.actual = actual;
    }

    public String expected() {
        return expected;
    }

    public String actual() {
        return actual;
    }
}

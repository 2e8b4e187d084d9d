package io.quorumesh.model;

import io.quorumesh.error.ValidationException;

import java.time.Duration;

public record VotingPolicy(
        boolean enabled,
        int minPoolSize,
        int quorumYes,
        int quorumNo,
        Duration timeout,
        boolean allowSelfVote
) {
    public static final int DEFAULT_MIN_POOL_SIZE = 3;
    public static final int DEFAULT_QUORUM_YES = 2;
    public static final int DEFAULT_QUORUM_NO = 2;
    public static final long DEFAULT_TIMEOUT_SEC = 3_600L;

    public static VotingPolicy defaults() {
        return new VotingPolicy(true, DEFAULT_MIN_POOL_SIZE, DEFAULT_QUORUM_YES, DEFAULT_QUORUM_NO,
                Duration.ofSeconds(DEFAULT_TIMEOUT_SEC), false);
    }

    public void validate() {
        if (minPoolSize <= 0) {
            throw new ValidationException("min pool size must be > 0");
        }
        if (quorumYes <= 0 || quorumNo <= 0) {
            throw new ValidationException("quorum yes/no must be > 0");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new ValidationException("timeout must be > 0");
        }
    }
}

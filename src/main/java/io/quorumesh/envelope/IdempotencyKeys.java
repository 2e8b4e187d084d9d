package io.quorumesh.envelope;

/**
 * Stable keys for logical actions. Retries of the same action must reuse the same key.
 */
public final class IdempotencyKeys {
    private static final String PREFIX = "knowledge:";

    private IdempotencyKeys() {
    }

    public static String proposal(String proposalId) {
        return PREFIX + "proposal:" + proposalId;
    }

    public static String vote(String proposalId, String voterId) {
        return PREFIX + "vote:" + proposalId + ":" + voterId;
    }

    public static String decision(String proposalId) {
        return PREFIX + "decision:" + proposalId;
    }

    public static String fact(String factId, int version, String source) {
        return PREFIX + "fact:" + factId + ":v" + version + ":" + source;
    }

    public static String presence(String memberId, long epochMs) {
        return PREFIX + "presence:" + memberId + ":" + epochMs;
    }

    public static String capabilities(String memberId, long epochMs) {
        return PREFIX + "capabilities:" + memberId + ":" + epochMs;
    }
}

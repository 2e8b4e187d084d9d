package io.quorumesh.observability;

import java.security.SecureRandom;
import java.util.HexFormat;

public final class TraceContextUtil {
    private static final SecureRandom RANDOM = new SecureRandom();

    private TraceContextUtil() {
    }

    public static String newTraceId() {
        return randomHex(16); // 32 hex chars
    }

    /**
     * Uses the caller's trace id when present so retries and replies stay on one trace.
     */
    public static String traceIdOrNew(String traceId) {
        return traceId == null || traceId.isBlank() ? newTraceId() : traceId.trim();
    }

    private static String randomHex(int bytes) {
        byte[] value = new byte[bytes];
        RANDOM.nextBytes(value);
        return HexFormat.of().formatHex(value);
    }
}

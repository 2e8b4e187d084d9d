package io.quorumesh.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

public enum CascadeStatus {
    PENDING("pending"),
    RUNNING("running"),
    SELF_TEST("self_test"),
    VALIDATED("validated"),
    COMMITTED("committed"),
    RELEASED_NEXT("released_next"),
    FAILED("failed");

    private static final Map<CascadeStatus, Set<CascadeStatus>> TRANSITIONS = buildTransitions();

    private final String wire;

    CascadeStatus(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    public boolean isTerminal() {
        return this == RELEASED_NEXT || this == FAILED;
    }

    /**
     * Whether a task in this stage unlocks the next sequence of its trace.
     */
    public boolean isCommittedOrReleased() {
        return this == COMMITTED || this == RELEASED_NEXT;
    }

    public boolean canTransitionTo(CascadeStatus to) {
        return to != null && TRANSITIONS.get(this).contains(to);
    }

    public static CascadeStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Cascade status must not be blank");
        }
        String value = raw.trim();
        for (CascadeStatus status : values()) {
            if (status.wire.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown cascade status: " + raw);
    }

    private static Map<CascadeStatus, Set<CascadeStatus>> buildTransitions() {
        Map<CascadeStatus, Set<CascadeStatus>> table = new EnumMap<>(CascadeStatus.class);
        table.put(PENDING, Collections.unmodifiableSet(EnumSet.of(RUNNING, FAILED)));
        table.put(RUNNING, Collections.unmodifiableSet(EnumSet.of(SELF_TEST, FAILED)));
        table.put(SELF_TEST, Collections.unmodifiableSet(EnumSet.of(VALIDATED, PENDING, FAILED)));
        table.put(VALIDATED, Collections.unmodifiableSet(EnumSet.of(COMMITTED, FAILED)));
        table.put(COMMITTED, Collections.unmodifiableSet(EnumSet.of(RELEASED_NEXT, FAILED)));
        table.put(RELEASED_NEXT, Collections.unmodifiableSet(EnumSet.noneOf(CascadeStatus.class)));
        table.put(FAILED, Collections.unmodifiableSet(EnumSet.noneOf(CascadeStatus.class)));
        return Collections.unmodifiableMap(table);
    }
}

package io.quorumesh.model;

import java.util.List;

public record GroupMember(
        String group,
        String memberId,
        String instanceId,
        String status,
        List<String> capabilities,
        long lastSeenAtMs
) {
    public static final String STATUS_ACTIVE = "active";
    public static final String STATUS_INACTIVE = "inactive";

    public GroupMember {
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
    }

    public boolean active() {
        return STATUS_ACTIVE.equalsIgnoreCase(status);
    }
}

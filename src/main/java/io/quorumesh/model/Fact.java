package io.quorumesh.model;

import java.util.List;

public record Fact(
        String factId,
        String group,
        String subject,
        String predicate,
        String object,
        int version,
        String source,
        String proposalId,
        List<String> tags,
        long createdAtMs
) {
    public Fact {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}

package io.quorumesh.envelope;

import java.util.List;

/**
 * Topic names for one group: {@code {group}.knowledge.{suffix}}.
 */
public record KnowledgeTopics(
        String proposals,
        String votes,
        String decisions,
        String facts,
        String presence,
        String capabilities
) {
    public static KnowledgeTopics forGroup(String group) {
        if (group == null || group.isBlank()) {
            throw new IllegalArgumentException("group must not be blank");
        }
        String g = group.trim();
        return new KnowledgeTopics(
                topic(g, EnvelopeType.PROPOSAL),
                topic(g, EnvelopeType.VOTE),
                topic(g, EnvelopeType.DECISION),
                topic(g, EnvelopeType.FACT),
                topic(g, EnvelopeType.PRESENCE),
                topic(g, EnvelopeType.CAPABILITIES)
        );
    }

    public static String topic(String group, EnvelopeType type) {
        return group.trim() + ".knowledge." + type.topicSuffix();
    }

    public String forType(EnvelopeType type) {
        return switch (type) {
            case PROPOSAL -> proposals;
            case VOTE -> votes;
            case DECISION -> decisions;
            case FACT -> facts;
            case PRESENCE -> presence;
            case CAPABILITIES -> capabilities;
        };
    }

    public List<String> all() {
        return List.of(proposals, votes, decisions, facts, presence, capabilities);
    }
}

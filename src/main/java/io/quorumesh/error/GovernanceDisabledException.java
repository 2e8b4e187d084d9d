package io.quorumesh.error;

public final class GovernanceDisabledException extends QuorumMeshException {
    public GovernanceDisabledException() {
        super("governance_disabled",
                "knowledge governance is disabled; set knowledgeEnabled=true and governanceEnabled=true");
    }
}

package io.quorumesh.model;

public record Decision(ProposalStatus status, int yes, int no, String reason) {

    public static Decision pending(int yes, int no, String reason) {
        return new Decision(ProposalStatus.PENDING, yes, no, reason);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}

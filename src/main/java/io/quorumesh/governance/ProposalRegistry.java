package io.quorumesh.governance;

import io.quorumesh.error.NotFoundException;
import io.quorumesh.error.ValidationException;
import io.quorumesh.model.Proposal;
import io.quorumesh.model.ProposalStatus;
import io.quorumesh.storage.KnowledgeStore;

import java.util.List;
import java.util.UUID;

public final class ProposalRegistry {
    private final KnowledgeStore store;

    public ProposalRegistry(KnowledgeStore store) {
        this.store = store;
    }

    public static String newProposalId() {
        return "kp-" + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }

    /**
     * @throws ValidationException                        if id, group or statement is blank
     * @throws io.quorumesh.error.DuplicateIdException if the id already exists
     */
    public Proposal create(Proposal proposal) {
        if (proposal == null) {
            throw new ValidationException("proposal is required");
        }
        if (isBlank(proposal.proposalId())) {
            throw new ValidationException("proposalId is required");
        }
        if (isBlank(proposal.group())) {
            throw new ValidationException("group is required");
        }
        if (isBlank(proposal.statement())) {
            throw new ValidationException("statement is required");
        }
        if (isBlank(proposal.proposerClawId())) {
            throw new ValidationException("proposer clawId is required");
        }
        store.createProposal(proposal);
        return proposal;
    }

    public Proposal get(String proposalId) {
        if (isBlank(proposalId)) {
            throw new ValidationException("proposalId is required");
        }
        return store.getProposal(proposalId.trim())
                .orElseThrow(() -> new NotFoundException("proposal", proposalId));
    }

    public List<Proposal> list(ProposalStatus status, int limit, int offset) {
        return store.listProposals(status, limit, offset);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

package io.quorumesh.error;

public final class DuplicateIdException extends QuorumMeshException {
    public DuplicateIdException(String resource, String id) {
        super("duplicate_id", resource + " already exists: " + id);
    }
}

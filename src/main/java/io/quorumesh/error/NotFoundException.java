package io.quorumesh.error;

public final class NotFoundException extends QuorumMeshException {
    private final String resource;

    public NotFoundException(String resource, String id) {
        super("not_found", resource + " not found: " + id);
        this.resource = resource;
    }

    public String resource() {
        return resource;
    }
}

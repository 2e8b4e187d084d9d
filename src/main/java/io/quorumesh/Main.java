package io.quorumesh;

import io.quorumesh.cli.QuorumMeshCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = QuorumMeshCommand.newCommandLine().execute(args);
        System.exit(code);
    }
}

package io.quorumbridge;

import io.quorumbridge.cli.QuorumBridgeCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = QuorumBridgeCommand.commandLine().execute(args);
        System.exit(code);
    }
}

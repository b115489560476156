package io.agentrelay;

import io.agentrelay.cli.AgentRelayCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = AgentRelayCommand.newCommandLine().execute(args);
        System.exit(code);
    }
}

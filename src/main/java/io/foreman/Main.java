package io.foreman;

import io.foreman.cli.ForemanCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = ForemanCommand.commandLine().execute(args);
        System.exit(code);
    }
}

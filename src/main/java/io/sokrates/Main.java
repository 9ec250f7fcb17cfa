package io.sokrates;

import io.sokrates.cli.SokratesCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = SokratesCommand.newCommandLine(new SokratesCommand()).execute(args);
        System.exit(code);
    }
}

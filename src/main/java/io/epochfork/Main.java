package io.epochfork;

import io.epochfork.cli.EpochForkCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new EpochForkCommand()).execute(args);
        System.exit(code);
    }
}

package io.walkie;

import io.walkie.cli.WalkieCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new WalkieCommand()).execute(args);
        System.exit(code);
    }
}

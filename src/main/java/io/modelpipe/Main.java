package io.modelpipe;

import io.modelpipe.cli.PipelineCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new PipelineCommand()).execute(args);
        System.exit(code);
    }
}

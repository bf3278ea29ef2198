package dev.macros;

import dev.macros.cli.MacroRunnerCli;
import picocli.CommandLine;

public class Main {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new MacroRunnerCli()).execute(args);
        System.exit(exitCode);
    }
}

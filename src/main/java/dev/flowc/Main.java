package dev.flowc;

import dev.flowc.cli.FlowcCli;
import picocli.CommandLine;

public class Main {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new FlowcCli()).execute(args);
        System.exit(exitCode);
    }
}

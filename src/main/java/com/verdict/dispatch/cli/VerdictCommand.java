package com.verdict.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Verdict.
 */
@Command(
        name = "verdict",
        mixinStandardHelpOptions = true,
        version = "Verdict 0.1.0",
        description = "Runs the example groups registered in the application context",
        subcommands = {
                RunCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class VerdictCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}

package com.designlens.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Designlens.
 * Routes to subcommands: analyze, fetch, serve.
 */
@Command(
        name = "designlens",
        mixinStandardHelpOptions = true,
        version = "Designlens 0.1.0",
        description = "Turns design-tool trees into UI component specifications",
        subcommands = {
                AnalyzeCommand.class,
                FetchCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class DesignlensCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}

package com.designlens.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the picocli command tree inside the Spring Boot lifecycle and hands its exit code to
 * {@link org.springframework.boot.SpringApplication#exit}.
 * <p>
 * Exit codes follow the commands: 0 success, 1 analysis failure, 2 input or API error.
 * An exception that escapes a command is reported like an analysis failure.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    static final int EXIT_FAILURE = 1;

    private final DesignlensCommand designlensCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(DesignlensCommand designlensCommand, IFactory factory) {
        this.designlensCommand = designlensCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        if (ServeCommand.isServeMode(args)) {
            log.debug("Serve mode, leaving the process to the web server");
            return;
        }
        exitCode = commandLine().execute(args);
        log.debug("Command finished with exit code {}", exitCode);
    }

    CommandLine commandLine() {
        return new CommandLine(designlensCommand, factory)
                .setExecutionExceptionHandler((e, commandLine, parseResult) -> {
                    log.error("Command '{}' failed", commandLine.getCommandName(), e);
                    ConsoleOutput.error("Command failed: " + AnalyzeCommand.rootCauseMessage(e));
                    return EXIT_FAILURE;
                });
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}

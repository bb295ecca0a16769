package com.sreagent.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

import java.util.Arrays;

/**
 * Runs the {@code sre-agent} command line inside the Spring context and exposes its
 * exit code to {@link org.springframework.boot.SpringApplication#exit}.
 * <p>
 * Does nothing in {@code serve} mode, where the embedded web server keeps the process
 * alive instead.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final SreAgentCommand rootCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(SreAgentCommand rootCommand, IFactory factory) {
        this.rootCommand = rootCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        if (Arrays.asList(args).contains("serve")) {
            return;
        }
        exitCode = commandLine().execute(args);
    }

    CommandLine commandLine() {
        return new CommandLine(rootCommand, factory)
                .setExecutionExceptionHandler((ex, cmd, parseResult) -> {
                    if (ex instanceof ApiClientException) {
                        ConsoleOutput.error(ex.getMessage());
                        return 1;
                    }
                    throw ex;
                });
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}

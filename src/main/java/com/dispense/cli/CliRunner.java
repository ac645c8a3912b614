package com.dispense.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final DispenseCommand dispenseCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(DispenseCommand dispenseCommand, IFactory factory) {
        this.dispenseCommand = dispenseCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) throws Exception {
        // The daemon is served by the embedded web server; picocli would return at once.
        if (isDaemon(args)) {
            return;
        }
        exitCode = new CommandLine(dispenseCommand, factory)
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
    }

    static boolean isDaemon(String... args) {
        return args.length > 0 && "daemon".equals(args[0]);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}

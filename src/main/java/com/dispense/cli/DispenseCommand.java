package com.dispense.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for dispense.
 */
@Command(
        name = "dispense",
        mixinStandardHelpOptions = true,
        version = "dispense 0.1.0",
        description = "Run and watch coding agents in local and remote sandboxes",
        subcommands = {
                DaemonCommand.class,
                RunCommand.class,
                StatusCommand.class,
                TasksCommand.class,
                LogsCommand.class,
                StopCommand.class,
                WaitCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class DispenseCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}

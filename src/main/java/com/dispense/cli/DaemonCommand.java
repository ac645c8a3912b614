package com.dispense.cli;

import com.dispense.daemon.DaemonProperties;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: dispense daemon
 * <p>
 * Runs the task supervisor inside a sandbox, serving the agent API over HTTP. The web
 * server is enabled by {@link com.dispense.DispenseApplication#main} detecting "daemon" in
 * the arguments, and {@link CliRunner} skips picocli so the server keeps the JVM alive.
 * <p>
 * Configure the port via {@code DISPENSE_DAEMON_PORT}.
 */
@Command(name = "daemon", mixinStandardHelpOptions = true,
        description = "Run the task supervisor daemon (inside a sandbox)")
@Component
public class DaemonCommand implements Runnable {

    private final DaemonProperties properties;

    public DaemonCommand(DaemonProperties properties) {
        this.properties = properties;
    }

    @Override
    public void run() {
        // Not called in daemon mode; kept for subcommand registration and --help.
        ConsoleOutput.info("Start with: java -jar dispense.jar daemon (port " + properties.getPort() + ")");
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Daemon listening on port " + event.getWebServer().getPort());
        ConsoleOutput.info("Task logs in " + properties.logDirectory());
    }
}

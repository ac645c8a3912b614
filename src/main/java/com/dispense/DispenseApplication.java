package com.dispense;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;

@SpringBootApplication
public class DispenseApplication {

    public static void main(String[] args) {
        boolean daemonMode = args.length > 0 && "daemon".equals(args[0]);

        SpringApplicationBuilder builder = new SpringApplicationBuilder(DispenseApplication.class);

        if (daemonMode) {
            // Embedded web server for the agent API + SSE
            builder.profiles("daemon");
            builder.properties(
                    "dispense.mode=daemon",
                    "spring.main.web-application-type=servlet",
                    "spring.main.banner-mode=off"
            );
        } else {
            // CLI-only: no web server, keep framework logging off the terminal
            builder.properties(
                    "dispense.mode=controller",
                    "spring.main.web-application-type=none",
                    "spring.main.banner-mode=off",
                    "logging.level.root=WARN",
                    "logging.level.com.dispense=WARN"
            );
        }

        ApplicationContext ctx = builder.run(args);

        if (!daemonMode) {
            ExitCodeGenerator exitCodeGen = ctx.getBean(ExitCodeGenerator.class);
            int exitCode = SpringApplication.exit(ctx, exitCodeGen);
            System.exit(exitCode);
        }
    }
}

package com.sreagent;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.Arrays;

/**
 * Entry point for both halves of the SRE agent.
 * <p>
 * {@code serve} starts the orchestrator behind the REST and SSE API and keeps running until
 * the process is stopped. Every other command (query, watch, workers, inspect, stats, history,
 * health) starts without a web server, runs one picocli command against a running server and
 * exits with that command's exit code.
 */
@SpringBootApplication
public class SreAgentApplication {

    static final String SERVE_COMMAND = "serve";

    public static void main(String[] args) {
        String[] effectiveArgs = withDefaultCommand(args);
        boolean serving = isServe(effectiveArgs);

        SpringApplicationBuilder builder = new SpringApplicationBuilder(SreAgentApplication.class)
                .properties("spring.main.banner-mode=off");
        if (serving) {
            builder.properties("spring.main.web-application-type=servlet");
        } else {
            builder.properties(
                    "spring.main.web-application-type=none",
                    "logging.level.root=WARN",
                    "logging.level.com.sreagent.mcp=ERROR"
            );
        }

        ConfigurableApplicationContext context = builder.run(effectiveArgs);
        if (!serving) {
            System.exit(SpringApplication.exit(context, context.getBean(ExitCodeGenerator.class)));
        }
    }

    /**
     * An argument-less start on Cloud Foundry is the platform launching the server.
     */
    static String[] withDefaultCommand(String[] args) {
        if (args.length == 0 && System.getenv("VCAP_APPLICATION") != null) {
            return new String[]{SERVE_COMMAND};
        }
        return args;
    }

    static boolean isServe(String[] args) {
        return Arrays.asList(args).contains(SERVE_COMMAND);
    }
}

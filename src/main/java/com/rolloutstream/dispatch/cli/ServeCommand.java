package com.rolloutstream.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: rollout-stream serve
 * <p>
 * Runs the HTTP server with the SSE log endpoint. The web server is enabled by
 * {@link com.rolloutstream.RolloutStreamApplication#main} seeing "serve" in the args;
 * {@link CliRunner} then skips picocli and the banner is printed once Tomcat is up.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the log streaming HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // only reached for --help style invocations; CliRunner skips picocli in serve mode
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Log stream server running on port " + port);
        System.out.println();
        System.out.println("  Logs:    http://localhost:" + port + "/api/v1/rollouts/{namespace}/{name}/pods/logs");
        System.out.println("  Health:  http://localhost:" + port + "/api/v1/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}

package com.sectune.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: sectune serve
 * <p>
 * Starts the REST API. The web server is enabled by
 * {@link com.sectune.SectuneApplication#main} detecting "serve" in args, and
 * {@link CliRunner} skips picocli in that mode; the banner is printed once the
 * server is listening.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Sectune HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Sectune server running on port " + port);
        System.out.println();
        System.out.println("  API:      http://localhost:" + port + "/api/v1");
        System.out.println("  Metrics:  http://localhost:" + port + "/actuator/metrics");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}

package com.runway.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: runway serve
 * <p>
 * Runs as a long-running HTTP server receiving push notifications from the
 * remote store. {@link CliRunner} skips picocli in this mode so the embedded
 * web server keeps the JVM alive; the banner is printed once Tomcat is ready.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 runway serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Runway notification server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Value("${runway.remote.base-url:http://localhost:3000}")
    private String remoteBaseUrl;

    @Override
    public void run() {
        // Not called in serve mode; kept for subcommand registration and --help.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Runway server running on port " + port);
        System.out.println();
        System.out.println("  Notifications:  POST http://localhost:" + port + "/api/v1/notifications");
        System.out.println("  Sessions:       http://localhost:" + port + "/api/v1/sessions");
        System.out.println("  Remote store:   " + remoteBaseUrl);
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}

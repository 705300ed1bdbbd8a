package com.warden.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: warden serve
 * <p>
 * Starts Warden as a long-running HTTP server exposing the REST API. The web
 * server is enabled by {@link com.warden.WardenApplication#main} detecting
 * "serve" in args; {@link CliRunner} then skips picocli and the banner is
 * printed once Tomcat is ready.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 warden serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Warden HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Not called in serve mode; kept for subcommand registration and --help.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Warden server running on port " + port);
        System.out.println();
        System.out.println("  API:     http://localhost:" + port + "/api/v1/updates");
        System.out.println("  Health:  http://localhost:" + port + "/api/v1/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}

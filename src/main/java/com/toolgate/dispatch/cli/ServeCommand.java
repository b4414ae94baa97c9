package com.toolgate.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: toolgate serve
 * <p>
 * Starts Toolgate as a long-running HTTP server exposing the decision API and
 * the approval queue. The web server is enabled by
 * {@link com.toolgate.ToolgateApplication#main} detecting "serve" in args.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 toolgate serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Toolgate HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Not called in serve mode; CliRunner skips picocli.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Toolgate server running on port " + port);
        System.out.println();
        System.out.println("  Decisions:  POST http://localhost:" + port + "/api/v1/decisions");
        System.out.println("  Approvals:  GET  http://localhost:" + port + "/api/v1/approvals");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}

package com.aura.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: aura serve
 * <p>
 * Runs Aura as a long-lived sandbox service exposing {@code POST /execute}, the
 * endpoint the {@code remote} sandbox provider of another runtime calls. The web
 * server is enabled by {@link com.aura.AuraApplication#main} detecting "serve".
 * <p>
 * Configure port via: {@code SERVER_PORT=8100 aura serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the sandbox execution service")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8100}")
    private int port;

    @Override
    public void run() {
        // Not reached in serve mode, CliRunner skips picocli; kept for --help.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Sandbox service running on port " + port);
        System.out.println();
        System.out.println("  Execute:  POST http://localhost:" + port + "/execute");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}

package com.designlens.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: designlens serve
 * <p>
 * Starts Designlens as a long-running HTTP server exposing the REST API. The web server is
 * enabled by {@link com.designlens.DesignlensApplication#main} detecting "serve" in args, and
 * {@link CliRunner} skips picocli so the embedded server keeps the JVM alive.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 designlens serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Designlens HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached through --help style invocations; CliRunner skips picocli in serve mode.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Designlens server running on port " + port);
        System.out.println();
        System.out.println("  API:      http://localhost:" + port + "/api/v1/analyses");
        System.out.println("  Health:   http://localhost:" + port + "/actuator/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    /**
     * True when the first argument is the {@code serve} subcommand. Options of other commands
     * (a tree file named "serve", say) never switch the process into server mode.
     */
    public static boolean isServeMode(String... args) {
        return args != null && args.length > 0 && "serve".equals(args[0]);
    }
}

package fr.lapetina.primaryserver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for the primary server.
 *
 * Exits once the serving loop reports that no more work may exist: 0 on a
 * regular end, 1 after a generation failure or a startup failure.
 */
public class PrimaryServerApplication {

    private static final Logger log = LoggerFactory.getLogger(PrimaryServerApplication.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;

    private PrimaryServerApplication() {
    }

    /**
     * Runs the server until serving finishes.
     *
     * @return the process exit code
     */
    public static int run(String configPath) {
        ServerFactory server;
        try {
            server = ServerFactory.create(configPath);
        } catch (Exception e) {
            log.error("Failed to create primary server", e);
            return EXIT_FAILURE;
        }
        try {
            server.start();
        } catch (Exception e) {
            log.error("Failed to start primary server", e);
            server.close();
            return EXIT_FAILURE;
        }

        Thread shutdownHook = new Thread(server::close, "primary-server-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        try {
            server.awaitServingFinished();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while serving");
        }

        boolean failed = server.getJobServer().hasFailed();
        log.info("Serving finished: state={}, failed={}", server.getJobServer().getState(), failed);
        server.close();
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException e) {
            log.debug("Shutdown already in progress");
        }
        return failed ? EXIT_FAILURE : EXIT_OK;
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";
        System.exit(run(configPath));
    }
}

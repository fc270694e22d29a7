package runbroker;

import runbroker.coordinator.config.CoordinatorConfig;
import runbroker.coordinator.server.CoordinatorNettyServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Coordinator entry point.
 *
 * Starts the HTTP server from environment configuration and blocks until the
 * JVM is asked to shut down.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws InterruptedException {
        CoordinatorConfig config = CoordinatorConfig.fromEnv();
        int port = config.serverPort();

        log.info("Starting coordinator on port {}...", port);
        if (!CoordinatorNettyServer.start(port, config)) {
            log.error("Coordinator failed to start");
            System.exit(1);
        }

        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested");
            CoordinatorNettyServer.stop();
            shutdown.countDown();
        }, "runbroker-shutdown"));

        shutdown.await();
    }
}

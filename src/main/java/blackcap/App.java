package blackcap;

import blackcap.coordinator.config.CoordinatorConfig;
import blackcap.coordinator.config.Dependencies;
import blackcap.coordinator.server.CoordinatorNettyServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Coordinator entry point.
 *
 * Starts the HTTP server first, then the background loops, and shuts both down on SIGTERM.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws InterruptedException {
        CoordinatorConfig config = CoordinatorConfig.fromEnv();

        Dependencies deps = Dependencies.create(config);
        CoordinatorNettyServer server = new CoordinatorNettyServer(config, deps.routerHandler());
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            server.stop();
            deps.close();
            stopped.countDown();
        }, "blackcap-shutdown"));

        try {
            server.start();
        } catch (IllegalStateException e) {
            log.error("Coordinator failed to start", e);
            deps.close();
            System.exit(1);
        }
        deps.startBackgroundLoops();

        stopped.await();
    }
}

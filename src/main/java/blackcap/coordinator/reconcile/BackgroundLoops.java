package blackcap.coordinator.reconcile;

import blackcap.coordinator.config.CoordinatorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Coordinates background scheduled tasks:
 * - SubmissionDispatcher: hands new schedules to their clusters
 * - StatusReconciler: polls clusters and advances job status
 *
 * Uses a single-threaded executor so passes never overlap; the reconciler fans
 * its polls out on its own pool.
 */
public class BackgroundLoops implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BackgroundLoops.class);

    private final ScheduledExecutorService executor;
    private final SubmissionDispatcher dispatcher;
    private final StatusReconciler reconciler;
    private final CoordinatorConfig config;

    private volatile boolean running = false;

    public BackgroundLoops(SubmissionDispatcher dispatcher, StatusReconciler reconciler, CoordinatorConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "blackcap-loops");
            t.setDaemon(true);
            return t;
        });
        this.dispatcher = dispatcher;
        this.reconciler = reconciler;
        this.config = config;
    }

    /**
     * Start the loops.
     */
    public void start() {
        if (running) {
            log.warn("Background loops already running");
            return;
        }

        running = true;

        long dispatchIntervalMs = config.dispatchInterval().toMillis();
        executor.scheduleWithFixedDelay(
                wrapRunnable("submission-dispatcher", dispatcher),
                dispatchIntervalMs,
                dispatchIntervalMs,
                TimeUnit.MILLISECONDS);
        log.info("Submission dispatcher scheduled every {}ms", dispatchIntervalMs);

        long reconcileIntervalMs = config.reconcileInterval().toMillis();
        executor.scheduleWithFixedDelay(
                wrapRunnable("status-reconciler", reconciler),
                reconcileIntervalMs,
                reconcileIntervalMs,
                TimeUnit.MILLISECONDS);
        log.info("Status reconciler scheduled every {}ms", reconcileIntervalMs);

        log.info("Background loops started");
    }

    /**
     * Stop the loops gracefully.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Background loops forcefully stopped");
            } else {
                log.info("Background loops stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public SubmissionDispatcher dispatcher() {
        return dispatcher;
    }

    public StatusReconciler reconciler() {
        return reconciler;
    }

    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}

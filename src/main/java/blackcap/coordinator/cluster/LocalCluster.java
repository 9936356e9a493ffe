package blackcap.coordinator.cluster;

import blackcap.coordinator.error.PermanentSubmissionException;
import blackcap.coordinator.error.PreparationException;
import blackcap.coordinator.error.SubmissionException;
import blackcap.coordinator.model.Job;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * In-process backend that runs job work on a thread pool.
 *
 * <p>Recognised spec fields:
 * <ul>
 * <li>{@code tasks} - number of sub-tasks (default 1)</li>
 * <li>{@code durationMs} - simulated run time of each sub-task (default 100)</li>
 * <li>{@code fail} - when true every sub-task ends in ERROR</li>
 * </ul>
 * State is kept in memory only; ids unknown after a restart report {@code LOST}.
 * Once every sub-task of a run has finished and been reported, the run moves to a bounded
 * cache of final statuses ({@code retained_runs}, default 1024).
 */
public final class LocalCluster extends AbstractCluster {

    private static final Logger log = LoggerFactory.getLogger(LocalCluster.class);

    static final int MAX_TASKS = 64;

    private static final Set<String> FINAL_STATES = Set.of("DONE", "ERROR", "CANCELLED");

    private final ExecutorService executor;
    private final Map<String, AtomicReferenceArray<String>> runs = new ConcurrentHashMap<>();
    private final Cache<String, List<String>> finished;
    private final AtomicInteger idGen = new AtomicInteger(1);

    public LocalCluster(ClusterSettings settings) {
        super(settings.descriptor());
        int workers = settings.intProperty("workers", 4);
        this.executor = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, "local-cluster-" + settings.id());
            t.setDaemon(true);
            return t;
        });
        this.finished = CacheBuilder.newBuilder()
                .maximumSize(settings.intProperty("retained_runs", 1024))
                .build();
    }

    @Override
    public StatusVocabulary vocabulary() {
        return StatusVocabulary.LOCAL;
    }

    @Override
    protected void prepareSpec(Job job, JsonNode spec) {
        int tasks = spec.path("tasks").asInt(1);
        if (tasks < 1 || tasks > MAX_TASKS) {
            throw new PreparationException("Job " + job.id() + ": tasks must be between 1 and " + MAX_TASKS);
        }
        if (spec.path("durationMs").asLong(0) < 0) {
            throw new PreparationException("Job " + job.id() + ": durationMs must be non-negative");
        }
    }

    @Override
    public String submit(Job job) {
        JsonNode spec = parseSpec(job);
        int tasks = spec.path("tasks").asInt(1);
        if (tasks < 1 || tasks > MAX_TASKS) {
            throw new PermanentSubmissionException("Job " + job.id() + " was not prepared: bad task count " + tasks);
        }
        long durationMs = spec.path("durationMs").asLong(100);
        boolean fail = spec.path("fail").asBoolean(false);

        String externalId = id() + "-" + idGen.getAndIncrement();
        AtomicReferenceArray<String> states = new AtomicReferenceArray<>(tasks);
        for (int i = 0; i < tasks; i++) {
            states.set(i, "QUEUED");
        }
        runs.put(externalId, states);

        try {
            for (int i = 0; i < tasks; i++) {
                int slot = i;
                executor.submit(() -> runTask(externalId, states, slot, durationMs, fail));
            }
        } catch (RejectedExecutionException e) {
            runs.remove(externalId);
            throw new SubmissionException("Cluster " + id() + " is shutting down", e);
        }

        log.info("Local cluster {} accepted job {} as {} ({} tasks)", id(), job.id(), externalId, tasks);
        return externalId;
    }

    private void runTask(String externalId, AtomicReferenceArray<String> states, int slot,
            long durationMs, boolean fail) {
        states.set(slot, "RUNNING");
        try {
            Thread.sleep(durationMs);
            states.set(slot, fail ? "ERROR" : "DONE");
            log.debug("Local run {} task {} finished: {}", externalId, slot, states.get(slot));
        } catch (InterruptedException e) {
            states.set(slot, "CANCELLED");
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public Iterable<String> getStatus(String externalJobId) {
        return new StatusSequence(() -> {
            AtomicReferenceArray<String> states = runs.get(externalJobId);
            if (states == null) {
                List<String> done = finished.getIfPresent(externalJobId);
                return done != null ? done : List.of("LOST");
            }
            List<String> snapshot = new ArrayList<>(states.length());
            for (int i = 0; i < states.length(); i++) {
                snapshot.add(states.get(i));
            }
            if (FINAL_STATES.containsAll(snapshot)) {
                finished.put(externalJobId, List.copyOf(snapshot));
                runs.remove(externalJobId);
            }
            return snapshot;
        });
    }

    /** Runs that still have unfinished or unreported sub-tasks. */
    int activeRuns() {
        return runs.size();
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            executor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Local cluster {} stopped", id());
    }
}

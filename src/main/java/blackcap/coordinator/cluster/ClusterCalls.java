package blackcap.coordinator.cluster;

import blackcap.coordinator.error.BlackcapException;
import blackcap.coordinator.error.StatusQueryException;
import blackcap.coordinator.error.SubmissionException;
import blackcap.coordinator.model.Job;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BiFunction;

/**
 * Invokes cluster operations with a deadline. A call that exceeds it is cancelled
 * and reported as a transient backend failure.
 */
public final class ClusterCalls implements AutoCloseable {

    private final ExecutorService executor;
    private final Duration timeout;

    public ClusterCalls(Duration timeout) {
        this.timeout = timeout;
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "cluster-call");
            t.setDaemon(true);
            return t;
        });
    }

    public Duration timeout() {
        return timeout;
    }

    public void prepare(Cluster cluster, Job job) {
        call(() -> {
            cluster.prepare(job);
            return null;
        }, "prepare " + job.id() + " on " + cluster.id(), SubmissionException::new);
    }

    public String submit(Cluster cluster, Job job) {
        return call(() -> cluster.submit(job),
                "submit " + job.id() + " to " + cluster.id(), SubmissionException::new);
    }

    /** Fetch and materialize the status sequence inside the deadline. */
    public List<String> status(Cluster cluster, String externalJobId) {
        return call(() -> {
            List<String> values = new ArrayList<>();
            for (String value : cluster.getStatus(externalJobId)) {
                values.add(value);
            }
            return values;
        }, "status of " + externalJobId + " on " + cluster.id(), StatusQueryException::new);
    }

    private <T> T call(Callable<T> action, String what,
            BiFunction<String, Throwable, ? extends BlackcapException> transientError) {
        Future<T> future = executor.submit(action);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw transientError.apply("Timed out after " + timeout.toMillis() + "ms: " + what, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw transientError.apply("Interrupted: " + what, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof BlackcapException be) {
                throw be;
            }
            throw transientError.apply("Failed to " + what + ": " + cause, cause);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}

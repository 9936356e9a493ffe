package blackcap.coordinator.reconcile;

import com.google.common.util.concurrent.Striped;

import java.util.concurrent.locks.Lock;

/**
 * Per-job mutual exclusion for background work. Different jobs may share a stripe,
 * which only costs an occasional skipped pass.
 */
public final class JobLocks {

    private final Striped<Lock> locks;

    public JobLocks(int stripes) {
        this.locks = Striped.lazyWeakLock(stripes);
    }

    /**
     * Run {@code work} while holding the job's lock.
     *
     * @return false, without running {@code work}, if the lock is held elsewhere
     */
    public boolean tryRun(String jobId, Runnable work) {
        Lock lock = locks.get(jobId);
        if (!lock.tryLock()) {
            return false;
        }
        try {
            work.run();
            return true;
        } finally {
            lock.unlock();
        }
    }
}

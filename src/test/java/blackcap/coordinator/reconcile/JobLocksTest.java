package blackcap.coordinator.reconcile;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class JobLocksTest {

    @Test
    void runsWorkWhenFree() {
        JobLocks locks = new JobLocks(4);
        AtomicBoolean ran = new AtomicBoolean();
        assertTrue(locks.tryRun("job-1", () -> ran.set(true)));
        assertTrue(ran.get());
    }

    @Test
    void sameJobIsExclusive() throws Exception {
        JobLocks locks = new JobLocks(4);
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        Thread holder = new Thread(() -> locks.tryRun("job-1", () -> {
            held.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }));
        holder.start();
        assertTrue(held.await(5, TimeUnit.SECONDS));

        AtomicBoolean ran = new AtomicBoolean();
        assertFalse(locks.tryRun("job-1", () -> ran.set(true)));
        assertFalse(ran.get());

        release.countDown();
        holder.join();
        assertTrue(locks.tryRun("job-1", () -> ran.set(true)));
    }

    @Test
    void lockIsReleasedWhenWorkThrows() {
        JobLocks locks = new JobLocks(4);
        assertThrows(IllegalStateException.class, () -> locks.tryRun("job-2", () -> {
            throw new IllegalStateException("boom");
        }));
        assertTrue(locks.tryRun("job-2", () -> {
        }));
    }
}

package blackcap.coordinator.store;

import blackcap.coordinator.error.ConflictException;
import blackcap.coordinator.error.DuplicateScheduleException;
import blackcap.coordinator.error.NotFoundException;
import blackcap.coordinator.error.ScheduleNotFoundException;
import blackcap.coordinator.model.Job;
import blackcap.coordinator.model.JobStatus;
import blackcap.coordinator.model.Schedule;
import blackcap.coordinator.schema.ScheduleQueryType;
import blackcap.coordinator.schema.ScheduleUpdate;
import blackcap.coordinator.schema.ScheduledCreate;
import org.junit.jupiter.api.*;

import java.sql.Connection;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class JdbcScheduleRepositoryTest {

    private static Database db;
    private static JdbcJobRepository jobRepo;
    private static JdbcScheduleRepository scheduleRepo;

    @BeforeAll
    static void setUp() {
        db = new Database("jdbc:h2:mem:test-schedules;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 8);
        jobRepo = new JdbcJobRepository(db);
        scheduleRepo = new JdbcScheduleRepository(db);
    }

    @AfterAll
    static void tearDown() {
        db.close();
    }

    @BeforeEach
    void cleanUp() throws Exception {
        try (Connection conn = db.getConnection(); Statement st = conn.createStatement()) {
            st.execute("DELETE FROM schedules");
            st.execute("DELETE FROM jobs");
            conn.commit();
        }
    }

    private void newJob(String id) {
        jobRepo.save(Job.builder().id(id).owner("alice@example.org").build());
    }

    @Test
    void createMarksJobScheduled() {
        newJob("job-1");

        Schedule schedule = scheduleRepo.create(new ScheduledCreate("job-1", "local"), "alice@example.org");

        assertTrue(schedule.id().startsWith("sch-"));
        assertTrue(schedule.isActive());
        assertFalse(schedule.isSubmitted());
        assertEquals(JobStatus.SCHEDULED, jobRepo.findById("job-1").orElseThrow().status());
        assertEquals(schedule.id(), scheduleRepo.findActiveByJobId("job-1").orElseThrow().id());
    }

    @Test
    void createForMissingJobFails() {
        assertThrows(NotFoundException.class,
                () -> scheduleRepo.create(new ScheduledCreate("job-ghost", "local"), "alice"));
        assertTrue(scheduleRepo.findActive().isEmpty());
    }

    @Test
    void createForTerminalJobConflicts() {
        newJob("job-done");
        jobRepo.advanceStatus("job-done", JobStatus.CANCELLED);

        ConflictException e = assertThrows(ConflictException.class,
                () -> scheduleRepo.create(new ScheduledCreate("job-done", "local"), "alice"));
        assertFalse(e instanceof DuplicateScheduleException);
    }

    @Test
    void secondActiveScheduleIsRejected() {
        newJob("job-2");
        scheduleRepo.create(new ScheduledCreate("job-2", "local"), "alice");

        assertThrows(DuplicateScheduleException.class,
                () -> scheduleRepo.create(new ScheduledCreate("job-2", "hpc"), "alice"));
        assertEquals(1, scheduleRepo.findBy(ScheduleQueryType.JOB_ID, "job-2", true).size());
    }

    @Test
    @DisplayName("Concurrent creates for one job leave exactly one active schedule")
    void concurrentCreatesAreSerialized() throws Exception {
        newJob("job-race");
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger created = new AtomicInteger();
        AtomicInteger duplicates = new AtomicInteger();

        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            String cluster = "cluster-" + i;
            futures.add(pool.submit(() -> {
                start.await();
                try {
                    scheduleRepo.create(new ScheduledCreate("job-race", cluster), "alice");
                    created.incrementAndGet();
                } catch (DuplicateScheduleException e) {
                    duplicates.incrementAndGet();
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) {
            f.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertEquals(1, created.get());
        assertEquals(threads - 1, duplicates.get());
        assertEquals(1, scheduleRepo.findBy(ScheduleQueryType.JOB_ID, "job-race", true).size());
    }

    @Test
    void submittedJobIsNotFreedBySoftDelete() {
        newJob("job-9");
        Schedule first = scheduleRepo.create(new ScheduledCreate("job-9", "local"), "alice");
        scheduleRepo.update(new ScheduleUpdate(first.id(), "local-9"));
        assertTrue(scheduleRepo.softDelete(first.id()));

        assertThrows(ConflictException.class,
                () -> scheduleRepo.create(new ScheduledCreate("job-9", "hpc"), "alice"));
        assertEquals(1, scheduleRepo.findBy(ScheduleQueryType.JOB_ID, "job-9", true).size());
    }

    @Test
    void softDeleteFreesTheJob() {
        newJob("job-3");
        Schedule first = scheduleRepo.create(new ScheduledCreate("job-3", "local"), "alice");

        assertTrue(scheduleRepo.softDelete(first.id()));
        assertFalse(scheduleRepo.softDelete(first.id()));
        assertTrue(scheduleRepo.findActiveByJobId("job-3").isEmpty());

        Schedule second = scheduleRepo.create(new ScheduledCreate("job-3", "hpc"), "alice");
        assertNotEquals(first.id(), second.id());

        assertEquals(List.of(second.id()),
                scheduleRepo.findBy(ScheduleQueryType.JOB_ID, "job-3", false).stream().map(Schedule::id).toList());
        List<Schedule> all = scheduleRepo.findBy(ScheduleQueryType.JOB_ID, "job-3", true);
        assertEquals(2, all.size());
        Schedule deleted = scheduleRepo.findById(first.id()).orElseThrow();
        assertFalse(deleted.isActive());
        assertNotNull(deleted.deletedAt());
    }

    @Test
    void updateSetsExternalId() {
        newJob("job-4");
        Schedule schedule = scheduleRepo.create(new ScheduledCreate("job-4", "local"), "alice");

        Schedule updated = scheduleRepo.update(new ScheduleUpdate(schedule.id(), "local-17"));
        assertEquals("local-17", updated.externalJobId());
        assertTrue(updated.isSubmitted());

        // null leaves the external id alone
        Schedule touched = scheduleRepo.update(new ScheduleUpdate(schedule.id(), null));
        assertEquals("local-17", touched.externalJobId());
    }

    @Test
    void updateOfMissingOrDeletedScheduleFails() {
        assertThrows(ScheduleNotFoundException.class,
                () -> scheduleRepo.update(new ScheduleUpdate("sch-none", "x")));

        newJob("job-5");
        Schedule schedule = scheduleRepo.create(new ScheduledCreate("job-5", "local"), "alice");
        scheduleRepo.softDelete(schedule.id());
        assertThrows(ScheduleNotFoundException.class,
                () -> scheduleRepo.update(new ScheduleUpdate(schedule.id(), "x")));
    }

    @Test
    void countsActivePerCluster() {
        newJob("job-a");
        newJob("job-b");
        newJob("job-c");
        scheduleRepo.create(new ScheduledCreate("job-a", "hpc"), "alice");
        scheduleRepo.create(new ScheduledCreate("job-b", "hpc"), "alice");
        Schedule c = scheduleRepo.create(new ScheduledCreate("job-c", "k8s"), "alice");
        scheduleRepo.softDelete(c.id());

        assertEquals(2, scheduleRepo.countActiveByCluster("hpc"));
        assertEquals(0, scheduleRepo.activeSchedules("k8s"));
        assertEquals(2, scheduleRepo.findBy(ScheduleQueryType.CLUSTER_ID, "hpc", false).size());
        assertEquals(2, scheduleRepo.findActive().size());
    }
}

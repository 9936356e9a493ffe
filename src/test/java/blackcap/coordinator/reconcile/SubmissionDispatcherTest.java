package blackcap.coordinator.reconcile;

import blackcap.coordinator.cluster.ClusterCalls;
import blackcap.coordinator.cluster.ClusterRegistry;
import blackcap.coordinator.cluster.FakeCluster;
import blackcap.coordinator.error.ConflictException;
import blackcap.coordinator.model.Job;
import blackcap.coordinator.model.JobStatus;
import blackcap.coordinator.model.Schedule;
import blackcap.coordinator.schema.ScheduledCreate;
import blackcap.coordinator.store.Database;
import blackcap.coordinator.store.JdbcJobRepository;
import blackcap.coordinator.store.JdbcScheduleRepository;
import org.junit.jupiter.api.*;

import java.sql.Connection;
import java.sql.Statement;
import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SubmissionDispatcherTest {

    private static Database db;
    private static JdbcJobRepository jobRepo;
    private static JdbcScheduleRepository scheduleRepo;

    private FakeCluster cluster;
    private ClusterCalls calls;
    private SubmissionDispatcher dispatcher;

    @BeforeAll
    static void setUpDb() {
        db = new Database("jdbc:h2:mem:test-dispatcher;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 4);
        jobRepo = new JdbcJobRepository(db);
        scheduleRepo = new JdbcScheduleRepository(db);
    }

    @AfterAll
    static void tearDownDb() {
        db.close();
    }

    @BeforeEach
    void setUp() throws Exception {
        try (Connection conn = db.getConnection(); Statement st = conn.createStatement()) {
            st.execute("DELETE FROM schedules");
            st.execute("DELETE FROM jobs");
            conn.commit();
        }
        cluster = new FakeCluster("local", "cpu");
        calls = new ClusterCalls(Duration.ofSeconds(2));
        dispatcher = new SubmissionDispatcher(jobRepo, scheduleRepo,
                new ClusterRegistry().register(cluster), calls, new JobLocks(16));
    }

    @AfterEach
    void tearDown() {
        calls.close();
    }

    private Schedule scheduledJob(String jobId, String... capabilities) {
        jobRepo.save(Job.builder().id(jobId).owner("alice").requiredCapabilities(Set.of(capabilities)).build());
        return scheduleRepo.create(new ScheduledCreate(jobId, "local"), "alice");
    }

    @Test
    void submitsAndRecordsExternalId() {
        Schedule schedule = scheduledJob("job-1", "cpu");

        assertEquals(SubmissionDispatcher.Outcome.SUBMITTED, dispatcher.dispatch(schedule));

        Schedule stored = scheduleRepo.findById(schedule.id()).orElseThrow();
        assertEquals("local-ext-1", stored.externalJobId());
        assertEquals(List.of("job-1"), cluster.submittedJobs());
    }

    @Test
    @DisplayName("A schedule is submitted at most once")
    void secondDispatchIsSkipped() {
        Schedule schedule = scheduledJob("job-2");

        dispatcher.dispatch(schedule);
        assertEquals(SubmissionDispatcher.Outcome.SKIPPED, dispatcher.dispatch(schedule));
        assertEquals(0, dispatcher.dispatchPending());
        assertEquals(1, cluster.submitCount());
    }

    @Test
    void permanentRejectionFailsJob() {
        Schedule schedule = scheduledJob("job-3");
        cluster.submitMode(FakeCluster.SubmitMode.PERMANENT_FAILURE);

        assertEquals(SubmissionDispatcher.Outcome.REJECTED, dispatcher.dispatch(schedule));
        assertEquals(JobStatus.FAILED, jobRepo.findById("job-3").orElseThrow().status());
        assertTrue(scheduleRepo.findActiveByJobId("job-3").isEmpty());
    }

    @Test
    void missingCapabilityIsPermanent() {
        jobRepo.save(Job.builder().id("job-4").owner("alice").requiredCapabilities(Set.of("gpu")).build());
        Schedule schedule = scheduleRepo.create(new ScheduledCreate("job-4", "local"), "alice");

        assertEquals(SubmissionDispatcher.Outcome.REJECTED, dispatcher.dispatch(schedule));
        assertEquals(0, cluster.submitCount());
        assertEquals(JobStatus.FAILED, jobRepo.findById("job-4").orElseThrow().status());
    }

    @Test
    void transientFailureIsRetriedNextPass() {
        Schedule schedule = scheduledJob("job-5");
        cluster.submitMode(FakeCluster.SubmitMode.TRANSIENT_FAILURE);

        assertEquals(SubmissionDispatcher.Outcome.DEFERRED, dispatcher.dispatch(schedule));
        assertEquals(JobStatus.SCHEDULED, jobRepo.findById("job-5").orElseThrow().status());
        assertFalse(scheduleRepo.findById(schedule.id()).orElseThrow().isSubmitted());

        cluster.submitMode(FakeCluster.SubmitMode.ACCEPT);
        assertEquals(1, dispatcher.dispatchPending());
        assertTrue(scheduleRepo.findById(schedule.id()).orElseThrow().isSubmitted());
    }

    @Test
    void terminalJobIsReleasedWithoutSubmitting() {
        Schedule schedule = scheduledJob("job-6");
        jobRepo.advanceStatus("job-6", JobStatus.CANCELLED);

        assertEquals(SubmissionDispatcher.Outcome.SKIPPED, dispatcher.dispatch(schedule));
        assertEquals(0, cluster.submitCount());
        assertTrue(scheduleRepo.findActiveByJobId("job-6").isEmpty());
    }

    @Test
    @DisplayName("A withdrawn submitted schedule cannot lead to a second submission")
    void withdrawnSubmittedJobIsNotSubmittedAgain() {
        Schedule first = scheduledJob("job-7", "cpu");
        assertEquals(1, dispatcher.dispatchPending());
        assertTrue(scheduleRepo.softDelete(first.id()));

        assertThrows(ConflictException.class,
                () -> scheduleRepo.create(new ScheduledCreate("job-7", "local"), "alice"));

        assertEquals(0, dispatcher.dispatchPending());
        assertEquals(List.of("job-7"), cluster.submittedJobs());
    }

    @Test
    void withdrawnUnsubmittedJobCanBeRescheduled() {
        Schedule first = scheduledJob("job-8", "cpu");
        assertTrue(scheduleRepo.softDelete(first.id()));

        Schedule second = scheduleRepo.create(new ScheduledCreate("job-8", "local"), "alice");

        assertEquals(SubmissionDispatcher.Outcome.SUBMITTED, dispatcher.dispatch(second));
        assertEquals(List.of("job-8"), cluster.submittedJobs());
    }
}

package blackcap.coordinator.service;

import blackcap.coordinator.auth.AccessGuard;
import blackcap.coordinator.auth.Credentials;
import blackcap.coordinator.auth.SessionToken;
import blackcap.coordinator.auth.SignedTokenIdentityProvider;
import blackcap.coordinator.cluster.ClusterRegistry;
import blackcap.coordinator.cluster.FakeCluster;
import blackcap.coordinator.error.ErrorKind;
import blackcap.coordinator.error.UnauthorizedException;
import blackcap.coordinator.model.Job;
import blackcap.coordinator.model.JobStatus;
import blackcap.coordinator.model.Schedule;
import blackcap.coordinator.scheduler.LeastLoadedScheduler;
import blackcap.coordinator.schema.*;
import blackcap.coordinator.store.Database;
import blackcap.coordinator.store.JdbcJobRepository;
import blackcap.coordinator.store.JdbcScheduleRepository;
import org.junit.jupiter.api.*;

import java.sql.Connection;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleServiceTest {

    private static Database db;
    private static JdbcJobRepository jobRepo;
    private static JdbcScheduleRepository scheduleRepo;
    private static SignedTokenIdentityProvider identity;
    private static ScheduleService service;

    @BeforeAll
    static void setUp() {
        db = new Database("jdbc:h2:mem:test-schedule-service;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 4);
        jobRepo = new JdbcJobRepository(db);
        scheduleRepo = new JdbcScheduleRepository(db);
        identity = new SignedTokenIdentityProvider("svc-secret",
                Map.of("alice@example.org", "ak", "bob@example.org", "bk"), Set.of("bob@example.org"),
                Duration.ofMinutes(10), Clock.systemUTC());
        ClusterRegistry clusters = new ClusterRegistry()
                .register(new FakeCluster("hpc", "cpu", "mpi"))
                .register(new FakeCluster("k8s", "cpu", "gpu"));
        service = new ScheduleService(new AccessGuard(identity),
                new LeastLoadedScheduler(jobRepo, clusters, scheduleRepo), new ScheduleStore(scheduleRepo));
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

    private static SessionToken login(String email, String key) {
        return identity.authenticate(new Credentials(email, key));
    }

    private void newJob(String id, String... capabilities) {
        jobRepo.save(Job.builder().id(id).owner("alice@example.org").requiredCapabilities(Set.of(capabilities)).build());
    }

    @Test
    void createPlacesAndStores() {
        newJob("job-gpu", "gpu");
        newJob("job-mpi", "mpi");

        List<ItemResult<Schedule>> results = service.create(login("alice@example.org", "ak"),
                List.of(new ScheduleCreate("job-gpu"), new ScheduleCreate("job-mpi")));

        assertTrue(ItemResult.allSucceeded(results));
        assertEquals("k8s", results.get(0).value().clusterId());
        assertEquals("hpc", results.get(1).value().clusterId());
        assertEquals(JobStatus.SCHEDULED, jobRepo.findById("job-gpu").orElseThrow().status());
    }

    @Test
    void nullRequestIsAValidationFailure() {
        newJob("job-ok", "cpu");

        List<ItemResult<Schedule>> results = service.create(login("alice@example.org", "ak"),
                Arrays.asList(null, new ScheduleCreate("job-ok")));

        assertEquals(2, results.size());
        assertEquals(0, results.get(0).index());
        assertEquals(ErrorKind.VALIDATION, results.get(0).errorKind());
        assertTrue(results.get(1).isSuccess());
        assertEquals(1, results.get(1).index());
    }

    @Test
    @DisplayName("Scheduler and store failures keep their request index")
    void failuresKeepIndex() {
        newJob("job-ok", "cpu");
        newJob("job-tpu", "tpu");
        newJob("job-dup", "cpu");
        SessionToken token = login("alice@example.org", "ak");
        service.create(token, List.of(new ScheduleCreate("job-dup")));

        List<ItemResult<Schedule>> results = service.create(token, List.of(
                new ScheduleCreate("job-tpu"),
                new ScheduleCreate("job-dup"),
                new ScheduleCreate("job-ok"),
                new ScheduleCreate(null)));

        assertEquals(4, results.size());
        for (int i = 0; i < results.size(); i++) {
            assertEquals(i, results.get(i).index());
        }
        assertEquals(ErrorKind.NOT_FOUND, results.get(0).errorKind());
        assertEquals(ErrorKind.CONFLICT, results.get(1).errorKind());
        assertTrue(results.get(2).isSuccess());
        assertEquals(ErrorKind.VALIDATION, results.get(3).errorKind());
    }

    @Test
    @DisplayName("Unauthorized create has no side effects")
    void unauthorizedCreateChangesNothing() {
        newJob("job-1", "cpu");

        assertThrows(UnauthorizedException.class,
                () -> service.create(SessionToken.ABSENT, List.of(new ScheduleCreate("job-1"))));
        assertThrows(UnauthorizedException.class,
                () -> service.create(login("bob@example.org", "bk"), List.of(new ScheduleCreate("job-1"))));

        assertTrue(scheduleRepo.findActive().isEmpty());
        assertEquals(JobStatus.PENDING, jobRepo.findById("job-1").orElseThrow().status());
    }

    @Test
    void readOnlyUserMayQueryButNotDelete() {
        newJob("job-1", "cpu");
        Schedule schedule = service.create(login("alice@example.org", "ak"),
                List.of(new ScheduleCreate("job-1"))).get(0).value();
        SessionToken bob = login("bob@example.org", "bk");

        assertEquals(1, service.get(bob, new ScheduleGetQueryParams("job_id", "job-1")).size());
        assertThrows(UnauthorizedException.class,
                () -> service.delete(bob, List.of(new ScheduleDelete(schedule.id()))));
        assertThrows(UnauthorizedException.class,
                () -> service.update(bob, List.of(new ScheduleUpdate(schedule.id(), "x"))));
        assertTrue(scheduleRepo.findById(schedule.id()).orElseThrow().isActive());
    }
}

package blackcap.coordinator.store;

import blackcap.coordinator.model.Job;
import blackcap.coordinator.model.JobStatus;
import org.junit.jupiter.api.*;

import java.sql.Connection;
import java.sql.Statement;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class JdbcJobRepositoryTest {

    private static Database db;
    private static JdbcJobRepository jobRepo;

    @BeforeAll
    static void setUp() {
        db = new Database("jdbc:h2:mem:test-jobs;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 4);
        jobRepo = new JdbcJobRepository(db);
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

    private Job newJob(String id) {
        Job job = Job.builder()
                .id(id)
                .name("render-" + id)
                .owner("alice@example.org")
                .spec("{\"tasks\":2}")
                .requiredCapabilities(Set.of("gpu", "cpu"))
                .build();
        jobRepo.save(job);
        return job;
    }

    @Test
    void saveAndFind() {
        newJob("job-1");

        Job found = jobRepo.findById("job-1").orElseThrow();
        assertEquals("render-job-1", found.name());
        assertEquals("alice@example.org", found.owner());
        assertEquals("{\"tasks\":2}", found.spec());
        assertEquals(Set.of("cpu", "gpu"), found.requiredCapabilities());
        assertEquals(JobStatus.PENDING, found.status());
        assertNotNull(found.createdAt());
        assertNull(found.finishedAt());
        assertTrue(jobRepo.findById("job-missing").isEmpty());
    }

    @Test
    void jobWithoutCapabilitiesRoundTrips() {
        jobRepo.save(Job.builder().id("job-bare").owner("bob").build());
        assertTrue(jobRepo.findById("job-bare").orElseThrow().requiredCapabilities().isEmpty());
    }

    @Test
    void advanceMovesForwardOnly() {
        newJob("job-2");

        assertTrue(jobRepo.advanceStatus("job-2", JobStatus.SCHEDULED));
        assertTrue(jobRepo.advanceStatus("job-2", JobStatus.RUNNING));
        assertFalse(jobRepo.advanceStatus("job-2", JobStatus.SCHEDULED));
        assertFalse(jobRepo.advanceStatus("job-2", JobStatus.RUNNING));
        assertEquals(JobStatus.RUNNING, jobRepo.findById("job-2").orElseThrow().status());
    }

    @Test
    void terminalStatusIsNeverOverwritten() {
        newJob("job-3");
        assertTrue(jobRepo.advanceStatus("job-3", JobStatus.CANCELLED));

        assertFalse(jobRepo.advanceStatus("job-3", JobStatus.RUNNING));
        assertFalse(jobRepo.advanceStatus("job-3", JobStatus.SUCCEEDED));
        assertFalse(jobRepo.advanceStatus("job-3", JobStatus.FAILED));

        Job job = jobRepo.findById("job-3").orElseThrow();
        assertEquals(JobStatus.CANCELLED, job.status());
        assertNotNull(job.finishedAt());
    }

    @Test
    void advanceOfUnknownJobIsNoop() {
        assertFalse(jobRepo.advanceStatus("job-nope", JobStatus.RUNNING));
    }

    @Test
    void findByStatusAndRecent() {
        Job older = Job.builder().id("job-old").owner("a").createdAt(Instant.now().minusSeconds(60)).build();
        jobRepo.save(older);
        newJob("job-new");
        jobRepo.advanceStatus("job-new", JobStatus.SCHEDULED);

        assertEquals(List.of("job-old"), jobRepo.findByStatus(JobStatus.PENDING).stream().map(Job::id).toList());
        List<Job> recent = jobRepo.findRecent(10);
        assertEquals("job-new", recent.get(0).id());
        assertEquals(1, jobRepo.findRecent(1).size());
    }

    @Test
    void generatedIdsAreUnique() {
        assertTrue(jobRepo.generateId().startsWith("job-"));
        assertNotEquals(jobRepo.generateId(), jobRepo.generateId());
    }
}

package blackcap.coordinator.cluster;

import blackcap.coordinator.error.PermanentSubmissionException;
import blackcap.coordinator.error.PreparationException;
import blackcap.coordinator.error.StatusQueryException;
import blackcap.coordinator.error.SubmissionException;
import blackcap.coordinator.model.Job;
import blackcap.coordinator.model.JobStatus;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SlurmClusterTest {

    private static final String SUBMIT = "/slurm/v0.0.39/job/submit";
    private static final String SCRIPT_SPEC = "{\"script\":\"#!/bin/bash\\necho hi\",\"environment\":[\"A=1\"]}";

    private StubBackend backend;
    private SlurmCluster cluster;

    @BeforeEach
    void setUp() throws Exception {
        backend = new StubBackend();
        cluster = new SlurmCluster(new ClusterSettings("hpc", "slurm", Set.of("cpu", "mpi"), 0,
                Map.of("endpoint", backend.url() + "/", "user", "svc", "token", "secret")));
    }

    @AfterEach
    void tearDown() {
        backend.close();
    }

    private static Job job(String spec) {
        return Job.builder().id("job-slurm").owner("tester").spec(spec).build();
    }

    @Test
    void prepareRequiresScript() {
        assertThrows(PreparationException.class, () -> cluster.prepare(job("{}")));
        assertThrows(PreparationException.class,
                () -> cluster.prepare(job("{\"script\":\"#!/bin/sh\",\"environment\":\"A=1\"}")));
        assertDoesNotThrow(() -> cluster.prepare(job(SCRIPT_SPEC)));
    }

    @Test
    void submitReturnsSlurmJobId() {
        backend.reply("POST", SUBMIT, 200, "{\"job_id\":4242,\"errors\":[]}");

        assertEquals("4242", cluster.submit(job(SCRIPT_SPEC)));

        StubBackend.Recorded request = backend.requests().get(0);
        assertEquals(List.of("svc"), request.headers().get("X-slurm-user-name"));
        assertTrue(request.body().contains("BLACKCAP_JOB_ID=job-slurm"));
        assertTrue(request.body().contains("A=1"));
    }

    @Test
    void rejectedSubmissionIsPermanent() {
        backend.reply("POST", SUBMIT, 400, "{\"errors\":[{\"error\":\"bad partition\"}]}");
        assertThrows(PermanentSubmissionException.class, () -> cluster.submit(job(SCRIPT_SPEC)));

        backend.reply("POST", SUBMIT, 200, "{\"errors\":[{\"error\":\"invalid account\"}]}");
        assertThrows(PermanentSubmissionException.class, () -> cluster.submit(job(SCRIPT_SPEC)));
    }

    @Test
    void serverErrorIsTransient() {
        backend.reply("POST", SUBMIT, 503, "{}");
        assertThrows(SubmissionException.class, () -> cluster.submit(job(SCRIPT_SPEC)));

        backend.reply("POST", SUBMIT, 429, "{}");
        assertThrows(SubmissionException.class, () -> cluster.submit(job(SCRIPT_SPEC)));
    }

    @Test
    void statusAcceptsStringAndArrayStates() {
        backend.reply("GET", "/slurm/v0.0.39/job/7", 200,
                "{\"jobs\":[{\"job_state\":\"RUNNING\"},{\"job_state\":[\"COMPLETED\",\"REQUEUED\"]}]}");

        Iterable<String> statuses = cluster.getStatus("7");
        assertEquals(Optional.of(JobStatus.RUNNING), cluster.vocabulary().fold(statuses));
    }

    @Test
    void statusFailuresAreQueryErrors() {
        assertThrows(StatusQueryException.class, () -> cluster.getStatus("missing").iterator());

        backend.reply("GET", "/slurm/v0.0.39/job/8", 200, "{\"jobs\":[]}");
        assertThrows(StatusQueryException.class, () -> cluster.getStatus("8").iterator());
    }

    @Test
    void endpointIsRequired() {
        assertThrows(IllegalArgumentException.class, () -> new SlurmCluster(
                new ClusterSettings("hpc", "slurm", Set.of(), 0, Map.of("user", "svc"))));
    }
}

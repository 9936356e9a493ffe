package blackcap.coordinator.integration;

import blackcap.coordinator.cluster.ClusterSettings;
import blackcap.coordinator.config.CoordinatorConfig;
import blackcap.coordinator.config.Dependencies;
import blackcap.coordinator.reconcile.BackgroundLoops;
import blackcap.coordinator.server.CoordinatorNettyServer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.*;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end: login, submit, schedule, then let the background loops drive
 * the job through a local cluster until it finishes.
 */
class FullFlowIntegrationTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Dependencies deps;
    private CoordinatorNettyServer server;
    private HttpClient httpClient;
    private String baseUrl;
    private String token;

    @BeforeEach
    void setUp() throws Exception {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-flow-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withServerHost("127.0.0.1")
                .withServerPort(0)
                .withDispatchInterval(Duration.ofMillis(50))
                .withReconcileInterval(Duration.ofMillis(50))
                .withSecretKey("flow-secret")
                .withUser("alice@example.org", "alice-key")
                .withCluster(new ClusterSettings("local", "local", Set.of("cpu"), 0, Map.of("workers", "2")));

        deps = Dependencies.create(config);
        server = new CoordinatorNettyServer(config, deps.routerHandler());
        server.start();
        deps.startBackgroundLoops();

        baseUrl = "http://127.0.0.1:" + server.port();
        httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();

        HttpResponse<String> login = post("/api/v1/auth/login",
                "{\"email\":\"alice@example.org\",\"apiKey\":\"alice-key\"}");
        token = MAPPER.readTree(login.body()).get("token").asText();
    }

    @AfterEach
    void tearDown() {
        server.stop();
        deps.close();
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (token != null) {
            request.header("Authorization", "Bearer " + token);
        }
        return httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
    }

    private JsonNode getJob(String jobId) throws Exception {
        HttpResponse<String> response = httpClient.send(HttpRequest.newBuilder()
                        .uri(URI.create(baseUrl + "/api/v1/jobs/" + jobId))
                        .header("Cookie", "blackcap_session=" + token)
                        .GET()
                        .build(),
                HttpResponse.BodyHandlers.ofString());
        assertEquals(200, response.statusCode(), response.body());
        return MAPPER.readTree(response.body());
    }

    private String submitAndSchedule(String spec) throws Exception {
        HttpResponse<String> created = post("/api/v1/jobs",
                "{\"name\":\"flow\",\"spec\":" + spec + ",\"requiredCapabilities\":[\"cpu\"]}");
        assertEquals(201, created.statusCode(), created.body());
        String jobId = MAPPER.readTree(created.body()).get("jobId").asText();

        HttpResponse<String> scheduled = post("/api/v1/schedules", "[{\"jobId\":\"" + jobId + "\"}]");
        assertEquals(200, scheduled.statusCode(), scheduled.body());
        return jobId;
    }

    private String awaitTerminal(String jobId) throws Exception {
        long deadline = System.currentTimeMillis() + 10_000;
        String status = getJob(jobId).get("status").asText();
        while (System.currentTimeMillis() < deadline
                && !Set.of("SUCCEEDED", "FAILED", "CANCELLED").contains(status)) {
            Thread.sleep(50);
            status = getJob(jobId).get("status").asText();
        }
        return status;
    }

    @Test
    @DisplayName("Job runs to SUCCEEDED on the local cluster and its schedule is released")
    void jobRunsToCompletion() throws Exception {
        BackgroundLoops loops = deps.backgroundLoops();
        assertTrue(loops.isRunning());

        String jobId = submitAndSchedule("{\"tasks\":3,\"durationMs\":20}");

        assertEquals("SUCCEEDED", awaitTerminal(jobId));
        assertTrue(getJob(jobId).hasNonNull("finishedAt"));
        assertTrue(deps.scheduleRepository().findActiveByJobId(jobId).isEmpty());
    }

    @Test
    void failingJobEndsFailed() throws Exception {
        String jobId = submitAndSchedule("{\"tasks\":2,\"durationMs\":10,\"fail\":true}");
        assertEquals("FAILED", awaitTerminal(jobId));
    }

    @Test
    @DisplayName("Cancelled job stays cancelled while the backend keeps running it")
    void cancelWins() throws Exception {
        String jobId = submitAndSchedule("{\"tasks\":1,\"durationMs\":500}");

        HttpResponse<String> cancelled = post("/api/v1/jobs/" + jobId + "/cancel", "");
        assertEquals(200, cancelled.statusCode(), cancelled.body());
        assertEquals("CANCELLED", MAPPER.readTree(cancelled.body()).get("status").asText());

        Thread.sleep(800);
        assertEquals("CANCELLED", getJob(jobId).get("status").asText());
        assertTrue(deps.scheduleRepository().findActiveByJobId(jobId).isEmpty());
    }
}

package blackcap.coordinator.cluster;

import blackcap.coordinator.error.PermanentSubmissionException;
import blackcap.coordinator.error.PreparationException;
import blackcap.coordinator.error.StatusQueryException;
import blackcap.coordinator.error.SubmissionException;
import blackcap.coordinator.model.Job;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpRequest;
import java.util.ArrayList;
import java.util.List;

/**
 * Batch-system backend speaking the slurmrestd JSON API.
 *
 * <p>The job spec must carry a {@code script} (batch script text); optional {@code partition},
 * {@code cpus}, {@code timeLimitMinutes} and {@code environment} (array of KEY=VALUE) are passed through.
 */
public final class SlurmCluster extends AbstractHttpCluster {

    private static final Logger log = LoggerFactory.getLogger(SlurmCluster.class);

    private final String apiVersion;
    private final String user;
    private final String token;
    private final String defaultPartition;

    public SlurmCluster(ClusterSettings settings) {
        super(settings);
        this.apiVersion = settings.property("api_version", "v0.0.39");
        this.user = settings.requireProperty("user");
        this.token = settings.property("token", null);
        this.defaultPartition = settings.property("partition", null);
    }

    @Override
    public StatusVocabulary vocabulary() {
        return StatusVocabulary.SLURM;
    }

    @Override
    protected void authorize(HttpRequest.Builder request) {
        request.header("X-SLURM-USER-NAME", user);
        if (token != null) {
            request.header("X-SLURM-USER-TOKEN", token);
        }
    }

    @Override
    protected void prepareSpec(Job job, JsonNode spec) {
        String script = spec.path("script").asText("");
        if (!script.startsWith("#!")) {
            throw new PreparationException("Job " + job.id() + ": slurm spec needs a 'script' starting with #!");
        }
        JsonNode env = spec.path("environment");
        if (!env.isMissingNode() && !env.isArray()) {
            throw new PreparationException("Job " + job.id() + ": 'environment' must be an array");
        }
    }

    @Override
    public String submit(Job job) {
        JsonNode spec = parseSpec(job);

        ObjectNode desc = MAPPER.createObjectNode();
        desc.put("name", job.id());
        desc.put("current_working_directory", spec.path("workingDirectory").asText("/tmp"));
        String partition = spec.path("partition").asText(defaultPartition);
        if (partition != null) {
            desc.put("partition", partition);
        }
        if (spec.has("cpus")) {
            desc.put("cpus_per_task", spec.get("cpus").asInt());
        }
        if (spec.has("timeLimitMinutes")) {
            desc.put("time_limit", spec.get("timeLimitMinutes").asInt());
        }
        ArrayNode environment = desc.putArray("environment");
        environment.add("BLACKCAP_JOB_ID=" + job.id());
        spec.path("environment").forEach(e -> environment.add(e.asText()));

        ObjectNode body = MAPPER.createObjectNode();
        body.put("script", spec.path("script").asText());
        body.set("job", desc);

        JsonNode response = post("/slurm/" + apiVersion + "/job/submit", body, Phase.SUBMIT);

        JsonNode errors = response.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            throw new PermanentSubmissionException("Slurm rejected job " + job.id() + ": " + errors);
        }
        JsonNode jobId = response.path("job_id");
        if (jobId.isMissingNode() || jobId.isNull()) {
            throw new SubmissionException("Slurm response for job " + job.id() + " carried no job_id");
        }
        log.info("Slurm cluster {} accepted job {} as {}", id(), job.id(), jobId.asText());
        return jobId.asText();
    }

    @Override
    public Iterable<String> getStatus(String externalJobId) {
        return new StatusSequence(() -> {
            JsonNode response = get("/slurm/" + apiVersion + "/job/" + externalJobId, Phase.STATUS);
            JsonNode jobs = response.path("jobs");
            if (!jobs.isArray() || jobs.isEmpty()) {
                throw new StatusQueryException("Slurm returned no jobs for id " + externalJobId);
            }
            List<String> states = new ArrayList<>();
            for (JsonNode node : jobs) {
                JsonNode state = node.path("job_state");
                // newer API versions return a list of flags, the first one is the base state
                if (state.isArray()) {
                    if (!state.isEmpty()) {
                        states.add(state.get(0).asText());
                    }
                } else if (!state.isMissingNode()) {
                    states.add(state.asText());
                }
            }
            return states;
        });
    }
}

package blackcap.coordinator.cluster;

import blackcap.coordinator.error.PreparationException;
import blackcap.coordinator.error.SubmissionException;
import blackcap.coordinator.model.Job;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpRequest;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Container-orchestrator backend creating Kubernetes {@code batch/v1} Jobs.
 *
 * <p>The job spec must carry an {@code image}; {@code command} (array) and {@code parallelism} are optional.
 * Status is one value per pod as counted by the Job controller.
 */
public final class KubernetesCluster extends AbstractHttpCluster {

    private static final Logger log = LoggerFactory.getLogger(KubernetesCluster.class);

    private final String namespace;
    private final String token;

    public KubernetesCluster(ClusterSettings settings) {
        super(settings);
        this.namespace = settings.property("namespace", "default");
        this.token = settings.property("token", null);
    }

    @Override
    public StatusVocabulary vocabulary() {
        return StatusVocabulary.KUBERNETES;
    }

    @Override
    protected void authorize(HttpRequest.Builder request) {
        if (token != null) {
            request.header("Authorization", "Bearer " + token);
        }
    }

    @Override
    protected void prepareSpec(Job job, JsonNode spec) {
        if (spec.path("image").asText("").isBlank()) {
            throw new PreparationException("Job " + job.id() + ": kubernetes spec needs an 'image'");
        }
        JsonNode command = spec.path("command");
        if (!command.isMissingNode() && !command.isArray()) {
            throw new PreparationException("Job " + job.id() + ": 'command' must be an array");
        }
        if (spec.path("parallelism").asInt(1) < 1) {
            throw new PreparationException("Job " + job.id() + ": parallelism must be positive");
        }
    }

    @Override
    public String submit(Job job) {
        JsonNode spec = parseSpec(job);
        int parallelism = spec.path("parallelism").asInt(1);

        ObjectNode manifest = MAPPER.createObjectNode();
        manifest.put("apiVersion", "batch/v1");
        manifest.put("kind", "Job");

        ObjectNode metadata = manifest.putObject("metadata");
        metadata.put("generateName", "blackcap-" + job.id().toLowerCase(Locale.ROOT) + "-");
        metadata.putObject("labels").put("blackcap/job-id", job.id());

        ObjectNode jobSpec = manifest.putObject("spec");
        jobSpec.put("backoffLimit", 0);
        jobSpec.put("parallelism", parallelism);
        jobSpec.put("completions", parallelism);

        ObjectNode podSpec = jobSpec.putObject("template").putObject("spec");
        podSpec.put("restartPolicy", "Never");
        ObjectNode container = podSpec.putArray("containers").addObject();
        container.put("name", "job");
        container.put("image", spec.get("image").asText());
        if (spec.has("command")) {
            ArrayNode command = container.putArray("command");
            spec.get("command").forEach(c -> command.add(c.asText()));
        }
        container.putArray("env").addObject()
                .put("name", "BLACKCAP_JOB_ID")
                .put("value", job.id());

        JsonNode response = post("/apis/batch/v1/namespaces/" + namespace + "/jobs", manifest, Phase.SUBMIT);
        String name = response.path("metadata").path("name").asText("");
        if (name.isEmpty()) {
            throw new SubmissionException("Kubernetes response for job " + job.id() + " carried no name");
        }
        log.info("Kubernetes cluster {} created Job {} for {}", id(), name, job.id());
        return name;
    }

    @Override
    public Iterable<String> getStatus(String externalJobId) {
        return new StatusSequence(() -> {
            JsonNode job = get("/apis/batch/v1/namespaces/" + namespace + "/jobs/" + externalJobId, Phase.STATUS);
            JsonNode status = job.path("status");

            for (JsonNode condition : status.path("conditions")) {
                if ("True".equals(condition.path("status").asText())) {
                    String type = condition.path("type").asText();
                    if ("Failed".equals(type)) {
                        return List.of("Failed");
                    }
                    if ("Complete".equals(type)) {
                        return List.of("Succeeded");
                    }
                }
            }

            List<String> phases = new ArrayList<>();
            phases.addAll(Collections.nCopies(status.path("active").asInt(0), "Running"));
            phases.addAll(Collections.nCopies(status.path("succeeded").asInt(0), "Succeeded"));
            phases.addAll(Collections.nCopies(status.path("failed").asInt(0), "Failed"));
            if (phases.isEmpty()) {
                phases.add("Pending");
            }
            return phases;
        });
    }
}

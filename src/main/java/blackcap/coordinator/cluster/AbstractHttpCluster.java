package blackcap.coordinator.cluster;

import blackcap.coordinator.error.PermanentSubmissionException;
import blackcap.coordinator.error.StatusQueryException;
import blackcap.coordinator.error.SubmissionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Base for backends reached over a JSON/HTTP API.
 * Classifies HTTP failures: network errors, 408, 429 and 5xx are retryable, other 4xx on submit are permanent.
 */
public abstract class AbstractHttpCluster extends AbstractCluster {

    protected enum Phase {
        SUBMIT,
        STATUS
    }

    private final HttpClient http;
    private final URI endpoint;
    private final Duration requestTimeout;

    protected AbstractHttpCluster(ClusterSettings settings) {
        super(settings.descriptor());
        this.endpoint = URI.create(stripTrailingSlash(settings.requireProperty("endpoint")));
        this.requestTimeout = settings.durationMsProperty("request_timeout_ms", Duration.ofSeconds(10));
        this.http = HttpClient.newBuilder()
                .connectTimeout(settings.durationMsProperty("connect_timeout_ms", Duration.ofSeconds(5)))
                .build();
    }

    /** Add backend credentials to an outgoing request. */
    protected abstract void authorize(HttpRequest.Builder request);

    protected URI endpoint() {
        return endpoint;
    }

    protected JsonNode get(String path, Phase phase) {
        return send(newRequest(path).GET(), phase);
    }

    protected JsonNode post(String path, JsonNode body, Phase phase) {
        String json;
        try {
            json = MAPPER.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new PermanentSubmissionException("Cannot encode request for " + id(), e);
        }
        return send(newRequest(path)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8)), phase);
    }

    private HttpRequest.Builder newRequest(String path) {
        HttpRequest.Builder request = HttpRequest.newBuilder(URI.create(endpoint + path))
                .timeout(requestTimeout)
                .header("Accept", "application/json");
        authorize(request);
        return request;
    }

    private JsonNode send(HttpRequest.Builder request, Phase phase) {
        HttpRequest built = request.build();
        HttpResponse<String> response;
        try {
            response = http.send(built, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw transientFailure(phase, built.method() + " " + built.uri() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw transientFailure(phase, "Interrupted calling " + built.uri(), e);
        }

        int code = response.statusCode();
        if (code >= 200 && code < 300) {
            try {
                return MAPPER.readTree(response.body());
            } catch (JsonProcessingException e) {
                throw transientFailure(phase, "Unreadable response from " + built.uri(), e);
            }
        }

        String message = built.method() + " " + built.uri() + " returned " + code + ": " + abbreviate(response.body());
        if (phase == Phase.SUBMIT && code >= 400 && code < 500 && code != 408 && code != 429) {
            throw new PermanentSubmissionException(message);
        }
        throw transientFailure(phase, message, null);
    }

    private static RuntimeException transientFailure(Phase phase, String message, Throwable cause) {
        return phase == Phase.SUBMIT
                ? new SubmissionException(message, cause)
                : new StatusQueryException(message, cause);
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 300 ? body.substring(0, 300) + "..." : body;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}

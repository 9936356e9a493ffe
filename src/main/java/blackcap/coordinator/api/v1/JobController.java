package blackcap.coordinator.api.v1;

import blackcap.coordinator.api.Controller;
import blackcap.coordinator.api.v1.dto.JobResponse;
import blackcap.coordinator.auth.AccessGuard;
import blackcap.coordinator.auth.Action;
import blackcap.coordinator.model.Job;
import blackcap.coordinator.model.JobStatus;
import blackcap.coordinator.schema.JobCreate;
import blackcap.coordinator.server.RouterHandler;
import blackcap.coordinator.service.JobService;
import com.fasterxml.jackson.core.type.TypeReference;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for Job management (public API).
 *
 * POST /api/v1/jobs - Create a new job
 * GET /api/v1/jobs?limit=N - Recent jobs
 * GET /api/v1/jobs/{jobId} - Get job status
 * POST /api/v1/jobs/{jobId}/cancel - Cancel a job
 */
public class JobController implements Controller {

    private static final Pattern JOBS_PATTERN = Pattern.compile("^/api/v1/jobs$");
    private static final Pattern JOB_BY_ID_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)$");
    private static final Pattern JOB_CANCEL_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)/cancel$");

    private static final int DEFAULT_LIMIT = 50;
    private static final int MAX_LIMIT = 500;

    private final JobService jobService;
    private final AccessGuard accessGuard;

    public JobController(JobService jobService, AccessGuard accessGuard) {
        this.jobService = jobService;
        this.accessGuard = accessGuard;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return JOBS_PATTERN.matcher(path).matches() || JOB_CANCEL_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return JOBS_PATTERN.matcher(path).matches() || JOB_BY_ID_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        if (req.method().equals(HttpMethod.POST) && JOBS_PATTERN.matcher(path).matches()) {
            return handleCreateJob(req);
        }

        Matcher cancelMatcher = JOB_CANCEL_PATTERN.matcher(path);
        if (req.method().equals(HttpMethod.POST) && cancelMatcher.matches()) {
            Job job = jobService.cancelJob(Controller.sessionToken(req), cancelMatcher.group(1));
            return ControllerResponse.json(RouterHandler.writeJson(JobResponse.from(job)));
        }

        accessGuard.require(Controller.sessionToken(req), Action.READ);

        if (JOBS_PATTERN.matcher(path).matches()) {
            return handleListJobs(req);
        }

        Matcher jobMatcher = JOB_BY_ID_PATTERN.matcher(path);
        if (jobMatcher.matches()) {
            Job job = jobService.getJob(jobMatcher.group(1));
            return ControllerResponse.json(RouterHandler.writeJson(JobResponse.from(job)));
        }

        return ControllerResponse.notFound("unknown job endpoint");
    }

    /**
     * POST /api/v1/jobs - Create a new job
     */
    private ControllerResponse handleCreateJob(FullHttpRequest req) {
        JobCreate request = RouterHandler.readJson(req, new TypeReference<JobCreate>() {
        });
        Job job = jobService.submitJob(Controller.sessionToken(req), request);
        return ControllerResponse.json(HttpResponseStatus.CREATED, RouterHandler.writeJson(JobResponse.from(job)));
    }

    /**
     * GET /api/v1/jobs - Recent jobs, newest first, or with ?status= the jobs in that status, oldest first
     */
    private ControllerResponse handleListJobs(FullHttpRequest req) {
        Map<String, List<String>> params = new QueryStringDecoder(req.uri()).parameters();
        List<String> limitParam = params.get("limit");
        int limit = DEFAULT_LIMIT;
        if (limitParam != null && !limitParam.isEmpty()) {
            try {
                limit = Integer.parseInt(limitParam.get(0));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("limit must be an integer", e);
            }
            if (limit < 1 || limit > MAX_LIMIT) {
                throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
            }
        }

        List<String> statusParam = params.get("status");
        List<Job> found = statusParam == null || statusParam.isEmpty()
                ? jobService.findRecent(limit)
                : jobService.findByStatus(parseStatus(statusParam.get(0)), limit);

        List<JobResponse> jobs = found.stream()
                .map(JobResponse::from)
                .map(JobResponse::compact)
                .toList();
        return ControllerResponse.json(RouterHandler.writeJson(Map.of("jobs", jobs)));
    }

    private static JobStatus parseStatus(String value) {
        try {
            return JobStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown job status: " + value, e);
        }
    }
}

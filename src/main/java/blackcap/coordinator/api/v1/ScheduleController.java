package blackcap.coordinator.api.v1;

import blackcap.coordinator.api.Controller;
import blackcap.coordinator.api.v1.dto.ScheduleResponse;
import blackcap.coordinator.auth.SessionToken;
import blackcap.coordinator.model.Schedule;
import blackcap.coordinator.schema.ItemResult;
import blackcap.coordinator.schema.ScheduleCreate;
import blackcap.coordinator.schema.ScheduleDelete;
import blackcap.coordinator.schema.ScheduleGetQueryParams;
import blackcap.coordinator.schema.ScheduleUpdate;
import blackcap.coordinator.server.RouterHandler;
import blackcap.coordinator.service.ScheduleService;
import com.fasterxml.jackson.core.type.TypeReference;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.QueryStringDecoder;

import java.util.List;
import java.util.Map;

/**
 * Controller for schedules (public API). Write endpoints take a JSON list and answer per item.
 *
 * POST /api/v1/schedules - Schedule jobs; the scheduler picks the clusters
 * GET /api/v1/schedules?query_type=job_id&value=... - Look up schedules
 * PUT /api/v1/schedules - Update schedules
 * DELETE /api/v1/schedules - Soft-delete schedules
 */
public class ScheduleController implements Controller {

    private static final String SCHEDULES_PATH = "/api/v1/schedules";

    private final ScheduleService scheduleService;

    public ScheduleController(ScheduleService scheduleService) {
        this.scheduleService = scheduleService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return SCHEDULES_PATH.equals(path)
                && (method.equals(HttpMethod.POST) || method.equals(HttpMethod.GET)
                        || method.equals(HttpMethod.PUT) || method.equals(HttpMethod.DELETE));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        SessionToken token = Controller.sessionToken(req);
        HttpMethod method = req.method();

        if (method.equals(HttpMethod.GET)) {
            return handleGet(req, token);
        }
        if (method.equals(HttpMethod.POST)) {
            List<ScheduleCreate> requests = RouterHandler.readJson(req, new TypeReference<List<ScheduleCreate>>() {
            });
            return RouterHandler.batch(toResponses(scheduleService.create(token, requests)));
        }
        if (method.equals(HttpMethod.PUT)) {
            List<ScheduleUpdate> updates = RouterHandler.readJson(req, new TypeReference<List<ScheduleUpdate>>() {
            });
            return RouterHandler.batch(toResponses(scheduleService.update(token, updates)));
        }
        List<ScheduleDelete> deletes = RouterHandler.readJson(req, new TypeReference<List<ScheduleDelete>>() {
        });
        return RouterHandler.batch(scheduleService.delete(token, deletes));
    }

    private ControllerResponse handleGet(FullHttpRequest req, SessionToken token) {
        Map<String, List<String>> params = new QueryStringDecoder(req.uri()).parameters();
        ScheduleGetQueryParams query = new ScheduleGetQueryParams(
                first(params, "query_type"),
                first(params, "value"),
                Boolean.parseBoolean(first(params, "include_deleted")));

        List<ScheduleResponse> schedules = scheduleService.get(token, query).stream()
                .map(ScheduleResponse::from)
                .toList();
        return ControllerResponse.json(RouterHandler.writeJson(Map.of("schedules", schedules)));
    }

    private static List<ItemResult<ScheduleResponse>> toResponses(
            List<ItemResult<Schedule>> results) {
        return results.stream().map(r -> r.map(ScheduleResponse::from)).toList();
    }

    private static String first(Map<String, List<String>> params, String name) {
        List<String> values = params.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}

package blackcap.coordinator.api.v1;

import blackcap.coordinator.api.Controller;
import blackcap.coordinator.api.v1.dto.HealthResponse;
import blackcap.coordinator.cluster.ClusterRegistry;
import blackcap.coordinator.service.ScheduleStore;
import blackcap.coordinator.store.Database;
import blackcap.coordinator.server.RouterHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * Health check controller. No session required.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final Database database;
    private final ClusterRegistry clusters;
    private final ScheduleStore scheduleStore;
    private final BooleanSupplier loopsRunning;

    public HealthController(Database database, ClusterRegistry clusters, ScheduleStore scheduleStore,
            BooleanSupplier loopsRunning) {
        this.database = database;
        this.clusters = clusters;
        this.scheduleStore = scheduleStore;
        this.loopsRunning = loopsRunning;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        if (!database.isHealthy()) {
            return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                    RouterHandler.writeJson(HealthResponse.unhealthy("connection failed")));
        }

        try {
            HealthResponse response = HealthResponse.healthy(
                    formatUptime(),
                    VERSION,
                    clusters.size(),
                    scheduleStore.findActive().size(),
                    loopsRunning.getAsBoolean());
            return ControllerResponse.json(RouterHandler.writeJson(response));
        } catch (RuntimeException e) {
            log.error("Health check failed", e);
            return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                    RouterHandler.writeJson(HealthResponse.unhealthy(e.getMessage())));
        }
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}

package blackcap.coordinator.api.v1;

import blackcap.coordinator.api.Controller;
import blackcap.coordinator.api.v1.dto.ClusterResponse;
import blackcap.coordinator.auth.AccessGuard;
import blackcap.coordinator.auth.Action;
import blackcap.coordinator.cluster.Cluster;
import blackcap.coordinator.cluster.ClusterRegistry;
import blackcap.coordinator.model.ClusterCapacity;
import blackcap.coordinator.model.ClusterDescriptor;
import blackcap.coordinator.server.RouterHandler;
import blackcap.coordinator.service.ScheduleStore;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Cluster listing.
 * GET /api/v1/clusters
 */
public class ClusterController implements Controller {

    private final ClusterRegistry clusters;
    private final ScheduleStore scheduleStore;
    private final AccessGuard accessGuard;

    public ClusterController(ClusterRegistry clusters, ScheduleStore scheduleStore, AccessGuard accessGuard) {
        this.clusters = clusters;
        this.scheduleStore = scheduleStore;
        this.accessGuard = accessGuard;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/clusters".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        accessGuard.require(Controller.sessionToken(req), Action.READ);

        List<ClusterResponse> result = new ArrayList<>();
        for (Cluster cluster : clusters.all()) {
            ClusterDescriptor descriptor = cluster.descriptor();
            ClusterCapacity capacity = new ClusterCapacity(
                    scheduleStore.countActiveByCluster(descriptor.id()), descriptor.limit());
            result.add(ClusterResponse.from(descriptor, capacity));
        }
        return ControllerResponse.json(RouterHandler.writeJson(Map.of("clusters", result)));
    }
}

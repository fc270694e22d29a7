package runbroker.coordinator.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import runbroker.coordinator.api.Controller;
import runbroker.coordinator.api.v1.dto.HealthResponse;
import runbroker.coordinator.model.RunnerStatus;
import runbroker.coordinator.server.RouterHandler;
import runbroker.coordinator.service.CallbackProcessor;
import runbroker.coordinator.service.RunQueue;
import runbroker.coordinator.service.RunnerRegistry;
import runbroker.coordinator.service.SessionDirectory;

import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final String VERSION = "1.0.0";

    private final RunQueue runQueue;
    private final RunnerRegistry runnerRegistry;
    private final SessionDirectory sessions;
    private final CallbackProcessor callbacks;

    public HealthController(RunQueue runQueue, RunnerRegistry runnerRegistry, SessionDirectory sessions,
            CallbackProcessor callbacks) {
        this.runQueue = runQueue;
        this.runnerRegistry = runnerRegistry;
        this.sessions = sessions;
        this.callbacks = callbacks;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        Map<String, Integer> runs = new LinkedHashMap<>();
        runQueue.countsByStatus().forEach((status, n) -> runs.put(status.wireName(), n));

        int pendingCallbacks = callbacks.pendingCounts().values().stream().mapToInt(Integer::intValue).sum();

        HealthResponse response = HealthResponse.healthy(
                formatUptime(),
                VERSION,
                runnerRegistry.countByStatus(RunnerStatus.ONLINE),
                sessions.count(),
                runs,
                pendingCallbacks);

        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}

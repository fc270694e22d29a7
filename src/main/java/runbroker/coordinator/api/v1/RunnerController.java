package runbroker.coordinator.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import runbroker.coordinator.api.Controller;
import runbroker.coordinator.api.v1.dto.RunnerInfoResponse;
import runbroker.coordinator.server.RouterHandler;
import runbroker.coordinator.service.RunnerService;

import java.util.List;
import java.util.Map;

/**
 * Controller for runner public API.
 * GET /api/v1/runners - List all runners, most recent heartbeat first
 */
public class RunnerController implements Controller {

    private final RunnerService runnerService;

    public RunnerController(RunnerService runnerService) {
        this.runnerService = runnerService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/runners".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        List<RunnerInfoResponse> runners = RunnerInfoResponse.from(runnerService.findAll());
        Map<String, Object> response = Map.of("runners", runners);
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }
}

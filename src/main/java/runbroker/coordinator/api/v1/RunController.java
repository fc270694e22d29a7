package runbroker.coordinator.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.QueryStringDecoder;
import runbroker.coordinator.api.Controller;
import runbroker.coordinator.api.v1.dto.RunListResponse;
import runbroker.coordinator.api.v1.dto.RunResponse;
import runbroker.coordinator.api.v1.dto.StopRunResponse;
import runbroker.coordinator.api.v1.dto.SubmitRunRequest;
import runbroker.coordinator.api.v1.dto.SubmitRunResponse;
import runbroker.coordinator.model.Run;
import runbroker.coordinator.model.RunStatus;
import runbroker.coordinator.server.RouterHandler;
import runbroker.coordinator.service.NotFoundException;
import runbroker.coordinator.service.RunService;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for run public API.
 * POST /api/v1/runs - Submit a run
 * GET /api/v1/runs - List runs (optional ?status=)
 * GET /api/v1/runs/{runId} - Get run details
 * POST /api/v1/runs/{runId}/stop - Request a stop
 *
 * Exceptions bubble to RouterHandler for proper error responses.
 */
public class RunController implements Controller {

    private static final Pattern RUNS_PATTERN = Pattern.compile("^/api/v1/runs/?$");
    private static final Pattern RUN_PATTERN = Pattern.compile("^/api/v1/runs/([^/]+)$");
    private static final Pattern STOP_PATTERN = Pattern.compile("^/api/v1/runs/([^/]+)/stop$");

    private final RunService runService;

    public RunController(RunService runService) {
        this.runService = runService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return RUNS_PATTERN.matcher(path).matches() || STOP_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return RUNS_PATTERN.matcher(path).matches() || RUN_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        if (RUNS_PATTERN.matcher(path).matches()) {
            return req.method().equals(HttpMethod.POST) ? handleSubmit(req) : handleList(req);
        }

        Matcher stopMatcher = STOP_PATTERN.matcher(path);
        if (stopMatcher.matches()) {
            return handleStop(stopMatcher.group(1));
        }

        Matcher runMatcher = RUN_PATTERN.matcher(path);
        if (runMatcher.matches()) {
            return handleGet(runMatcher.group(1));
        }

        return ControllerResponse.notFound("unknown run endpoint");
    }

    /**
     * POST /api/v1/runs
     */
    private ControllerResponse handleSubmit(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw new IllegalArgumentException("request body is required");
        }
        SubmitRunRequest request = RouterHandler.mapper().readValue(body, SubmitRunRequest.class);

        // Validate
        request.validate();

        Run run = runService.submit(request.toSubmitRun());
        return ControllerResponse.created(
                RouterHandler.mapper().writeValueAsString(SubmitRunResponse.from(run)));
    }

    /**
     * GET /api/v1/runs
     */
    private ControllerResponse handleList(FullHttpRequest req) throws Exception {
        QueryStringDecoder decoder = new QueryStringDecoder(req.uri());
        List<String> statusParam = decoder.parameters().get("status");

        Optional<RunStatus> status = Optional.empty();
        if (statusParam != null && !statusParam.isEmpty()) {
            status = Optional.of(RunStatus.fromWire(statusParam.get(0)));
        }

        List<Run> runs = runService.findAll(status);
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(RunListResponse.from(runs)));
    }

    /**
     * GET /api/v1/runs/{runId}
     */
    private ControllerResponse handleGet(String runId) throws Exception {
        Run run = runService.findById(runId).orElseThrow(() -> NotFoundException.run(runId));
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(RunResponse.from(run)));
    }

    /**
     * POST /api/v1/runs/{runId}/stop
     */
    private ControllerResponse handleStop(String runId) throws Exception {
        Run run = runService.stop(runId);
        StopRunResponse response = new StopRunResponse(run.id(), run.status().wireName());
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }
}

package runbroker.coordinator.api.internal.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import runbroker.coordinator.api.Controller;
import runbroker.coordinator.api.internal.v1.dto.OperationResponse;
import runbroker.coordinator.api.internal.v1.dto.RunReportRequest;
import runbroker.coordinator.model.Run;
import runbroker.coordinator.server.RouterHandler;
import runbroker.coordinator.service.RunService;

import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for run progress reports (runner API).
 * POST /internal/v1/runs/{runId}/started
 * POST /internal/v1/runs/{runId}/completed
 * POST /internal/v1/runs/{runId}/failed
 * POST /internal/v1/runs/{runId}/stopped
 *
 * A report from the wrong runner, or for a run in a state that does not
 * allow it, is answered with 409 and changes nothing.
 */
public class RunReportController implements Controller {

    private static final Pattern REPORT_PATTERN =
            Pattern.compile("^/internal/v1/runs/([^/]+)/(started|completed|failed|stopped)$");

    private final RunService runService;

    public RunReportController(RunService runService) {
        this.runService = runService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && REPORT_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        Matcher matcher = REPORT_PATTERN.matcher(path);
        if (!matcher.matches()) {
            return ControllerResponse.notFound("unknown run report endpoint");
        }
        String runId = matcher.group(1);
        String event = matcher.group(2);

        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw new IllegalArgumentException("runner_id is required");
        }
        RunReportRequest request = RouterHandler.mapper().readValue(body, RunReportRequest.class);

        // Validate
        request.validate();

        Run run = switch (event) {
            case "started" -> runService.reportStarted(runId, request.runnerId());
            case "completed" -> runService.reportCompleted(runId, request.runnerId(), request.result());
            case "failed" -> runService.reportFailed(runId, request.runnerId(), request.error());
            default -> runService.reportStopped(runId, request.runnerId());
        };

        OperationResponse response = OperationResponse.success(run.status().wireName());
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }
}

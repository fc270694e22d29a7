package runbroker.coordinator.api.internal.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import runbroker.coordinator.api.Controller;
import runbroker.coordinator.api.internal.v1.dto.OperationResponse;
import runbroker.coordinator.api.internal.v1.dto.RegisterRunnerRequest;
import runbroker.coordinator.api.internal.v1.dto.RegisterRunnerResponse;
import runbroker.coordinator.api.internal.v1.dto.RunnerIdRequest;
import runbroker.coordinator.config.CoordinatorConfig;
import runbroker.coordinator.model.Runner;
import runbroker.coordinator.server.RouterHandler;
import runbroker.coordinator.service.RunnerService;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;

/**
 * Controller for runner registration and liveness (runner API).
 * POST /internal/v1/runners/register - Register new runner
 * POST /internal/v1/runners/heartbeat - Runner heartbeat
 * POST /internal/v1/runners/deregister - Deregister a runner
 */
public class RegistrationController implements Controller {

    private static final String REGISTER = "/internal/v1/runners/register";
    private static final String HEARTBEAT = "/internal/v1/runners/heartbeat";
    private static final String DEREGISTER = "/internal/v1/runners/deregister";

    private final RunnerService runnerService;
    private final CoordinatorConfig config;

    public RegistrationController(RunnerService runnerService, CoordinatorConfig config) {
        this.runnerService = runnerService;
        this.config = config;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (!method.equals(HttpMethod.POST)) {
            return false;
        }
        return REGISTER.equals(path) || HEARTBEAT.equals(path) || DEREGISTER.equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        return switch (path) {
            case REGISTER -> handleRegister(ctx, req);
            case HEARTBEAT -> handleHeartbeat(req);
            default -> handleDeregister(req);
        };
    }

    /**
     * POST /internal/v1/runners/register
     */
    private ControllerResponse handleRegister(ChannelHandlerContext ctx, FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        RegisterRunnerRequest request = body.isBlank()
                ? new RegisterRunnerRequest(null, null, null, null)
                : RouterHandler.mapper().readValue(body, RegisterRunnerRequest.class);

        // Validate
        request.validate();

        String hostname = request.hostname() != null ? request.hostname() : remoteHost(ctx);
        Runner runner = runnerService.register(request.tagsOrEmpty(), request.profile(), request.strict(), hostname);

        RegisterRunnerResponse response = new RegisterRunnerResponse(
                runner.id(),
                config.maxPollWait().toSeconds(),
                config.heartbeatInterval().toSeconds());
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * POST /internal/v1/runners/heartbeat
     */
    private ControllerResponse handleHeartbeat(FullHttpRequest req) throws Exception {
        RunnerIdRequest request = readRunnerId(req);
        runnerService.heartbeat(request.runnerId());
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(OperationResponse.success()));
    }

    /**
     * POST /internal/v1/runners/deregister
     */
    private ControllerResponse handleDeregister(FullHttpRequest req) throws Exception {
        RunnerIdRequest request = readRunnerId(req);
        runnerService.deregister(request.runnerId(), request.selfInitiated());
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(OperationResponse.success()));
    }

    private static RunnerIdRequest readRunnerId(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw new IllegalArgumentException("runner_id is required");
        }
        RunnerIdRequest request = RouterHandler.mapper().readValue(body, RunnerIdRequest.class);
        request.validate();
        return request;
    }

    private static String remoteHost(ChannelHandlerContext ctx) {
        SocketAddress address = ctx.channel().remoteAddress();
        if (address instanceof InetSocketAddress inet) {
            return inet.getHostString();
        }
        return null;
    }
}

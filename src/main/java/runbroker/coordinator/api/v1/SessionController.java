package runbroker.coordinator.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.QueryStringDecoder;
import runbroker.coordinator.api.Controller;
import runbroker.coordinator.api.v1.dto.DeleteSessionResponse;
import runbroker.coordinator.api.v1.dto.SessionResponse;
import runbroker.coordinator.server.RouterHandler;
import runbroker.coordinator.service.SessionService;

import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for sessions.
 * GET /api/v1/sessions/{name} - Busy/idle state and queued callbacks
 * DELETE /api/v1/sessions/{name} - Forget a session and its queued callbacks
 */
public class SessionController implements Controller {

    private static final Pattern SESSION_PATTERN = Pattern.compile("^/api/v1/sessions/([^/]+)$");

    private final SessionService sessionService;

    public SessionController(SessionService sessionService) {
        this.sessionService = sessionService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return (method.equals(HttpMethod.GET) || method.equals(HttpMethod.DELETE))
                && SESSION_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        Matcher matcher = SESSION_PATTERN.matcher(path);
        if (!matcher.matches()) {
            return ControllerResponse.notFound("unknown session endpoint");
        }
        String name = QueryStringDecoder.decodeComponent(matcher.group(1), StandardCharsets.UTF_8);

        if (req.method().equals(HttpMethod.DELETE)) {
            int cleared = sessionService.delete(name);
            return ControllerResponse.json(
                    RouterHandler.mapper().writeValueAsString(new DeleteSessionResponse(true, cleared)));
        }

        SessionResponse response = SessionResponse.from(sessionService.get(name));
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }
}

package runbroker.coordinator.api.internal.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.QueryStringDecoder;
import runbroker.coordinator.api.Controller;
import runbroker.coordinator.api.internal.v1.dto.PollResponse;
import runbroker.coordinator.model.PollResult;
import runbroker.coordinator.server.RouterHandler;
import runbroker.coordinator.service.LongPollDispatcher;

import java.time.Duration;
import java.util.List;

/**
 * Long-poll endpoint (runner API).
 * GET /internal/v1/runners/poll?runner_id=...&max_wait=seconds
 *
 * Blocks the handler thread until there is a run, a stop command or a
 * deregistration for the runner; answers 204 when the wait runs out.
 */
public class PollController implements Controller {

    private static final String POLL = "/internal/v1/runners/poll";

    private final LongPollDispatcher dispatcher;

    public PollController(LongPollDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && POLL.equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        QueryStringDecoder decoder = new QueryStringDecoder(req.uri());

        String runnerId = first(decoder, "runner_id");
        if (runnerId == null || runnerId.isBlank()) {
            throw new IllegalArgumentException("runner_id is required");
        }

        Duration maxWait = null;
        String maxWaitParam = first(decoder, "max_wait");
        if (maxWaitParam != null && !maxWaitParam.isBlank()) {
            try {
                maxWait = Duration.ofMillis(Math.round(Double.parseDouble(maxWaitParam.trim()) * 1000));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("max_wait must be a number of seconds");
            }
        }

        PollResult result = dispatcher.poll(runnerId, maxWait);
        if (result.isEmpty()) {
            return ControllerResponse.noContent();
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(PollResponse.from(result)));
    }

    private static String first(QueryStringDecoder decoder, String name) {
        List<String> values = decoder.parameters().get(name);
        return (values == null || values.isEmpty()) ? null : values.get(0);
    }
}

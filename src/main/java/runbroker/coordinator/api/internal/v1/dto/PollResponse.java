package runbroker.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import runbroker.coordinator.api.v1.dto.RunResponse;
import runbroker.coordinator.model.PollResult;

import java.util.List;

/**
 * Response DTO for a long-poll that returned something.
 * Exactly one field is present. An empty poll is answered with 204 instead.
 * GET /internal/v1/runners/poll
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PollResponse(
        @JsonProperty("run") RunResponse run,
        @JsonProperty("stop_runs") List<String> stopRuns,
        @JsonProperty("deregistered") Boolean deregistered) {

    public static PollResponse from(PollResult result) {
        if (result.deregistered()) {
            return new PollResponse(null, null, true);
        }
        if (result.hasStops()) {
            return new PollResponse(null, result.stopRuns(), null);
        }
        return new PollResponse(result.hasRun() ? RunResponse.from(result.run()) : null, null, null);
    }
}

package runbroker.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import runbroker.coordinator.model.Run;

/**
 * Response DTO for run submission.
 * POST /api/v1/runs
 */
public record SubmitRunResponse(
        @JsonProperty("run_id") String runId,
        @JsonProperty("session_name") String sessionName,
        @JsonProperty("status") String status) {

    public static SubmitRunResponse from(Run run) {
        return new SubmitRunResponse(run.id(), run.sessionName(), run.status().wireName());
    }
}

package runbroker.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * POST /api/v1/runs/{run_id}/stop
 */
public record StopRunResponse(
        @JsonProperty("run_id") String runId,
        @JsonProperty("status") String status) {
}

package runbroker.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for run progress reports.
 * POST /internal/v1/runs/{run_id}/started|completed|failed|stopped
 */
public record RunReportRequest(
        @JsonProperty("runner_id") String runnerId,
        @JsonProperty("error") String error,
        @JsonProperty("result") String result) {

    public void validate() {
        if (runnerId == null || runnerId.isBlank()) {
            throw new IllegalArgumentException("runner_id is required");
        }
    }
}

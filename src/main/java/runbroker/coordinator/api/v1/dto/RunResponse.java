package runbroker.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import runbroker.coordinator.model.DemandSpec;
import runbroker.coordinator.model.Run;

import java.time.Instant;

/**
 * Full view of a run. Also the body of the {@code run} field in a poll response.
 * GET /api/v1/runs/{run_id}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunResponse(
        @JsonProperty("run_id") String runId,
        @JsonProperty("kind") String kind,
        @JsonProperty("session_name") String sessionName,
        @JsonProperty("parent_session_name") String parentSessionName,
        @JsonProperty("payload") String payload,
        @JsonProperty("demand") DemandSpec demand,
        @JsonProperty("status") String status,
        @JsonProperty("runner_id") String runnerId,
        @JsonProperty("last_runner_id") String lastRunnerId,
        @JsonProperty("error") String error,
        @JsonProperty("result") String result,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("claimed_at") Instant claimedAt,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("completed_at") Instant completedAt) {

    /** Create response from domain model */
    public static RunResponse from(Run run) {
        return new RunResponse(
                run.id(),
                run.kind().wireName(),
                run.sessionName(),
                run.parentSessionName(),
                run.payload(),
                run.demand().isEmpty() ? null : run.demand(),
                run.status().wireName(),
                run.runnerId(),
                run.lastRunnerId(),
                run.error(),
                run.result(),
                run.createdAt(),
                run.claimedAt(),
                run.startedAt(),
                run.completedAt());
    }
}

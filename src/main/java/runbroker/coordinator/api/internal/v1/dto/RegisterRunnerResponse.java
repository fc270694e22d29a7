package runbroker.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for runner registration.
 * Tells the runner how long to poll and how often to heartbeat.
 */
public record RegisterRunnerResponse(
        @JsonProperty("runner_id") String runnerId,
        @JsonProperty("poll_timeout_seconds") long pollTimeoutSeconds,
        @JsonProperty("heartbeat_interval_seconds") long heartbeatIntervalSeconds) {
}

package runbroker.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import runbroker.coordinator.model.Runner;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Response DTO for runner information.
 * GET /api/v1/runners
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunnerInfoResponse(
        @JsonProperty("runner_id") String runnerId,
        @JsonProperty("status") String status,
        @JsonProperty("tags") Set<String> tags,
        @JsonProperty("profile") String profile,
        @JsonProperty("strict_tags") boolean strictTags,
        @JsonProperty("hostname") String hostname,
        @JsonProperty("registered_at") Instant registeredAt,
        @JsonProperty("last_heartbeat") Instant lastHeartbeat,
        @JsonProperty("seconds_since_heartbeat") Double secondsSinceHeartbeat) {

    /** Create response from domain model */
    public static RunnerInfoResponse from(Runner runner, Instant now) {
        Double since = runner.lastHeartbeat() == null
                ? null
                : Duration.between(runner.lastHeartbeat(), now).toMillis() / 1000.0;
        return new RunnerInfoResponse(
                runner.id(),
                runner.status().name(),
                runner.tags(),
                runner.profile(),
                runner.strictTags(),
                runner.hostname(),
                runner.registeredAt(),
                runner.lastHeartbeat(),
                since);
    }

    public static List<RunnerInfoResponse> from(List<Runner> runners) {
        Instant now = Instant.now();
        return runners.stream().map(r -> from(r, now)).toList();
    }
}

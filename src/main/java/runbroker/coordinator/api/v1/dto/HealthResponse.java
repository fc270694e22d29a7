package runbroker.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("runners_online") int runnersOnline,
        @JsonProperty("sessions") int sessions,
        @JsonProperty("runs") Map<String, Integer> runs,
        @JsonProperty("pending_callbacks") int pendingCallbacks) {

    public static HealthResponse healthy(String uptime, String version, int runnersOnline, int sessions,
            Map<String, Integer> runs, int pendingCallbacks) {
        return new HealthResponse("healthy", uptime, version, runnersOnline, sessions, runs, pendingCallbacks);
    }
}

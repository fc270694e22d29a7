package runbroker.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO carrying only the runner id.
 * POST /internal/v1/runners/heartbeat
 * POST /internal/v1/runners/deregister ({@code self} marks a runner shutting itself down)
 */
public record RunnerIdRequest(
        @JsonProperty("runner_id") String runnerId,
        @JsonProperty("self") Boolean self) {

    public void validate() {
        if (runnerId == null || runnerId.isBlank()) {
            throw new IllegalArgumentException("runner_id is required");
        }
    }

    public boolean selfInitiated() {
        return Boolean.TRUE.equals(self);
    }
}

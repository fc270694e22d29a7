package runbroker.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import runbroker.coordinator.model.DemandSpec;
import runbroker.coordinator.service.SessionService.SessionState;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for a session's busy/idle state and queued callbacks.
 * GET /api/v1/sessions/{name}
 */
public record SessionResponse(
        @JsonProperty("session_name") String sessionName,
        @JsonProperty("parent_session_name") String parentSessionName,
        @JsonProperty("affinity") @JsonInclude(JsonInclude.Include.NON_NULL) DemandSpec affinity,
        @JsonProperty("busy") boolean busy,
        @JsonProperty("pending_notifications") List<String> pendingNotifications,
        @JsonProperty("created_at") Instant createdAt) {

    public static SessionResponse from(SessionState state) {
        return new SessionResponse(
                state.session().name(),
                state.session().parentSessionName(),
                state.session().affinity().isEmpty() ? null : state.session().affinity(),
                state.busy(),
                state.pendingNotifications(),
                state.session().createdAt());
    }
}

package runbroker.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * DELETE /api/v1/sessions/{name}
 */
public record DeleteSessionResponse(
        @JsonProperty("ok") boolean ok,
        @JsonProperty("cleared_notifications") int clearedNotifications) {
}

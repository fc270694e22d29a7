package runbroker.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import runbroker.coordinator.model.DemandSpec;
import runbroker.coordinator.model.RunKind;
import runbroker.coordinator.model.SubmitRun;

/**
 * Request DTO for submitting a run.
 * POST /api/v1/runs
 */
public record SubmitRunRequest(
        @JsonProperty("session_name") String sessionName,
        @JsonProperty("kind") String kind,
        @JsonProperty("payload") String payload,
        @JsonProperty("parent_session_name") String parentSessionName,
        @JsonProperty("demand") DemandSpec demand) {

    public void validate() {
        if (sessionName == null || sessionName.isBlank()) {
            throw new IllegalArgumentException("session_name is required");
        }
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("kind is required");
        }
        RunKind.fromWire(kind);
        if (payload == null || payload.isBlank()) {
            throw new IllegalArgumentException("payload is required");
        }
    }

    /** Convert to the queue's request after {@link #validate()}. */
    public SubmitRun toSubmitRun() {
        return new SubmitRun(
                RunKind.fromWire(kind),
                sessionName,
                parentSessionName,
                payload,
                demand == null ? DemandSpec.none() : demand);
    }
}

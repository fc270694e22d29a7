package runbroker.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Generic response for runner API operations.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResponse(
        @JsonProperty("ok") boolean ok,
        @JsonProperty("status") String status) {

    /** Success response */
    public static OperationResponse success() {
        return new OperationResponse(true, null);
    }

    /** Success with the run's new status */
    public static OperationResponse success(String status) {
        return new OperationResponse(true, status);
    }
}

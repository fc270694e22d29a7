package runbroker.coordinator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * What a run does to its session.
 */
public enum RunKind {
    /** Start a new session */
    START,
    /** Continue an existing session (callbacks always use this) */
    RESUME;

    @JsonValue
    public String wireName() {
        return name();
    }

    @JsonCreator
    public static RunKind fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("kind is required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        // accept the longer names older runners send
        if (normalized.equals("START_SESSION")) {
            return START;
        }
        if (normalized.equals("RESUME_SESSION")) {
            return RESUME;
        }
        try {
            return RunKind.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown run kind: " + value);
        }
    }
}

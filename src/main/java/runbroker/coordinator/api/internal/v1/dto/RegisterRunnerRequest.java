package runbroker.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Set;

/**
 * Request DTO for runner registration. Every field is optional.
 * POST /internal/v1/runners/register
 */
public record RegisterRunnerRequest(
        @JsonProperty("tags") Set<String> tags,
        @JsonProperty("profile") String profile,
        @JsonProperty("strict_tags") Boolean strictTags,
        @JsonProperty("hostname") String hostname) {

    public void validate() {
        if (tags != null && tags.stream().anyMatch(t -> t == null || t.isBlank())) {
            throw new IllegalArgumentException("tags must not contain blank entries");
        }
    }

    public Set<String> tagsOrEmpty() {
        return tags == null ? Set.of() : tags;
    }

    public boolean strict() {
        return Boolean.TRUE.equals(strictTags);
    }
}

package runbroker.coordinator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Constraints a run places on the runners allowed to claim it.
 * A runner qualifies when its profile equals {@code profile} (if set) and its
 * tag set contains every tag in {@code tags}.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record DemandSpec(
        @JsonProperty("profile") String profile,
        @JsonProperty("tags") Set<String> tags) {

    private static final DemandSpec NONE = new DemandSpec(null, Set.of());

    public DemandSpec {
        profile = (profile == null || profile.isBlank()) ? null : profile.trim();
        tags = normalizeTags(tags);
    }

    public static DemandSpec none() {
        return NONE;
    }

    public static DemandSpec ofTags(String... tags) {
        return new DemandSpec(null, Set.of(tags));
    }

    public static DemandSpec ofProfile(String profile) {
        return new DemandSpec(profile, Set.of());
    }

    public boolean hasProfile() {
        return profile != null;
    }

    public boolean hasTags() {
        return !tags.isEmpty();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return !hasProfile() && !hasTags();
    }

    /**
     * Combine two demand sets. {@code primary} keeps its profile when set,
     * tags are unioned, so merging only ever adds constraints.
     */
    public static DemandSpec merge(DemandSpec primary, DemandSpec additional) {
        if (primary == null) {
            return additional == null ? NONE : additional;
        }
        if (additional == null) {
            return primary;
        }
        Set<String> union = new LinkedHashSet<>(primary.tags());
        union.addAll(additional.tags());
        return new DemandSpec(primary.hasProfile() ? primary.profile() : additional.profile(), union);
    }

    static Set<String> normalizeTags(Collection<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return Set.of();
        }
        Set<String> out = new LinkedHashSet<>();
        for (String t : raw) {
            if (t != null && !t.isBlank()) {
                out.add(t.trim());
            }
        }
        return Set.copyOf(out);
    }
}

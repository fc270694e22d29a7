package runbroker.coordinator.service;

import runbroker.coordinator.model.DemandSpec;
import runbroker.coordinator.model.Runner;

import java.util.Collections;
import java.util.Set;

/**
 * Decides whether a runner may claim a run. Pure functions, no locking.
 *
 * <p>Demanded tags use subset semantics (runner tags must contain all of them).
 * The strict-tags guard uses intersection semantics: a strict runner with tags
 * only takes runs that name at least one of its tags.
 */
public final class DemandMatcher {

    private DemandMatcher() {
    }

    public static boolean matches(DemandSpec demand, Runner runner) {
        DemandSpec d = demand == null ? DemandSpec.none() : demand;

        if (runner.strictTags() && !runner.tags().isEmpty() && !intersects(d.tags(), runner.tags())) {
            return false;
        }
        if (d.hasProfile() && !d.profile().equals(runner.profile())) {
            return false;
        }
        return !d.hasTags() || isSubset(d.tags(), runner.tags());
    }

    public static boolean isSubset(Set<String> required, Set<String> offered) {
        return offered.containsAll(required);
    }

    public static boolean intersects(Set<String> a, Set<String> b) {
        return !Collections.disjoint(a, b);
    }
}

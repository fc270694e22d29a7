package runbroker.coordinator.service;

import runbroker.coordinator.model.DemandSpec;
import runbroker.coordinator.model.Runner;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DemandMatcherTest {

    private static Runner runner(String profile, boolean strict, String... tags) {
        return Runner.builder()
                .id("rnr_test")
                .profile(profile)
                .strictTags(strict)
                .tags(Set.of(tags))
                .build();
    }

    @Test
    void noDemandMatchesAnyNonStrictRunner() {
        assertTrue(DemandMatcher.matches(DemandSpec.none(), runner(null, false)));
        assertTrue(DemandMatcher.matches(DemandSpec.none(), runner("linux", false, "gpu")));
        assertTrue(DemandMatcher.matches(null, runner(null, false, "gpu")));
    }

    @Test
    void profileMustBeEqual() {
        DemandSpec linux = DemandSpec.ofProfile("linux");

        assertTrue(DemandMatcher.matches(linux, runner("linux", false)));
        assertFalse(DemandMatcher.matches(linux, runner("mac", false)));
        assertFalse(DemandMatcher.matches(linux, runner(null, false)));
    }

    @Test
    void demandedTagsMustBeSubsetOfRunnerTags() {
        DemandSpec gpuFast = DemandSpec.ofTags("gpu", "fast");

        assertTrue(DemandMatcher.matches(gpuFast, runner(null, false, "gpu", "fast", "big")));
        assertFalse(DemandMatcher.matches(gpuFast, runner(null, false, "gpu")));
        assertFalse(DemandMatcher.matches(gpuFast, runner(null, false)));
    }

    @Test
    void profileAndTagsAreCombined() {
        DemandSpec spec = new DemandSpec("linux", Set.of("gpu"));

        assertTrue(DemandMatcher.matches(spec, runner("linux", false, "gpu")));
        assertFalse(DemandMatcher.matches(spec, runner("mac", false, "gpu")));
        assertFalse(DemandMatcher.matches(spec, runner("linux", false, "cpu")));
    }

    @Test
    void strictRunnerRejectsRunsWithoutItsTags() {
        Runner strict = runner(null, true, "gpu", "secure");

        assertFalse(DemandMatcher.matches(DemandSpec.none(), strict));
        assertFalse(DemandMatcher.matches(DemandSpec.ofProfile("linux"), strict));
        assertFalse(DemandMatcher.matches(DemandSpec.ofTags("other"), strict));
        assertTrue(DemandMatcher.matches(DemandSpec.ofTags("gpu"), strict));
        assertTrue(DemandMatcher.matches(DemandSpec.ofTags("gpu", "secure"), strict));
    }

    @Test
    void strictRunnerWithoutTagsBehavesNormally() {
        Runner strictNoTags = runner(null, true);

        assertTrue(DemandMatcher.matches(DemandSpec.none(), strictNoTags));
        assertFalse(DemandMatcher.matches(DemandSpec.ofTags("gpu"), strictNoTags));
    }
}

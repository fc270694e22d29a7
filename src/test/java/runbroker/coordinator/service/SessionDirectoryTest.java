package runbroker.coordinator.service;

import runbroker.coordinator.model.DemandSpec;
import runbroker.coordinator.model.Session;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SessionDirectoryTest {

    @Test
    void touchCreatesSessionAndParent() {
        SessionDirectory directory = new SessionDirectory();

        Session child = directory.touch("child", "parent", DemandSpec.none());

        assertEquals("parent", child.parentSessionName());
        assertTrue(directory.exists("parent"));
        assertFalse(directory.find("parent").orElseThrow().hasParent());
        assertEquals(2, directory.count());
    }

    @Test
    void laterParentReplacesEarlierOne() {
        SessionDirectory directory = new SessionDirectory();
        directory.touch("child", "p1", DemandSpec.none());

        directory.touch("child", null, DemandSpec.none());
        assertEquals("p1", directory.find("child").orElseThrow().parentSessionName());

        directory.touch("child", "p2", DemandSpec.none());
        assertEquals("p2", directory.find("child").orElseThrow().parentSessionName());
    }

    @Test
    void deleteForgetsSession() {
        SessionDirectory directory = new SessionDirectory();
        directory.touch("s1", null, DemandSpec.none());

        assertTrue(directory.delete("s1"));
        assertFalse(directory.exists("s1"));
        assertFalse(directory.delete("s1"));
    }

    @Test
    void demandOfLatestRunBecomesAffinity() {
        SessionDirectory directory = new SessionDirectory();
        DemandSpec coding = new DemandSpec("coding", Set.of("gpu"));

        directory.touch("s1", null, coding);
        assertEquals(coding, directory.affinity("s1"));

        // a run without demand keeps the pinned affinity
        directory.touch("s1", null, DemandSpec.none());
        assertEquals(coding, directory.affinity("s1"));

        directory.touch("s1", null, DemandSpec.ofProfile("review"));
        assertEquals("review", directory.affinity("s1").profile());

        assertTrue(directory.affinity("unknown").isEmpty());
    }
}

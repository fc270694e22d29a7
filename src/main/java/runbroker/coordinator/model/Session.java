package runbroker.coordinator.model;

import java.time.Instant;

/**
 * A logical conversation that runs act on. Outlives any single run.
 *
 * @param name              session name, unique
 * @param parentSessionName session notified when this one finishes a run, or null
 * @param affinity          demand of the latest run that declared one; resume runs inherit it
 * @param createdAt         first time a run referenced the session
 */
public record Session(String name, String parentSessionName, DemandSpec affinity, Instant createdAt) {

    public Session {
        affinity = affinity == null ? DemandSpec.none() : affinity;
    }

    public boolean hasParent() {
        return parentSessionName != null;
    }

    public Session withParent(String parent) {
        return new Session(name, parent, affinity, createdAt);
    }

    public Session withAffinity(DemandSpec demand) {
        return new Session(name, parentSessionName, demand, createdAt);
    }
}

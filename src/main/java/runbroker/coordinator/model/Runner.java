package runbroker.coordinator.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable snapshot of a registered runner.
 */
public final class Runner {
    private final String id;
    private final Set<String> tags;
    private final String profile;
    private final boolean strictTags;
    private final String hostname;
    private final RunnerStatus status;
    private final Instant registeredAt;
    private final Instant lastHeartbeat;

    private Runner(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.tags = DemandSpec.normalizeTags(builder.tags);
        this.profile = (builder.profile == null || builder.profile.isBlank()) ? null : builder.profile.trim();
        this.strictTags = builder.strictTags;
        this.hostname = builder.hostname;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.registeredAt = builder.registeredAt;
        this.lastHeartbeat = builder.lastHeartbeat;
    }

    public String id() {
        return id;
    }

    public Set<String> tags() {
        return tags;
    }

    public String profile() {
        return profile;
    }

    /** Only accept runs that demand at least one of this runner's tags. */
    public boolean strictTags() {
        return strictTags;
    }

    public String hostname() {
        return hostname;
    }

    public RunnerStatus status() {
        return status;
    }

    public Instant registeredAt() {
        return registeredAt;
    }

    public Instant lastHeartbeat() {
        return lastHeartbeat;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .tags(tags)
                .profile(profile)
                .strictTags(strictTags)
                .hostname(hostname)
                .status(status)
                .registeredAt(registeredAt)
                .lastHeartbeat(lastHeartbeat);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private Set<String> tags = Set.of();
        private String profile;
        private boolean strictTags;
        private String hostname;
        private RunnerStatus status = RunnerStatus.ONLINE;
        private Instant registeredAt;
        private Instant lastHeartbeat;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder tags(Set<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder profile(String profile) {
            this.profile = profile;
            return this;
        }

        public Builder strictTags(boolean strictTags) {
            this.strictTags = strictTags;
            return this;
        }

        public Builder hostname(String hostname) {
            this.hostname = hostname;
            return this;
        }

        public Builder status(RunnerStatus status) {
            this.status = status;
            return this;
        }

        public Builder registeredAt(Instant registeredAt) {
            this.registeredAt = registeredAt;
            return this;
        }

        public Builder lastHeartbeat(Instant lastHeartbeat) {
            this.lastHeartbeat = lastHeartbeat;
            return this;
        }

        public Runner build() {
            return new Runner(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Runner runner))
            return false;
        return Objects.equals(id, runner.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Runner{id='" + id + "', status=" + status + ", tags=" + tags + ", profile='" + profile + "'}";
    }
}

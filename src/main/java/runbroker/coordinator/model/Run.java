package runbroker.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model of a dispatchable unit of work.
 * The run queue replaces the stored instance on every transition, so a
 * reference handed out never changes under the caller.
 */
public final class Run {
    private final String id;
    private final RunKind kind;
    private final String sessionName;
    private final String parentSessionName;
    private final String payload;
    private final DemandSpec demand;
    private final RunStatus status;
    private final String runnerId;
    private final String lastRunnerId;
    private final String error;
    private final String result;
    private final Instant createdAt;
    private final Instant claimedAt;
    private final Instant startedAt;
    private final Instant completedAt;

    private Run(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.kind = Objects.requireNonNull(builder.kind, "kind is required");
        this.sessionName = Objects.requireNonNull(builder.sessionName, "sessionName is required");
        this.parentSessionName = builder.parentSessionName;
        this.payload = Objects.requireNonNull(builder.payload, "payload is required");
        this.demand = builder.demand == null ? DemandSpec.none() : builder.demand;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.runnerId = builder.runnerId;
        this.lastRunnerId = builder.lastRunnerId;
        this.error = builder.error;
        this.result = builder.result;
        this.createdAt = builder.createdAt;
        this.claimedAt = builder.claimedAt;
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;

        if (status.holdsRunner() != (runnerId != null)) {
            throw new IllegalStateException("runnerId must be set iff status is claimed/running/stopping: " + this);
        }
        if (status.isTerminal() != (completedAt != null)) {
            throw new IllegalStateException("completedAt must be set iff status is terminal: " + this);
        }
    }

    public String id() {
        return id;
    }

    public RunKind kind() {
        return kind;
    }

    public String sessionName() {
        return sessionName;
    }

    public String parentSessionName() {
        return parentSessionName;
    }

    public String payload() {
        return payload;
    }

    public DemandSpec demand() {
        return demand;
    }

    public RunStatus status() {
        return status;
    }

    public String runnerId() {
        return runnerId;
    }

    /** Runner that held the run most recently; survives the terminal transition. */
    public String lastRunnerId() {
        return lastRunnerId;
    }

    public String error() {
        return error;
    }

    /** Output the runner reported on completion, if any. */
    public String result() {
        return result;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant claimedAt() {
        return claimedAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean hasParent() {
        return parentSessionName != null;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .kind(kind)
                .sessionName(sessionName)
                .parentSessionName(parentSessionName)
                .payload(payload)
                .demand(demand)
                .status(status)
                .runnerId(runnerId)
                .lastRunnerId(lastRunnerId)
                .error(error)
                .result(result)
                .createdAt(createdAt)
                .claimedAt(claimedAt)
                .startedAt(startedAt)
                .completedAt(completedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private RunKind kind = RunKind.START;
        private String sessionName;
        private String parentSessionName;
        private String payload;
        private DemandSpec demand;
        private RunStatus status = RunStatus.PENDING;
        private String runnerId;
        private String lastRunnerId;
        private String error;
        private String result;
        private Instant createdAt;
        private Instant claimedAt;
        private Instant startedAt;
        private Instant completedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder kind(RunKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder sessionName(String sessionName) {
            this.sessionName = sessionName;
            return this;
        }

        public Builder parentSessionName(String parentSessionName) {
            this.parentSessionName = parentSessionName;
            return this;
        }

        public Builder payload(String payload) {
            this.payload = payload;
            return this;
        }

        public Builder demand(DemandSpec demand) {
            this.demand = demand;
            return this;
        }

        public Builder status(RunStatus status) {
            this.status = status;
            return this;
        }

        public Builder runnerId(String runnerId) {
            this.runnerId = runnerId;
            return this;
        }

        public Builder lastRunnerId(String lastRunnerId) {
            this.lastRunnerId = lastRunnerId;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder result(String result) {
            this.result = result;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder claimedAt(Instant claimedAt) {
            this.claimedAt = claimedAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Run build() {
            return new Run(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Run run))
            return false;
        return Objects.equals(id, run.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Run{id='" + id + "', session='" + sessionName + "', kind=" + kind
                + ", status=" + status + ", runnerId='" + runnerId + "'}";
    }
}

package runbroker.coordinator.config;

import java.time.Duration;

/**
 * Configuration holder for coordinator settings.
 * All settings have defaults; {@link #fromEnv()} overrides them from
 * {@code RUNBROKER_*} environment variables.
 */
public final class CoordinatorConfig {

    // Server settings
    private int serverPort = 8765;
    private String serverHost = "0.0.0.0";
    private int pollWorkerThreads = 64;

    // Runner settings
    private Duration heartbeatTimeout = Duration.ofSeconds(120);
    private Duration heartbeatInterval = Duration.ofSeconds(60);

    // Long-poll settings
    private Duration maxPollWait = Duration.ofSeconds(30);
    private Duration pollSlice = Duration.ofMillis(500);

    // Recovery settings
    private Duration staleClaimGrace = Duration.ofMinutes(5);
    private Duration sweepInterval = Duration.ofSeconds(30);
    private Duration noMatchTimeout = Duration.ofMinutes(5);

    private CoordinatorConfig() {
    }

    public static CoordinatorConfig defaults() {
        return new CoordinatorConfig();
    }

    public static CoordinatorConfig fromEnv() {
        CoordinatorConfig config = new CoordinatorConfig();

        String host = System.getenv("RUNBROKER_HOST");
        if (host != null && !host.isBlank()) {
            config.serverHost = host;
        }

        String port = System.getenv("RUNBROKER_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port.trim());
        }

        String threads = System.getenv("RUNBROKER_POLL_THREADS");
        if (threads != null && !threads.isBlank()) {
            config.pollWorkerThreads = Integer.parseInt(threads.trim());
        }

        config.heartbeatTimeout = seconds("RUNBROKER_HEARTBEAT_TIMEOUT_SECONDS", config.heartbeatTimeout);
        config.heartbeatInterval = seconds("RUNBROKER_HEARTBEAT_INTERVAL_SECONDS", config.heartbeatInterval);
        config.maxPollWait = seconds("RUNBROKER_POLL_TIMEOUT_SECONDS", config.maxPollWait);
        config.staleClaimGrace = seconds("RUNBROKER_STALE_CLAIM_GRACE_SECONDS", config.staleClaimGrace);
        config.sweepInterval = seconds("RUNBROKER_SWEEP_INTERVAL_SECONDS", config.sweepInterval);
        config.noMatchTimeout = seconds("RUNBROKER_NO_MATCH_TIMEOUT_SECONDS", config.noMatchTimeout);

        return config;
    }

    private static Duration seconds(String name, Duration fallback) {
        String value = System.getenv(name);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return Duration.ofSeconds(Long.parseLong(value.trim()));
    }

    // Getters
    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public int pollWorkerThreads() {
        return pollWorkerThreads;
    }

    public Duration heartbeatTimeout() {
        return heartbeatTimeout;
    }

    public Duration heartbeatInterval() {
        return heartbeatInterval;
    }

    public Duration maxPollWait() {
        return maxPollWait;
    }

    public Duration pollSlice() {
        return pollSlice;
    }

    public Duration staleClaimGrace() {
        return staleClaimGrace;
    }

    public Duration sweepInterval() {
        return sweepInterval;
    }

    /** Zero or negative disables failing of unmatched pending runs. */
    public Duration noMatchTimeout() {
        return noMatchTimeout;
    }

    // Fluent setters for testing/customization
    public CoordinatorConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public CoordinatorConfig withServerHost(String host) {
        this.serverHost = host;
        return this;
    }

    public CoordinatorConfig withPollWorkerThreads(int threads) {
        this.pollWorkerThreads = threads;
        return this;
    }

    public CoordinatorConfig withHeartbeatTimeout(Duration timeout) {
        this.heartbeatTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withHeartbeatInterval(Duration interval) {
        this.heartbeatInterval = interval;
        return this;
    }

    public CoordinatorConfig withMaxPollWait(Duration wait) {
        this.maxPollWait = wait;
        return this;
    }

    public CoordinatorConfig withPollSlice(Duration slice) {
        this.pollSlice = slice;
        return this;
    }

    public CoordinatorConfig withStaleClaimGrace(Duration grace) {
        this.staleClaimGrace = grace;
        return this;
    }

    public CoordinatorConfig withSweepInterval(Duration interval) {
        this.sweepInterval = interval;
        return this;
    }

    public CoordinatorConfig withNoMatchTimeout(Duration timeout) {
        this.noMatchTimeout = timeout;
        return this;
    }

    @Override
    public String toString() {
        return "CoordinatorConfig{" +
                "serverHost='" + serverHost + '\'' +
                ", serverPort=" + serverPort +
                ", heartbeatTimeout=" + heartbeatTimeout +
                ", staleClaimGrace=" + staleClaimGrace +
                ", maxPollWait=" + maxPollWait +
                ", noMatchTimeout=" + noMatchTimeout +
                '}';
    }
}

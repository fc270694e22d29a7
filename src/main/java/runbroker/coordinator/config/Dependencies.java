package runbroker.coordinator.config;

import runbroker.coordinator.api.internal.v1.PollController;
import runbroker.coordinator.api.internal.v1.RegistrationController;
import runbroker.coordinator.api.internal.v1.RunReportController;
import runbroker.coordinator.api.v1.HealthController;
import runbroker.coordinator.api.v1.RunController;
import runbroker.coordinator.api.v1.RunnerController;
import runbroker.coordinator.api.v1.SessionController;
import runbroker.coordinator.scheduler.Scheduler;
import runbroker.coordinator.server.RouterHandler;
import runbroker.coordinator.service.CallbackProcessor;
import runbroker.coordinator.service.LongPollDispatcher;
import runbroker.coordinator.service.RunQueue;
import runbroker.coordinator.service.RunService;
import runbroker.coordinator.service.RunnerRegistry;
import runbroker.coordinator.service.RunnerService;
import runbroker.coordinator.service.SessionDirectory;
import runbroker.coordinator.service.SessionService;
import runbroker.coordinator.service.StopChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(CoordinatorConfig.fromEnv());
 * deps.startScheduler(); // start background sweeps
 * RunService runService = deps.runService();
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final CoordinatorConfig config;

    // Core structures
    private final SessionDirectory sessionDirectory;
    private final RunQueue runQueue;
    private final RunnerRegistry runnerRegistry;
    private final StopChannel stopChannel;
    private final CallbackProcessor callbackProcessor;
    private final LongPollDispatcher pollDispatcher;

    // Services
    private final RunService runService;
    private final RunnerService runnerService;
    private final SessionService sessionService;

    // Controllers
    private final HealthController healthController;
    private final RunController runController;
    private final SessionController sessionController;
    private final RunnerController runnerController;
    private final RegistrationController registrationController;
    private final PollController pollController;
    private final RunReportController runReportController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    // Scheduler (lazy-initialized)
    private Scheduler scheduler;

    private Dependencies(CoordinatorConfig config) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Core structures
        this.sessionDirectory = new SessionDirectory();
        this.runQueue = new RunQueue(sessionDirectory);
        this.runnerRegistry = new RunnerRegistry(config.heartbeatTimeout());
        this.stopChannel = new StopChannel();
        this.callbackProcessor = new CallbackProcessor(runQueue, sessionDirectory);
        this.pollDispatcher = new LongPollDispatcher(runnerRegistry, runQueue, stopChannel,
                config.maxPollWait(), config.pollSlice());

        // New runs wake parked polls; terminal runs drive callbacks
        runQueue.addListener(stopChannel);
        runQueue.addListener(callbackProcessor);

        // Services
        this.runService = new RunService(runQueue, stopChannel);
        this.runnerService = new RunnerService(runnerRegistry, runQueue, stopChannel, config.staleClaimGrace());
        this.sessionService = new SessionService(sessionDirectory, runQueue, callbackProcessor);

        // Controllers (public API)
        this.healthController = new HealthController(runQueue, runnerRegistry, sessionDirectory, callbackProcessor);
        this.runController = new RunController(runService);
        this.sessionController = new SessionController(sessionService);
        this.runnerController = new RunnerController(runnerService);

        // Controllers (runner API)
        this.registrationController = new RegistrationController(runnerService, config);
        this.pollController = new PollController(pollDispatcher);
        this.runReportController = new RunReportController(runService);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(CoordinatorConfig config) {
        return new Dependencies(config);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(CoordinatorConfig.fromEnv());
    }

    // Getters
    public CoordinatorConfig config() {
        return config;
    }

    public SessionDirectory sessionDirectory() {
        return sessionDirectory;
    }

    public RunQueue runQueue() {
        return runQueue;
    }

    public RunnerRegistry runnerRegistry() {
        return runnerRegistry;
    }

    public StopChannel stopChannel() {
        return stopChannel;
    }

    public CallbackProcessor callbackProcessor() {
        return callbackProcessor;
    }

    public LongPollDispatcher pollDispatcher() {
        return pollDispatcher;
    }

    public RunService runService() {
        return runService;
    }

    public RunnerService runnerService() {
        return runnerService;
    }

    public SessionService sessionService() {
        return sessionService;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(healthController)
                    .registerController(runController)
                    .registerController(sessionController)
                    .registerController(runnerController)
                    .registerController(registrationController)
                    .registerController(pollController)
                    .registerController(runReportController);
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    /**
     * Get the scheduler (creates it if not yet created).
     */
    public Scheduler scheduler() {
        if (scheduler == null) {
            scheduler = new Scheduler(runQueue, runnerRegistry, config);
        }
        return scheduler;
    }

    /**
     * Start the background sweeps. Should be called after server startup.
     */
    public void startScheduler() {
        scheduler().start();
    }

    public void stopScheduler() {
        if (scheduler != null) {
            scheduler.stop();
        }
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");
        if (scheduler != null) {
            try {
                scheduler.stop();
            } catch (Exception e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }
        log.info("Dependencies closed");
    }
}

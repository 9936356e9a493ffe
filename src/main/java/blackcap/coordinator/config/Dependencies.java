package blackcap.coordinator.config;

import blackcap.coordinator.api.v1.AuthController;
import blackcap.coordinator.api.v1.ClusterController;
import blackcap.coordinator.api.v1.HealthController;
import blackcap.coordinator.api.v1.JobController;
import blackcap.coordinator.api.v1.ScheduleController;
import blackcap.coordinator.auth.AccessGuard;
import blackcap.coordinator.auth.IdentityProvider;
import blackcap.coordinator.auth.SignedTokenIdentityProvider;
import blackcap.coordinator.cluster.ClusterCalls;
import blackcap.coordinator.cluster.ClusterRegistry;
import blackcap.coordinator.reconcile.BackgroundLoops;
import blackcap.coordinator.reconcile.JobLocks;
import blackcap.coordinator.reconcile.StatusReconciler;
import blackcap.coordinator.reconcile.SubmissionDispatcher;
import blackcap.coordinator.repository.JobRepository;
import blackcap.coordinator.repository.ScheduleRepository;
import blackcap.coordinator.scheduler.Scheduler;
import blackcap.coordinator.scheduler.SchedulerRegistry;
import blackcap.coordinator.server.RouterHandler;
import blackcap.coordinator.service.JobService;
import blackcap.coordinator.service.ScheduleService;
import blackcap.coordinator.service.ScheduleStore;
import blackcap.coordinator.store.Database;
import blackcap.coordinator.store.JdbcJobRepository;
import blackcap.coordinator.store.JdbcScheduleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(CoordinatorConfig.fromEnv());
 * deps.startBackgroundLoops(); // start dispatcher and reconciler
 * JobService jobService = deps.jobService();
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final CoordinatorConfig config;
    private final Database database;
    private final JobRepository jobRepository;
    private final JdbcScheduleRepository scheduleRepository;
    private final ClusterRegistry clusterRegistry;
    private final ClusterCalls clusterCalls;
    private final JobLocks jobLocks;
    private final IdentityProvider identityProvider;
    private final AccessGuard accessGuard;
    private final Scheduler scheduler;
    private final ScheduleStore scheduleStore;
    private final ScheduleService scheduleService;
    private final JobService jobService;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    // Background loops (lazy-initialized)
    private BackgroundLoops backgroundLoops;

    private Dependencies(CoordinatorConfig config, ClusterRegistry clusterRegistry) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);
        this.clusterRegistry = clusterRegistry;
        this.clusterCalls = new ClusterCalls(config.clusterCallTimeout());
        this.jobLocks = new JobLocks(config.lockStripes());

        // Repositories
        this.jobRepository = new JdbcJobRepository(database);
        this.scheduleRepository = new JdbcScheduleRepository(database);

        // Auth
        this.identityProvider = new SignedTokenIdentityProvider(
                config.secretKey(), config.users(), config.readOnlyUsers(), config.tokenTtl(), Clock.systemUTC());
        this.accessGuard = new AccessGuard(identityProvider);

        // Services
        this.scheduler = SchedulerRegistry.create(
                config.schedulerStrategy(), jobRepository, clusterRegistry, scheduleRepository);
        this.scheduleStore = new ScheduleStore(scheduleRepository);
        this.scheduleService = new ScheduleService(accessGuard, scheduler, scheduleStore);
        this.jobService = new JobService(accessGuard, jobRepository, scheduleRepository, scheduleService);

        log.info("Dependencies initialized: {} clusters, scheduler={}", clusterRegistry.size(), scheduler.name());
    }

    /**
     * Create dependencies with the given config, building the clusters it lists.
     */
    public static Dependencies create(CoordinatorConfig config) {
        return new Dependencies(config, ClusterRegistry.fromSettings(config.clusters()));
    }

    /**
     * Create dependencies around an already populated cluster registry (tests, embedding).
     */
    public static Dependencies create(CoordinatorConfig config, ClusterRegistry clusters) {
        return new Dependencies(config, clusters);
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

    public Database database() {
        return database;
    }

    public JobRepository jobRepository() {
        return jobRepository;
    }

    public ScheduleRepository scheduleRepository() {
        return scheduleRepository;
    }

    public ClusterRegistry clusterRegistry() {
        return clusterRegistry;
    }

    public IdentityProvider identityProvider() {
        return identityProvider;
    }

    public Scheduler scheduler() {
        return scheduler;
    }

    public ScheduleStore scheduleStore() {
        return scheduleStore;
    }

    public ScheduleService scheduleService() {
        return scheduleService;
    }

    public JobService jobService() {
        return jobService;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(new HealthController(database, clusterRegistry, scheduleStore,
                            () -> backgroundLoops != null && backgroundLoops.isRunning()))
                    .registerController(new AuthController(identityProvider, config.tokenTtl()))
                    .registerController(new JobController(jobService, accessGuard))
                    .registerController(new ScheduleController(scheduleService))
                    .registerController(new ClusterController(clusterRegistry, scheduleStore, accessGuard));
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    /**
     * Get the background loops (creates them if not yet created).
     */
    public BackgroundLoops backgroundLoops() {
        if (backgroundLoops == null) {
            SubmissionDispatcher dispatcher = new SubmissionDispatcher(
                    jobRepository, scheduleRepository, clusterRegistry, clusterCalls, jobLocks);
            StatusReconciler reconciler = new StatusReconciler(
                    jobRepository, scheduleRepository, clusterRegistry, clusterCalls, jobLocks, config);
            backgroundLoops = new BackgroundLoops(dispatcher, reconciler, config);
        }
        return backgroundLoops;
    }

    /**
     * Start submission and reconciliation.
     * Should be called after server startup.
     */
    public void startBackgroundLoops() {
        backgroundLoops().start();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop background work first
        if (backgroundLoops != null) {
            try {
                backgroundLoops.stop();
                backgroundLoops.reconciler().close();
            } catch (Exception e) {
                log.warn("Error stopping background loops: {}", e.getMessage());
            }
        }

        clusterCalls.close();
        clusterRegistry.close();

        // Close database
        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}

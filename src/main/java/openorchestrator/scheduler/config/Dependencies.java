package openorchestrator.scheduler.config;

import openorchestrator.scheduler.api.v1.HealthController;
import openorchestrator.scheduler.api.v1.JobController;
import openorchestrator.scheduler.api.v1.SchedulerController;
import openorchestrator.scheduler.api.v1.TriggerController;
import openorchestrator.scheduler.loop.OperatingMode;
import openorchestrator.scheduler.loop.SchedulerLoop;
import openorchestrator.scheduler.repository.JobRepository;
import openorchestrator.scheduler.repository.LogRepository;
import openorchestrator.scheduler.repository.QueueRepository;
import openorchestrator.scheduler.repository.SchedulerRepository;
import openorchestrator.scheduler.repository.TriggerRepository;
import openorchestrator.scheduler.server.RouterHandler;
import openorchestrator.scheduler.server.SchedulerHttpServer;
import openorchestrator.scheduler.service.CheckoutManager;
import openorchestrator.scheduler.service.CronCalculator;
import openorchestrator.scheduler.service.JobSupervisor;
import openorchestrator.scheduler.service.ProcessLauncher;
import openorchestrator.scheduler.service.TriggerSelector;
import openorchestrator.scheduler.store.Database;
import openorchestrator.scheduler.store.JdbcJobRepository;
import openorchestrator.scheduler.store.JdbcLogRepository;
import openorchestrator.scheduler.store.JdbcQueueRepository;
import openorchestrator.scheduler.store.JdbcSchedulerRepository;
import openorchestrator.scheduler.store.JdbcTriggerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires all scheduler components.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(SchedulerConfig.fromEnv());
 * deps.startServer();
 * deps.loop().run();
 * // ...
 * deps.close();
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final SchedulerConfig config;
    private final Database database;

    private final TriggerRepository triggerRepository;
    private final JobRepository jobRepository;
    private final LogRepository logRepository;
    private final SchedulerRepository schedulerRepository;
    private final QueueRepository queueRepository;

    private final CheckoutManager checkoutManager;
    private final TriggerSelector selector;
    private final ProcessLauncher launcher;
    private final JobSupervisor supervisor;
    private final SchedulerLoop loop;

    // Lazy-initialized
    private RouterHandler routerHandler;
    private SchedulerHttpServer server;

    private Dependencies(SchedulerConfig config) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        this.database = new Database(config);

        this.triggerRepository = new JdbcTriggerRepository(database);
        this.jobRepository = new JdbcJobRepository(database);
        this.logRepository = new JdbcLogRepository(database);
        this.schedulerRepository = new JdbcSchedulerRepository(database);
        this.queueRepository = new JdbcQueueRepository(database);

        this.checkoutManager = new CheckoutManager(config);
        this.selector = new TriggerSelector(triggerRepository, logRepository, new CronCalculator());
        this.launcher = new ProcessLauncher(config, triggerRepository, jobRepository, logRepository,
                schedulerRepository, checkoutManager);
        this.supervisor = new JobSupervisor(config, triggerRepository, jobRepository, logRepository,
                checkoutManager);
        this.loop = new SchedulerLoop(config, new OperatingMode(), schedulerRepository, selector, launcher,
                supervisor);

        log.info("Dependencies initialized successfully");
    }

    public static Dependencies create(SchedulerConfig config) {
        return new Dependencies(config);
    }

    public static Dependencies create() {
        return create(SchedulerConfig.fromEnv());
    }

    public SchedulerConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public TriggerRepository triggerRepository() {
        return triggerRepository;
    }

    public JobRepository jobRepository() {
        return jobRepository;
    }

    public LogRepository logRepository() {
        return logRepository;
    }

    public SchedulerRepository schedulerRepository() {
        return schedulerRepository;
    }

    public QueueRepository queueRepository() {
        return queueRepository;
    }

    public CheckoutManager checkoutManager() {
        return checkoutManager;
    }

    public JobSupervisor supervisor() {
        return supervisor;
    }

    public SchedulerLoop loop() {
        return loop;
    }

    /**
     * RouterHandler with all operator controllers registered.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config)
                    .registerController(new HealthController(database, loop, config.machineName()))
                    .registerController(new SchedulerController(loop, config.machineName()))
                    .registerController(new JobController(loop, config.killTimeout().toMillis()))
                    .registerController(new TriggerController(triggerRepository));
            log.info("RouterHandler created with {} controllers", 4);
        }
        return routerHandler;
    }

    /**
     * Start the operator HTTP API on the configured host and port.
     */
    public synchronized SchedulerHttpServer startServer() {
        if (server == null) {
            server = new SchedulerHttpServer(config.serverHost(), config.serverPort(), routerHandler());
            server.start();
        }
        return server;
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        if (server != null) {
            try {
                server.stop();
            } catch (Exception e) {
                log.warn("Error stopping server: {}", e.getMessage());
            }
        }

        try {
            loop.close();
        } catch (Exception e) {
            log.warn("Error stopping scheduler loop: {}", e.getMessage());
        }

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}

package gpufleet.orchestrator.config;

import gpufleet.cloud.config.IniLoader;
import gpufleet.cloud.config.YandexCloudConfig;
import gpufleet.cloud.mock.MockCloudProvider;
import gpufleet.cloud.provider.CloudProviders;
import gpufleet.cloud.yandex.YandexAuth;
import gpufleet.cloud.yandex.YandexCloudProvider;
import gpufleet.orchestrator.api.internal.v1.WorkerController;
import gpufleet.orchestrator.api.v1.CommandController;
import gpufleet.orchestrator.api.v1.HealthController;
import gpufleet.orchestrator.api.v1.InstanceController;
import gpufleet.orchestrator.api.v1.RouteController;
import gpufleet.orchestrator.bus.CommandBus;
import gpufleet.orchestrator.bus.InMemoryCommandBus;
import gpufleet.orchestrator.health.HttpWorkerProbe;
import gpufleet.orchestrator.health.MockWorkerProbe;
import gpufleet.orchestrator.health.WorkerProbes;
import gpufleet.orchestrator.repository.ActionLogRepository;
import gpufleet.orchestrator.repository.CatalogRepository;
import gpufleet.orchestrator.repository.InstanceRepository;
import gpufleet.orchestrator.repository.VolumeRepository;
import gpufleet.orchestrator.repository.WorkerTokenRepository;
import gpufleet.orchestrator.scheduler.HealthCheckJob;
import gpufleet.orchestrator.scheduler.ProvisioningRequeueJob;
import gpufleet.orchestrator.scheduler.RecoveryJob;
import gpufleet.orchestrator.scheduler.Scheduler;
import gpufleet.orchestrator.scheduler.TerminatorJob;
import gpufleet.orchestrator.scheduler.VolumeReconciliationJob;
import gpufleet.orchestrator.scheduler.WatchDogJob;
import gpufleet.orchestrator.server.OrchestratorServer;
import gpufleet.orchestrator.server.RouterHandler;
import gpufleet.orchestrator.service.CatalogService;
import gpufleet.orchestrator.service.CommandDispatcher;
import gpufleet.orchestrator.service.InstanceService;
import gpufleet.orchestrator.service.ProvisioningService;
import gpufleet.orchestrator.service.TerminationService;
import gpufleet.orchestrator.service.WorkerSelector;
import gpufleet.orchestrator.service.WorkerService;
import gpufleet.orchestrator.statemachine.StateMachine;
import gpufleet.orchestrator.store.Database;
import gpufleet.orchestrator.store.JdbcActionLogRepository;
import gpufleet.orchestrator.store.JdbcCatalogRepository;
import gpufleet.orchestrator.store.JdbcInstanceRepository;
import gpufleet.orchestrator.store.JdbcVolumeRepository;
import gpufleet.orchestrator.store.JdbcWorkerTokenRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.Optional;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(OrchestratorConfig.fromEnv());
 * deps.start(); // dispatcher, scheduler, HTTP server
 * InstanceService instances = deps.instanceService();
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final OrchestratorConfig config;
    private final Database database;

    // Repositories
    private final InstanceRepository instanceRepository;
    private final VolumeRepository volumeRepository;
    private final WorkerTokenRepository tokenRepository;
    private final ActionLogRepository actionLogRepository;
    private final CatalogRepository catalogRepository;

    // Providers
    private final MockCloudProvider mockProvider;
    private final CloudProviders providers;
    private final WorkerProbes probes;

    // Services
    private final StateMachine stateMachine;
    private final CommandBus commandBus;
    private final InstanceService instanceService;
    private final ProvisioningService provisioningService;
    private final TerminationService terminationService;
    private final CatalogService catalogService;
    private final WorkerService workerService;
    private final WorkerSelector workerSelector;

    // Reconciliation
    private final Scheduler scheduler;
    private final CommandDispatcher dispatcher;

    // Router and server (lazy-initialized)
    private RouterHandler routerHandler;
    private OrchestratorServer server;

    private Dependencies(OrchestratorConfig config) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Repositories
        this.instanceRepository = new JdbcInstanceRepository(database, config.clock(), config.claimHold());
        this.volumeRepository = new JdbcVolumeRepository(database);
        this.tokenRepository = new JdbcWorkerTokenRepository(database);
        this.actionLogRepository = new JdbcActionLogRepository(database);
        this.catalogRepository = new JdbcCatalogRepository(database);

        // Providers and probes
        this.mockProvider = new MockCloudProvider();
        this.providers = new CloudProviders().register(mockProvider);
        this.probes = new WorkerProbes(new HttpWorkerProbe(config.probeTimeout()))
                .register(MockCloudProvider.NAME, new MockWorkerProbe(mockProvider));
        loadYandex(config).ifPresent(yandex -> {
            providers.register(new YandexCloudProvider(new YandexAuth(yandex), yandex));
            log.info("Yandex Cloud provider enabled (folder={})", yandex.folderId());
        });

        // Services
        this.stateMachine = new StateMachine(instanceRepository);
        this.commandBus = new InMemoryCommandBus(config.busQueueCapacity());
        this.instanceService = new InstanceService(instanceRepository, volumeRepository, actionLogRepository,
                stateMachine, commandBus, config);
        this.provisioningService = new ProvisioningService(instanceRepository, actionLogRepository, stateMachine,
                providers, config);
        this.terminationService = new TerminationService(instanceRepository, volumeRepository, tokenRepository,
                actionLogRepository, stateMachine, providers, config);
        this.catalogService = new CatalogService(catalogRepository, providers, config);
        this.workerService = new WorkerService(instanceRepository, tokenRepository, config);
        this.workerSelector = new WorkerSelector(instanceRepository, config);

        // Reconciliation jobs
        this.scheduler = new Scheduler(
                new HealthCheckJob(instanceRepository, actionLogRepository, stateMachine, providers, probes, config),
                new TerminatorJob(instanceRepository, terminationService, config),
                new WatchDogJob(instanceRepository, volumeRepository, tokenRepository, actionLogRepository,
                        stateMachine, providers, config),
                new ProvisioningRequeueJob(instanceRepository, provisioningService, config),
                new RecoveryJob(instanceRepository, config),
                new VolumeReconciliationJob(instanceRepository, volumeRepository, terminationService, providers,
                        config),
                config);
        this.dispatcher = new CommandDispatcher(commandBus, instanceRepository, instanceService,
                provisioningService, terminationService, catalogService, scheduler::runAllOnce, config);

        log.info("Dependencies initialized successfully");
    }

    private static Optional<YandexCloudConfig> loadYandex(OrchestratorConfig config) {
        String path = config.yandexIniPath();
        if (path == null || path.isBlank()) {
            return Optional.empty();
        }
        File file = new File(path);
        if (!file.isFile()) {
            log.warn("Yandex ini not found at {}, provider disabled", path);
            return Optional.empty();
        }
        return IniLoader.load(file);
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(OrchestratorConfig config) {
        return new Dependencies(config);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(OrchestratorConfig.fromEnv());
    }

    // Getters
    public OrchestratorConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public InstanceRepository instanceRepository() {
        return instanceRepository;
    }

    public VolumeRepository volumeRepository() {
        return volumeRepository;
    }

    public WorkerTokenRepository tokenRepository() {
        return tokenRepository;
    }

    public ActionLogRepository actionLogRepository() {
        return actionLogRepository;
    }

    public CatalogRepository catalogRepository() {
        return catalogRepository;
    }

    public MockCloudProvider mockProvider() {
        return mockProvider;
    }

    public CloudProviders providers() {
        return providers;
    }

    public StateMachine stateMachine() {
        return stateMachine;
    }

    public CommandBus commandBus() {
        return commandBus;
    }

    public InstanceService instanceService() {
        return instanceService;
    }

    public ProvisioningService provisioningService() {
        return provisioningService;
    }

    public TerminationService terminationService() {
        return terminationService;
    }

    public CatalogService catalogService() {
        return catalogService;
    }

    public WorkerService workerService() {
        return workerService;
    }

    public WorkerSelector workerSelector() {
        return workerSelector;
    }

    public Scheduler scheduler() {
        return scheduler;
    }

    public CommandDispatcher dispatcher() {
        return dispatcher;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(new HealthController(database, instanceRepository))
                    .registerController(new InstanceController(instanceService))
                    .registerController(new CommandController(instanceService))
                    .registerController(new RouteController(workerSelector))
                    .registerController(new WorkerController(workerService, config));
            log.info("RouterHandler created with {} controllers", 5);
        }
        return routerHandler;
    }

    public synchronized OrchestratorServer server() {
        if (server == null) {
            server = new OrchestratorServer(routerHandler());
        }
        return server;
    }

    /**
     * Start command dispatcher, reconciliation scheduler and HTTP server.
     */
    public void start() {
        dispatcher.start();
        scheduler.start();
        server().start(config.serverHost(), config.serverPort());
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
            scheduler.stop();
        } catch (Exception e) {
            log.warn("Error stopping scheduler: {}", e.getMessage());
        }

        try {
            dispatcher.stop();
        } catch (Exception e) {
            log.warn("Error stopping dispatcher: {}", e.getMessage());
        }

        try {
            commandBus.close();
        } catch (Exception e) {
            log.warn("Error closing command bus: {}", e.getMessage());
        }

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}

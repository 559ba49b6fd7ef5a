package gpufleet.orchestrator.config;

import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Configuration holder for orchestrator settings.
 * All settings have sensible defaults; environment variables override them in {@link #fromEnv()}.
 */
public final class OrchestratorConfig {

    private static final long MIN_STALENESS_SECONDS = 10;
    private static final long MAX_STALENESS_SECONDS = 86_400;

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/gpufleet;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8090;
    private String serverHost = "0.0.0.0";

    // Worker auth (optional)
    private String workerAuthToken = null; // shared fallback token accepted on /internal
    private boolean workerAuthRequired = false;

    // Liveness windows
    private Duration heartbeatTrustWindow = Duration.ofSeconds(30);
    private Duration routingStaleness = Duration.ofSeconds(300);
    private int routingCandidateLimit = 200;

    // Coming-up phase timeouts
    private Duration bootTimeout = Duration.ofHours(2);
    private Duration installTimeout = Duration.ofHours(1);
    private Duration modelLoadTimeout = Duration.ofMinutes(30);
    private int startupRetryCap = 2;

    // Recovery timeouts for the remaining non-terminal states
    private Duration provisioningTimeout = Duration.ofMinutes(30);
    private Duration drainingTimeout = Duration.ofHours(1);
    private Duration terminatingTimeout = Duration.ofHours(2);

    // Provisioning requeue
    private Duration requeueThreshold = Duration.ofSeconds(30);
    private Duration requeueLease = Duration.ofSeconds(30);
    private int requeueMaxRetries = 5;
    private int requeueBatchSize = 25;

    // Terminator / watch-dog / health-check
    private Duration terminatorLease = Duration.ofSeconds(30);
    private int terminatorMaxAttempts = 10;
    private Duration watchDogLease = Duration.ofSeconds(60);
    private Duration healthCheckLease = Duration.ofSeconds(10);
    // In-flight hold on requeue/terminator rows; must outlast one row's provider calls
    private Duration claimHold = Duration.ofMinutes(20);
    private Duration volumeSweepLease = Duration.ofMinutes(5);
    private int batchSize = 50;

    // Job intervals
    private Duration healthCheckInterval = Duration.ofSeconds(10);
    private Duration terminatorInterval = Duration.ofSeconds(10);
    private Duration watchDogInterval = Duration.ofSeconds(30);
    private Duration requeueInterval = Duration.ofSeconds(10);
    private Duration recoveryInterval = Duration.ofSeconds(30);
    private Duration volumeSweepInterval = Duration.ofSeconds(60);

    // Provisioning workflow
    private String defaultProvider = "mock";
    private String defaultImage = "ubuntu-2204-lts-gpu";
    private int ipPollAttempts = 10;
    private Duration ipPollInterval = Duration.ofSeconds(2);

    // Worker endpoints
    private int vllmPort = 8000;
    private int workerHealthPort = 8080;
    private String publicUrl = "http://127.0.0.1:8090"; // handed to workers for heartbeats
    private Duration probeTimeout = Duration.ofSeconds(5);

    // Command dispatch
    private String commandChannel = "orchestrator_commands";
    private int dispatcherThreads = 4;
    private int busQueueCapacity = 1024;

    // Catalog sync
    private List<String> catalogZones = List.of("ru-central1-a");

    // Yandex Cloud provider (optional)
    private String yandexIniPath = null;

    private Clock clock = Clock.systemUTC();

    private OrchestratorConfig() {
    }

    public static OrchestratorConfig defaults() {
        return new OrchestratorConfig();
    }

    public static OrchestratorConfig fromEnv() {
        OrchestratorConfig config = new OrchestratorConfig();

        String dbUrl = env("GPUFLEET_DB_URL");
        if (dbUrl != null) {
            config.databaseUrl = dbUrl;
        }

        String port = env("GPUFLEET_PORT");
        if (port != null) {
            config.serverPort = Integer.parseInt(port);
        }

        String token = env("GPUFLEET_WORKER_AUTH_TOKEN");
        if (token != null) {
            config.workerAuthToken = token;
            config.workerAuthRequired = true;
        }

        String staleness = env("GPUFLEET_ROUTING_STALE_SECONDS");
        if (staleness != null) {
            config.withRoutingStaleness(Duration.ofSeconds(Long.parseLong(staleness)));
        }

        String trust = env("GPUFLEET_HEARTBEAT_TRUST_SECONDS");
        if (trust != null) {
            config.heartbeatTrustWindow = Duration.ofSeconds(Long.parseLong(trust));
        }

        String retryCap = env("GPUFLEET_STARTUP_RETRY_CAP");
        if (retryCap != null) {
            config.startupRetryCap = Integer.parseInt(retryCap);
        }

        String hold = env("GPUFLEET_CLAIM_HOLD_SECONDS");
        if (hold != null) {
            config.claimHold = Duration.ofSeconds(Long.parseLong(hold));
        }

        String provider = env("GPUFLEET_DEFAULT_PROVIDER");
        if (provider != null) {
            config.defaultProvider = provider;
        }

        String image = env("GPUFLEET_DEFAULT_IMAGE");
        if (image != null) {
            config.defaultImage = image;
        }

        String zones = env("GPUFLEET_CATALOG_ZONES");
        if (zones != null) {
            config.catalogZones = Arrays.stream(zones.split(","))
                    .map(String::trim)
                    .filter(z -> !z.isEmpty())
                    .toList();
        }

        String publicUrl = env("GPUFLEET_PUBLIC_URL");
        if (publicUrl != null) {
            config.publicUrl = publicUrl;
        }

        String ini = env("GPUFLEET_YANDEX_INI");
        if (ini != null) {
            config.yandexIniPath = ini;
        }

        return config;
    }

    private static String env(String name) {
        String value = System.getenv(name);
        return value != null && !value.isBlank() ? value.trim() : null;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public String workerAuthToken() {
        return workerAuthToken;
    }

    public boolean hasWorkerAuthToken() {
        return workerAuthToken != null && !workerAuthToken.isBlank();
    }

    public boolean workerAuthRequired() {
        return workerAuthRequired;
    }

    public Duration heartbeatTrustWindow() {
        return heartbeatTrustWindow;
    }

    public Duration routingStaleness() {
        return routingStaleness;
    }

    public int routingCandidateLimit() {
        return routingCandidateLimit;
    }

    public Duration bootTimeout() {
        return bootTimeout;
    }

    public Duration installTimeout() {
        return installTimeout;
    }

    public Duration modelLoadTimeout() {
        return modelLoadTimeout;
    }

    public int startupRetryCap() {
        return startupRetryCap;
    }

    public Duration provisioningTimeout() {
        return provisioningTimeout;
    }

    public Duration drainingTimeout() {
        return drainingTimeout;
    }

    public Duration terminatingTimeout() {
        return terminatingTimeout;
    }

    public Duration requeueThreshold() {
        return requeueThreshold;
    }

    public Duration requeueLease() {
        return requeueLease;
    }

    public int requeueMaxRetries() {
        return requeueMaxRetries;
    }

    public int requeueBatchSize() {
        return requeueBatchSize;
    }

    public Duration terminatorLease() {
        return terminatorLease;
    }

    public int terminatorMaxAttempts() {
        return terminatorMaxAttempts;
    }

    public Duration watchDogLease() {
        return watchDogLease;
    }

    public Duration healthCheckLease() {
        return healthCheckLease;
    }

    public Duration claimHold() {
        return claimHold;
    }

    public Duration volumeSweepLease() {
        return volumeSweepLease;
    }

    public int batchSize() {
        return batchSize;
    }

    public Duration healthCheckInterval() {
        return healthCheckInterval;
    }

    public Duration terminatorInterval() {
        return terminatorInterval;
    }

    public Duration watchDogInterval() {
        return watchDogInterval;
    }

    public Duration requeueInterval() {
        return requeueInterval;
    }

    public Duration recoveryInterval() {
        return recoveryInterval;
    }

    public Duration volumeSweepInterval() {
        return volumeSweepInterval;
    }

    public String defaultProvider() {
        return defaultProvider;
    }

    public String defaultImage() {
        return defaultImage;
    }

    public int ipPollAttempts() {
        return ipPollAttempts;
    }

    public Duration ipPollInterval() {
        return ipPollInterval;
    }

    public int vllmPort() {
        return vllmPort;
    }

    public int workerHealthPort() {
        return workerHealthPort;
    }

    public String publicUrl() {
        return publicUrl;
    }

    public Duration probeTimeout() {
        return probeTimeout;
    }

    public String commandChannel() {
        return commandChannel;
    }

    public int dispatcherThreads() {
        return dispatcherThreads;
    }

    public int busQueueCapacity() {
        return busQueueCapacity;
    }

    public List<String> catalogZones() {
        return catalogZones;
    }

    public String yandexIniPath() {
        return yandexIniPath;
    }

    public Clock clock() {
        return clock;
    }

    // Fluent setters for testing/customization
    public OrchestratorConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public OrchestratorConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public OrchestratorConfig withWorkerAuthToken(String token) {
        this.workerAuthToken = token;
        return this;
    }

    public OrchestratorConfig withWorkerAuthRequired(boolean required) {
        this.workerAuthRequired = required;
        return this;
    }

    public OrchestratorConfig withHeartbeatTrustWindow(Duration window) {
        this.heartbeatTrustWindow = window;
        return this;
    }

    /**
     * Staleness is clamped to [10s, 24h].
     */
    public OrchestratorConfig withRoutingStaleness(Duration staleness) {
        long seconds = Math.max(MIN_STALENESS_SECONDS, Math.min(MAX_STALENESS_SECONDS, staleness.toSeconds()));
        this.routingStaleness = Duration.ofSeconds(seconds);
        return this;
    }

    public OrchestratorConfig withRoutingCandidateLimit(int limit) {
        this.routingCandidateLimit = limit;
        return this;
    }

    public OrchestratorConfig withBootTimeout(Duration timeout) {
        this.bootTimeout = timeout;
        return this;
    }

    public OrchestratorConfig withInstallTimeout(Duration timeout) {
        this.installTimeout = timeout;
        return this;
    }

    public OrchestratorConfig withModelLoadTimeout(Duration timeout) {
        this.modelLoadTimeout = timeout;
        return this;
    }

    public OrchestratorConfig withStartupRetryCap(int cap) {
        this.startupRetryCap = cap;
        return this;
    }

    public OrchestratorConfig withProvisioningTimeout(Duration timeout) {
        this.provisioningTimeout = timeout;
        return this;
    }

    public OrchestratorConfig withDrainingTimeout(Duration timeout) {
        this.drainingTimeout = timeout;
        return this;
    }

    public OrchestratorConfig withTerminatingTimeout(Duration timeout) {
        this.terminatingTimeout = timeout;
        return this;
    }

    public OrchestratorConfig withRequeueThreshold(Duration threshold) {
        this.requeueThreshold = threshold;
        return this;
    }

    public OrchestratorConfig withRequeueMaxRetries(int retries) {
        this.requeueMaxRetries = retries;
        return this;
    }

    public OrchestratorConfig withTerminatorMaxAttempts(int attempts) {
        this.terminatorMaxAttempts = attempts;
        return this;
    }

    public OrchestratorConfig withClaimHold(Duration hold) {
        this.claimHold = hold;
        return this;
    }

    public OrchestratorConfig withBatchSize(int size) {
        this.batchSize = size;
        return this;
    }

    public OrchestratorConfig withDefaultProvider(String provider) {
        this.defaultProvider = provider;
        return this;
    }

    public OrchestratorConfig withDefaultImage(String image) {
        this.defaultImage = image;
        return this;
    }

    public OrchestratorConfig withIpPolling(int attempts, Duration interval) {
        this.ipPollAttempts = attempts;
        this.ipPollInterval = interval;
        return this;
    }

    public OrchestratorConfig withProbeTimeout(Duration timeout) {
        this.probeTimeout = timeout;
        return this;
    }

    public OrchestratorConfig withCatalogZones(List<String> zones) {
        this.catalogZones = List.copyOf(zones);
        return this;
    }

    public OrchestratorConfig withYandexIniPath(String path) {
        this.yandexIniPath = path;
        return this;
    }

    public OrchestratorConfig withClock(Clock clock) {
        this.clock = clock;
        return this;
    }

    @Override
    public String toString() {
        return "OrchestratorConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", defaultProvider='" + defaultProvider + '\'' +
                ", routingStaleness=" + routingStaleness +
                ", workerAuthRequired=" + workerAuthRequired +
                '}';
    }
}

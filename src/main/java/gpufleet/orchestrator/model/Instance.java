package gpufleet.orchestrator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model of one GPU instance row.
 * Lifecycle columns are written by the state machine, worker columns by heartbeat ingestion.
 */
public final class Instance {
    private final String id;
    private final String provider;
    private final String zone;
    private final String instanceType;
    private final String modelId;
    private final String providerInstanceId;
    private final String ipAddress;
    private final InstanceStatus status;
    private final Instant createdAt;
    private final Instant statusChangedAt;
    private final Instant bootStartedAt;
    private final Instant installStartedAt;
    private final Instant startingStartedAt;
    private final Instant readyAt;
    private final Instant drainingStartedAt;
    private final Instant terminatingStartedAt;
    private final Instant terminatedAt;
    private final Instant failedAt;
    private final Instant archivedAt;
    private final String errorCode;
    private final String errorMessage;
    private final int retryCount;
    private final int healthCheckFailures;
    private final int terminationAttempts;
    private final Instant lastHealthCheck;
    private final Instant lastReconciliation;
    private final Instant workerLastHeartbeat;
    private final String workerStatus;
    private final String workerModelId;
    private final Integer workerVllmPort;
    private final Integer workerHealthPort;
    private final Integer workerQueueDepth;
    private final Double workerGpuUtilization;
    private final String workerMetadata;
    private final String deletionReason;
    private final boolean deletedByProvider;
    private final boolean archived;

    private Instance(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.provider = builder.provider;
        this.zone = builder.zone;
        this.instanceType = builder.instanceType;
        this.modelId = builder.modelId;
        this.providerInstanceId = builder.providerInstanceId;
        this.ipAddress = builder.ipAddress;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.createdAt = builder.createdAt;
        this.statusChangedAt = builder.statusChangedAt;
        this.bootStartedAt = builder.bootStartedAt;
        this.installStartedAt = builder.installStartedAt;
        this.startingStartedAt = builder.startingStartedAt;
        this.readyAt = builder.readyAt;
        this.drainingStartedAt = builder.drainingStartedAt;
        this.terminatingStartedAt = builder.terminatingStartedAt;
        this.terminatedAt = builder.terminatedAt;
        this.failedAt = builder.failedAt;
        this.archivedAt = builder.archivedAt;
        this.errorCode = builder.errorCode;
        this.errorMessage = builder.errorMessage;
        this.retryCount = builder.retryCount;
        this.healthCheckFailures = builder.healthCheckFailures;
        this.terminationAttempts = builder.terminationAttempts;
        this.lastHealthCheck = builder.lastHealthCheck;
        this.lastReconciliation = builder.lastReconciliation;
        this.workerLastHeartbeat = builder.workerLastHeartbeat;
        this.workerStatus = builder.workerStatus;
        this.workerModelId = builder.workerModelId;
        this.workerVllmPort = builder.workerVllmPort;
        this.workerHealthPort = builder.workerHealthPort;
        this.workerQueueDepth = builder.workerQueueDepth;
        this.workerGpuUtilization = builder.workerGpuUtilization;
        this.workerMetadata = builder.workerMetadata;
        this.deletionReason = builder.deletionReason;
        this.deletedByProvider = builder.deletedByProvider;
        this.archived = builder.archived;
    }

    // Getters
    public String id() {
        return id;
    }

    public String provider() {
        return provider;
    }

    public String zone() {
        return zone;
    }

    public String instanceType() {
        return instanceType;
    }

    public String modelId() {
        return modelId;
    }

    public String providerInstanceId() {
        return providerInstanceId;
    }

    public String ipAddress() {
        return ipAddress;
    }

    public InstanceStatus status() {
        return status;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant statusChangedAt() {
        return statusChangedAt;
    }

    public Instant bootStartedAt() {
        return bootStartedAt;
    }

    public Instant installStartedAt() {
        return installStartedAt;
    }

    public Instant startingStartedAt() {
        return startingStartedAt;
    }

    public Instant readyAt() {
        return readyAt;
    }

    public Instant drainingStartedAt() {
        return drainingStartedAt;
    }

    public Instant terminatingStartedAt() {
        return terminatingStartedAt;
    }

    public Instant terminatedAt() {
        return terminatedAt;
    }

    public Instant failedAt() {
        return failedAt;
    }

    public Instant archivedAt() {
        return archivedAt;
    }

    public String errorCode() {
        return errorCode;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public int retryCount() {
        return retryCount;
    }

    public int healthCheckFailures() {
        return healthCheckFailures;
    }

    public int terminationAttempts() {
        return terminationAttempts;
    }

    public Instant lastHealthCheck() {
        return lastHealthCheck;
    }

    public Instant lastReconciliation() {
        return lastReconciliation;
    }

    public Instant workerLastHeartbeat() {
        return workerLastHeartbeat;
    }

    public String workerStatus() {
        return workerStatus;
    }

    public String workerModelId() {
        return workerModelId;
    }

    public Integer workerVllmPort() {
        return workerVllmPort;
    }

    public Integer workerHealthPort() {
        return workerHealthPort;
    }

    public Integer workerQueueDepth() {
        return workerQueueDepth;
    }

    public Double workerGpuUtilization() {
        return workerGpuUtilization;
    }

    public String workerMetadata() {
        return workerMetadata;
    }

    public String deletionReason() {
        return deletionReason;
    }

    public boolean deletedByProvider() {
        return deletedByProvider;
    }

    public boolean isArchived() {
        return archived;
    }

    public boolean hasProviderInstance() {
        return providerInstanceId != null && !providerInstanceId.isBlank();
    }

    public boolean hasIp() {
        return ipAddress != null && !ipAddress.isBlank();
    }

    /**
     * When the current coming-up phase began, falling back to the last status change.
     */
    public Instant phaseStartedAt() {
        Instant phase = switch (status) {
            case BOOTING -> bootStartedAt;
            case INSTALLING -> installStartedAt;
            case STARTING -> startingStartedAt;
            default -> null;
        };
        return phase != null ? phase : statusChangedAt;
    }

    /**
     * Most recent liveness signal: worker heartbeat or successful health check.
     */
    public Instant freshness() {
        if (workerLastHeartbeat == null) {
            return lastHealthCheck;
        }
        if (lastHealthCheck == null) {
            return workerLastHeartbeat;
        }
        return workerLastHeartbeat.isAfter(lastHealthCheck) ? workerLastHeartbeat : lastHealthCheck;
    }

    /** Create a builder from this instance (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .provider(provider)
                .zone(zone)
                .instanceType(instanceType)
                .modelId(modelId)
                .providerInstanceId(providerInstanceId)
                .ipAddress(ipAddress)
                .status(status)
                .createdAt(createdAt)
                .statusChangedAt(statusChangedAt)
                .bootStartedAt(bootStartedAt)
                .installStartedAt(installStartedAt)
                .startingStartedAt(startingStartedAt)
                .readyAt(readyAt)
                .drainingStartedAt(drainingStartedAt)
                .terminatingStartedAt(terminatingStartedAt)
                .terminatedAt(terminatedAt)
                .failedAt(failedAt)
                .archivedAt(archivedAt)
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .retryCount(retryCount)
                .healthCheckFailures(healthCheckFailures)
                .terminationAttempts(terminationAttempts)
                .lastHealthCheck(lastHealthCheck)
                .lastReconciliation(lastReconciliation)
                .workerLastHeartbeat(workerLastHeartbeat)
                .workerStatus(workerStatus)
                .workerModelId(workerModelId)
                .workerVllmPort(workerVllmPort)
                .workerHealthPort(workerHealthPort)
                .workerQueueDepth(workerQueueDepth)
                .workerGpuUtilization(workerGpuUtilization)
                .workerMetadata(workerMetadata)
                .deletionReason(deletionReason)
                .deletedByProvider(deletedByProvider)
                .archived(archived);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String provider;
        private String zone;
        private String instanceType;
        private String modelId;
        private String providerInstanceId;
        private String ipAddress;
        private InstanceStatus status = InstanceStatus.PROVISIONING;
        private Instant createdAt;
        private Instant statusChangedAt;
        private Instant bootStartedAt;
        private Instant installStartedAt;
        private Instant startingStartedAt;
        private Instant readyAt;
        private Instant drainingStartedAt;
        private Instant terminatingStartedAt;
        private Instant terminatedAt;
        private Instant failedAt;
        private Instant archivedAt;
        private String errorCode;
        private String errorMessage;
        private int retryCount;
        private int healthCheckFailures;
        private int terminationAttempts;
        private Instant lastHealthCheck;
        private Instant lastReconciliation;
        private Instant workerLastHeartbeat;
        private String workerStatus;
        private String workerModelId;
        private Integer workerVllmPort;
        private Integer workerHealthPort;
        private Integer workerQueueDepth;
        private Double workerGpuUtilization;
        private String workerMetadata;
        private String deletionReason;
        private boolean deletedByProvider;
        private boolean archived;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder provider(String provider) {
            this.provider = provider;
            return this;
        }

        public Builder zone(String zone) {
            this.zone = zone;
            return this;
        }

        public Builder instanceType(String instanceType) {
            this.instanceType = instanceType;
            return this;
        }

        public Builder modelId(String modelId) {
            this.modelId = modelId;
            return this;
        }

        public Builder providerInstanceId(String providerInstanceId) {
            this.providerInstanceId = providerInstanceId;
            return this;
        }

        public Builder ipAddress(String ipAddress) {
            this.ipAddress = ipAddress;
            return this;
        }

        public Builder status(InstanceStatus status) {
            this.status = status;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder statusChangedAt(Instant statusChangedAt) {
            this.statusChangedAt = statusChangedAt;
            return this;
        }

        public Builder bootStartedAt(Instant bootStartedAt) {
            this.bootStartedAt = bootStartedAt;
            return this;
        }

        public Builder installStartedAt(Instant installStartedAt) {
            this.installStartedAt = installStartedAt;
            return this;
        }

        public Builder startingStartedAt(Instant startingStartedAt) {
            this.startingStartedAt = startingStartedAt;
            return this;
        }

        public Builder readyAt(Instant readyAt) {
            this.readyAt = readyAt;
            return this;
        }

        public Builder drainingStartedAt(Instant drainingStartedAt) {
            this.drainingStartedAt = drainingStartedAt;
            return this;
        }

        public Builder terminatingStartedAt(Instant terminatingStartedAt) {
            this.terminatingStartedAt = terminatingStartedAt;
            return this;
        }

        public Builder terminatedAt(Instant terminatedAt) {
            this.terminatedAt = terminatedAt;
            return this;
        }

        public Builder failedAt(Instant failedAt) {
            this.failedAt = failedAt;
            return this;
        }

        public Builder archivedAt(Instant archivedAt) {
            this.archivedAt = archivedAt;
            return this;
        }

        public Builder errorCode(String errorCode) {
            this.errorCode = errorCode;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder healthCheckFailures(int healthCheckFailures) {
            this.healthCheckFailures = healthCheckFailures;
            return this;
        }

        public Builder terminationAttempts(int terminationAttempts) {
            this.terminationAttempts = terminationAttempts;
            return this;
        }

        public Builder lastHealthCheck(Instant lastHealthCheck) {
            this.lastHealthCheck = lastHealthCheck;
            return this;
        }

        public Builder lastReconciliation(Instant lastReconciliation) {
            this.lastReconciliation = lastReconciliation;
            return this;
        }

        public Builder workerLastHeartbeat(Instant workerLastHeartbeat) {
            this.workerLastHeartbeat = workerLastHeartbeat;
            return this;
        }

        public Builder workerStatus(String workerStatus) {
            this.workerStatus = workerStatus;
            return this;
        }

        public Builder workerModelId(String workerModelId) {
            this.workerModelId = workerModelId;
            return this;
        }

        public Builder workerVllmPort(Integer workerVllmPort) {
            this.workerVllmPort = workerVllmPort;
            return this;
        }

        public Builder workerHealthPort(Integer workerHealthPort) {
            this.workerHealthPort = workerHealthPort;
            return this;
        }

        public Builder workerQueueDepth(Integer workerQueueDepth) {
            this.workerQueueDepth = workerQueueDepth;
            return this;
        }

        public Builder workerGpuUtilization(Double workerGpuUtilization) {
            this.workerGpuUtilization = workerGpuUtilization;
            return this;
        }

        public Builder workerMetadata(String workerMetadata) {
            this.workerMetadata = workerMetadata;
            return this;
        }

        public Builder deletionReason(String deletionReason) {
            this.deletionReason = deletionReason;
            return this;
        }

        public Builder deletedByProvider(boolean deletedByProvider) {
            this.deletedByProvider = deletedByProvider;
            return this;
        }

        public Builder archived(boolean archived) {
            this.archived = archived;
            return this;
        }

        public Instance build() {
            return new Instance(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Instance instance))
            return false;
        return Objects.equals(id, instance.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Instance{id='" + id + "', provider='" + provider + "', status=" + status + "}";
    }
}

package gpufleet.orchestrator.model;

import java.util.Objects;

/**
 * One requested status change, guarded on the expected current status.
 * Side-effect columns are applied in the same statement as the status change.
 */
public final class Transition {
    private final String instanceId;
    private final InstanceStatus from;
    private final InstanceStatus to;
    private final String reason;
    private final String metadata;
    private final String errorCode;
    private final String errorMessage;
    private final boolean clearError;
    private final String deletionReason;
    private final boolean deletedByProvider;
    private final boolean resetWorker;
    private final boolean incrementRetry;

    private Transition(Builder builder) {
        this.instanceId = Objects.requireNonNull(builder.instanceId, "instanceId is required");
        this.from = Objects.requireNonNull(builder.from, "from is required");
        this.to = Objects.requireNonNull(builder.to, "to is required");
        this.reason = builder.reason;
        this.metadata = builder.metadata;
        this.errorCode = builder.errorCode;
        this.errorMessage = builder.errorMessage;
        this.clearError = builder.clearError;
        this.deletionReason = builder.deletionReason;
        this.deletedByProvider = builder.deletedByProvider;
        this.resetWorker = builder.resetWorker;
        this.incrementRetry = builder.incrementRetry;
    }

    public String instanceId() {
        return instanceId;
    }

    public InstanceStatus from() {
        return from;
    }

    public InstanceStatus to() {
        return to;
    }

    public String reason() {
        return reason;
    }

    /** JSON object, may be null */
    public String metadata() {
        return metadata;
    }

    public String errorCode() {
        return errorCode;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public boolean clearError() {
        return clearError;
    }

    public String deletionReason() {
        return deletionReason;
    }

    public boolean deletedByProvider() {
        return deletedByProvider;
    }

    public boolean resetWorker() {
        return resetWorker;
    }

    public boolean incrementRetry() {
        return incrementRetry;
    }

    public Builder toBuilder() {
        return new Builder()
                .instanceId(instanceId)
                .from(from)
                .to(to)
                .reason(reason)
                .metadata(metadata)
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .clearError(clearError)
                .deletionReason(deletionReason)
                .deletedByProvider(deletedByProvider)
                .resetWorker(resetWorker)
                .incrementRetry(incrementRetry);
    }

    public static Builder of(String instanceId, InstanceStatus from, InstanceStatus to) {
        return new Builder().instanceId(instanceId).from(from).to(to);
    }

    public static final class Builder {
        private String instanceId;
        private InstanceStatus from;
        private InstanceStatus to;
        private String reason;
        private String metadata;
        private String errorCode;
        private String errorMessage;
        private boolean clearError;
        private String deletionReason;
        private boolean deletedByProvider;
        private boolean resetWorker;
        private boolean incrementRetry;

        public Builder instanceId(String instanceId) {
            this.instanceId = instanceId;
            return this;
        }

        public Builder from(InstanceStatus from) {
            this.from = from;
            return this;
        }

        public Builder to(InstanceStatus to) {
            this.to = to;
            return this;
        }

        public Builder reason(String reason) {
            this.reason = reason;
            return this;
        }

        public Builder metadata(String metadata) {
            this.metadata = metadata;
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

        public Builder error(String code, String message) {
            this.errorCode = code;
            this.errorMessage = message;
            return this;
        }

        public Builder clearError(boolean clearError) {
            this.clearError = clearError;
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

        public Builder resetWorker(boolean resetWorker) {
            this.resetWorker = resetWorker;
            return this;
        }

        public Builder incrementRetry(boolean incrementRetry) {
            this.incrementRetry = incrementRetry;
            return this;
        }

        public Transition build() {
            return new Transition(this);
        }
    }

    @Override
    public String toString() {
        return "Transition{" + instanceId + ": " + from + " -> " + to + ", reason='" + reason + "'}";
    }
}

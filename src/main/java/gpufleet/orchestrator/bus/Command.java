package gpufleet.orchestrator.bus;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Message carried on the orchestrator command channel.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Command(
        @JsonProperty("type") CommandType type,
        @JsonProperty("instance_id") String instanceId,
        @JsonProperty("zone") String zone,
        @JsonProperty("instance_type") String instanceType,
        @JsonProperty("model_id") String modelId,
        @JsonProperty("provider") String provider,
        @JsonProperty("correlation_id") String correlationId) {

    public static Command provision(String instanceId, String provider, String zone, String instanceType,
            String modelId) {
        return new Command(CommandType.PROVISION, instanceId, zone, instanceType, modelId, provider, null);
    }

    public static Command terminate(String instanceId) {
        return new Command(CommandType.TERMINATE, instanceId, null, null, null, null, null);
    }

    public static Command reinstall(String instanceId) {
        return new Command(CommandType.REINSTALL, instanceId, null, null, null, null, null);
    }

    public static Command syncCatalog(String provider) {
        return new Command(CommandType.SYNC_CATALOG, null, null, null, null, provider, null);
    }

    public static Command reconcile() {
        return new Command(CommandType.RECONCILE, null, null, null, null, null, null);
    }

    public Command withCorrelationId(String correlationId) {
        return new Command(type, instanceId, zone, instanceType, modelId, provider, correlationId);
    }

    /**
     * Validate required fields for the command type.
     *
     * @throws IllegalArgumentException if validation fails
     */
    public void validate() {
        if (type == null) {
            throw new IllegalArgumentException("type is required");
        }
        switch (type) {
            case PROVISION, TERMINATE, REINSTALL -> {
                if (instanceId == null || instanceId.isBlank()) {
                    throw new IllegalArgumentException("instance_id is required for " + type);
                }
            }
            default -> {
            }
        }
    }
}

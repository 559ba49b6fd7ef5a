package gpufleet.orchestrator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Request DTO for worker registration.
 * POST /internal/v1/worker/register
 */
public record WorkerRegisterRequest(
        @JsonProperty("instance_id") String instanceId,
        @JsonProperty("model_id") String modelId,
        @JsonProperty("vllm_port") Integer vllmPort,
        @JsonProperty("health_port") Integer healthPort,
        @JsonProperty("metadata") JsonNode metadata) {
    public void validate() {
        if (instanceId == null || instanceId.isBlank()) {
            throw new IllegalArgumentException("instance_id is required");
        }
        checkPort("vllm_port", vllmPort);
        checkPort("health_port", healthPort);
    }

    private static void checkPort(String name, Integer port) {
        if (port != null && (port < 1 || port > 65535)) {
            throw new IllegalArgumentException(name + " must be between 1 and 65535");
        }
    }

    public String metadataJson() {
        return metadata == null || metadata.isNull() ? null : metadata.toString();
    }
}

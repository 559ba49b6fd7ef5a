package gpufleet.orchestrator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Request DTO for worker heartbeat.
 * POST /internal/v1/worker/heartbeat
 */
public record WorkerHeartbeatRequest(
        @JsonProperty("instance_id") String instanceId,
        @JsonProperty("status") String status,
        @JsonProperty("model_id") String modelId,
        @JsonProperty("queue_depth") Integer queueDepth,
        @JsonProperty("gpu_utilization") Double gpuUtilization,
        @JsonProperty("metadata") JsonNode metadata) {
    public void validate() {
        if (instanceId == null || instanceId.isBlank()) {
            throw new IllegalArgumentException("instance_id is required");
        }
        if (status == null || status.isBlank()) {
            throw new IllegalArgumentException("status is required");
        }
        if (queueDepth != null && queueDepth < 0) {
            throw new IllegalArgumentException("queue_depth must be non-negative");
        }
        if (gpuUtilization != null && (gpuUtilization < 0 || gpuUtilization > 100)) {
            throw new IllegalArgumentException("gpu_utilization must be between 0 and 100");
        }
    }

    public String metadataJson() {
        return metadata == null || metadata.isNull() ? null : metadata.toString();
    }
}

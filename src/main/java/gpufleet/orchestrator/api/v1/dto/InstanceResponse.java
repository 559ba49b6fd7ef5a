package gpufleet.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import gpufleet.orchestrator.model.Instance;

import java.time.Instant;

/**
 * Response DTO for one instance, with its lifecycle progress.
 * GET /api/v1/instances/{id}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record InstanceResponse(
        @JsonProperty("id") String id,
        @JsonProperty("provider") String provider,
        @JsonProperty("zone") String zone,
        @JsonProperty("instance_type") String instanceType,
        @JsonProperty("model_id") String modelId,
        @JsonProperty("provider_instance_id") String providerInstanceId,
        @JsonProperty("ip_address") String ipAddress,
        @JsonProperty("status") String status,
        @JsonProperty("progress") int progress,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("status_changed_at") Instant statusChangedAt,
        @JsonProperty("ready_at") Instant readyAt,
        @JsonProperty("terminated_at") Instant terminatedAt,
        @JsonProperty("error_code") String errorCode,
        @JsonProperty("error_message") String errorMessage,
        @JsonProperty("retry_count") int retryCount,
        @JsonProperty("worker_status") String workerStatus,
        @JsonProperty("worker_last_heartbeat") Instant workerLastHeartbeat,
        @JsonProperty("worker_queue_depth") Integer workerQueueDepth,
        @JsonProperty("worker_gpu_utilization") Double workerGpuUtilization,
        @JsonProperty("deletion_reason") String deletionReason,
        @JsonProperty("deleted_by_provider") boolean deletedByProvider) {

    public static InstanceResponse from(Instance instance, int progress) {
        return new InstanceResponse(
                instance.id(),
                instance.provider(),
                instance.zone(),
                instance.instanceType(),
                instance.modelId(),
                instance.providerInstanceId(),
                instance.ipAddress(),
                instance.status().dbValue(),
                progress,
                instance.createdAt(),
                instance.statusChangedAt(),
                instance.readyAt(),
                instance.terminatedAt(),
                instance.errorCode(),
                instance.errorMessage(),
                instance.retryCount(),
                instance.workerStatus(),
                instance.workerLastHeartbeat(),
                instance.workerQueueDepth(),
                instance.workerGpuUtilization(),
                instance.deletionReason(),
                instance.deletedByProvider());
    }
}

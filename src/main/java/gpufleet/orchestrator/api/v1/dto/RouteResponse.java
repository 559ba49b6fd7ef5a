package gpufleet.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import gpufleet.orchestrator.model.WorkerHandle;

/**
 * Routing decision.
 * GET /api/v1/route
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RouteResponse(
        @JsonProperty("instance_id") String instanceId,
        @JsonProperty("base_url") String baseUrl,
        @JsonProperty("ip_address") String ipAddress,
        @JsonProperty("port") int port,
        @JsonProperty("model_id") String modelId,
        @JsonProperty("queue_depth") Integer queueDepth) {

    public static RouteResponse from(WorkerHandle handle) {
        return new RouteResponse(handle.instanceId(), handle.baseUrl(), handle.ipAddress(), handle.port(),
                handle.modelId(), handle.queueDepth());
    }
}

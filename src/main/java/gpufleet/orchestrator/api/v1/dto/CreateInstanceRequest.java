package gpufleet.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for creating an instance.
 * POST /api/v1/instances
 */
public record CreateInstanceRequest(
        @JsonProperty("provider") String provider,
        @JsonProperty("zone") String zone,
        @JsonProperty("instance_type") String instanceType,
        @JsonProperty("model_id") String modelId) {
    public void validate() {
        if (zone == null || zone.isBlank()) {
            throw new IllegalArgumentException("zone is required");
        }
        if (instanceType == null || instanceType.isBlank()) {
            throw new IllegalArgumentException("instance_type is required");
        }
    }
}

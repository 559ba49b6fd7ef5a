package gpufleet.orchestrator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Generic response for internal API operations.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResponse(
        @JsonProperty("ok") boolean ok,
        @JsonProperty("error") String error) {
    public static OperationResponse success() {
        return new OperationResponse(true, null);
    }

    public static OperationResponse error(String error) {
        return new OperationResponse(false, error);
    }

    public static OperationResponse instanceNotFound() {
        return error("instance_not_found");
    }
}

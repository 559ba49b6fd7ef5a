package gpufleet.orchestrator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for worker registration. The token is only returned to the call that issued it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkerRegisterResponse(
        @JsonProperty("status") String status,
        @JsonProperty("bootstrap_token") String bootstrapToken,
        @JsonProperty("bootstrap_token_prefix") String bootstrapTokenPrefix) {
    public static WorkerRegisterResponse ok() {
        return new WorkerRegisterResponse("ok", null, null);
    }

    public static WorkerRegisterResponse withToken(String token, String prefix) {
        return new WorkerRegisterResponse("ok", token, prefix);
    }
}

package gpufleet.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import gpufleet.orchestrator.bus.Command;
import gpufleet.orchestrator.bus.CommandType;

import java.util.Locale;

/**
 * Request DTO for publishing a command.
 * POST /api/v1/commands
 */
public record CommandRequest(
        @JsonProperty("type") String type,
        @JsonProperty("instance_id") String instanceId,
        @JsonProperty("provider") String provider,
        @JsonProperty("zone") String zone,
        @JsonProperty("instance_type") String instanceType,
        @JsonProperty("model_id") String modelId) {

    /**
     * Convert to a bus command.
     *
     * @throws IllegalArgumentException if the type is unknown or a required field is missing
     */
    public Command toCommand() {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type is required");
        }
        CommandType commandType;
        try {
            commandType = CommandType.valueOf(type.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown command type: " + type);
        }
        Command command = new Command(commandType, instanceId, zone, instanceType, modelId, provider, null);
        command.validate();
        return command;
    }
}

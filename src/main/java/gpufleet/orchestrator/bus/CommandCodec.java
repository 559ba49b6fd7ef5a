package gpufleet.orchestrator.bus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * JSON encoding of {@link Command} messages.
 */
public final class CommandCodec {

    private static final Logger log = LoggerFactory.getLogger(CommandCodec.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private CommandCodec() {
    }

    public static String encode(Command command) {
        try {
            return MAPPER.writeValueAsString(command);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode command " + command.type(), e);
        }
    }

    /**
     * Decode a message. Malformed or invalid payloads are logged and yield empty.
     */
    public static Optional<Command> decode(String payload) {
        try {
            Command command = MAPPER.readValue(payload, Command.class);
            command.validate();
            return Optional.of(command);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Dropping undecodable command: {} ({})", abbreviate(payload), e.getMessage());
            return Optional.empty();
        }
    }

    private static String abbreviate(String payload) {
        if (payload == null) {
            return "null";
        }
        return payload.length() > 200 ? payload.substring(0, 200) + "..." : payload;
    }
}

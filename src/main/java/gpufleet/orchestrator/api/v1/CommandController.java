package gpufleet.orchestrator.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import gpufleet.orchestrator.api.Controller;
import gpufleet.orchestrator.api.v1.dto.CommandRequest;
import gpufleet.orchestrator.bus.Command;
import gpufleet.orchestrator.server.RouterHandler;
import gpufleet.orchestrator.service.InstanceService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Publishes a command on the orchestrator channel.
 * POST /api/v1/commands
 */
public class CommandController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(CommandController.class);

    private final InstanceService instanceService;

    public CommandController(InstanceService instanceService) {
        this.instanceService = instanceService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && "/api/v1/commands".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            String body = req.content().toString(StandardCharsets.UTF_8);
            CommandRequest request = RouterHandler.mapper().readValue(body, CommandRequest.class);
            Command command = request.toCommand();

            int delivered = instanceService.publish(command);

            Map<String, Object> response = Map.of(
                    "accepted", true,
                    "type", command.type().name(),
                    "delivered", delivered);
            return ControllerResponse.json(
                    HttpResponseStatus.ACCEPTED,
                    RouterHandler.mapper().writeValueAsString(response));

        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("invalid JSON body");
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Command controller error", e);
            return ControllerResponse.error("internal error");
        }
    }
}

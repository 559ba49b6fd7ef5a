package gpufleet.orchestrator.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import gpufleet.orchestrator.api.Controller;
import gpufleet.orchestrator.api.v1.dto.CreateInstanceRequest;
import gpufleet.orchestrator.api.v1.dto.HistoryEntryResponse;
import gpufleet.orchestrator.api.v1.dto.InstanceResponse;
import gpufleet.orchestrator.model.Instance;
import gpufleet.orchestrator.server.RouterHandler;
import gpufleet.orchestrator.service.InstanceService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for instance management (public API).
 *
 * POST /api/v1/instances - Request a new instance
 * GET /api/v1/instances - List instances
 * GET /api/v1/instances/{id} - Instance with progress
 * GET /api/v1/instances/{id}/history - State history
 */
public class InstanceController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(InstanceController.class);

    private static final Pattern INSTANCES_PATTERN = Pattern.compile("^/api/v1/instances$");
    private static final Pattern INSTANCE_BY_ID_PATTERN = Pattern.compile("^/api/v1/instances/([^/]+)$");
    private static final Pattern HISTORY_PATTERN = Pattern.compile("^/api/v1/instances/([^/]+)/history$");

    private final InstanceService instanceService;

    public InstanceController(InstanceService instanceService) {
        this.instanceService = instanceService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (INSTANCES_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.POST) || method.equals(HttpMethod.GET);
        }
        if (method.equals(HttpMethod.GET)) {
            return INSTANCE_BY_ID_PATTERN.matcher(path).matches() ||
                    HISTORY_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (INSTANCES_PATTERN.matcher(path).matches()) {
                return req.method().equals(HttpMethod.POST) ? handleCreate(req) : handleList();
            }

            Matcher historyMatcher = HISTORY_PATTERN.matcher(path);
            if (historyMatcher.matches()) {
                return handleHistory(historyMatcher.group(1));
            }

            Matcher instanceMatcher = INSTANCE_BY_ID_PATTERN.matcher(path);
            if (instanceMatcher.matches()) {
                return handleGet(instanceMatcher.group(1));
            }

            return ControllerResponse.notFound("unknown instance endpoint");

        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("invalid JSON body");
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Instance controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * POST /api/v1/instances
     */
    private ControllerResponse handleCreate(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        CreateInstanceRequest request = RouterHandler.mapper().readValue(body, CreateInstanceRequest.class);
        request.validate();

        Instance instance = instanceService.create(
                request.provider(),
                request.zone(),
                request.instanceType(),
                request.modelId());

        InstanceResponse response = InstanceResponse.from(instance, instanceService.progress(instance));
        return ControllerResponse.json(
                HttpResponseStatus.CREATED,
                RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * GET /api/v1/instances
     */
    private ControllerResponse handleList() throws Exception {
        List<InstanceResponse> response = instanceService.findAll().stream()
                .map(i -> InstanceResponse.from(i, instanceService.progress(i)))
                .toList();
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * GET /api/v1/instances/{id}
     */
    private ControllerResponse handleGet(String instanceId) throws Exception {
        Optional<Instance> instance = instanceService.findById(instanceId);
        if (instance.isEmpty()) {
            return ControllerResponse.notFound("instance not found: " + instanceId);
        }
        InstanceResponse response = InstanceResponse.from(instance.get(), instanceService.progress(instance.get()));
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * GET /api/v1/instances/{id}/history
     */
    private ControllerResponse handleHistory(String instanceId) throws Exception {
        if (instanceService.findById(instanceId).isEmpty()) {
            return ControllerResponse.notFound("instance not found: " + instanceId);
        }
        List<HistoryEntryResponse> response = instanceService.history(instanceId).stream()
                .map(HistoryEntryResponse::from)
                .toList();
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }
}

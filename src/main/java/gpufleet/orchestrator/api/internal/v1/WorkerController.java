package gpufleet.orchestrator.api.internal.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import gpufleet.orchestrator.api.Controller;
import gpufleet.orchestrator.api.internal.v1.dto.OperationResponse;
import gpufleet.orchestrator.api.internal.v1.dto.WorkerHeartbeatRequest;
import gpufleet.orchestrator.api.internal.v1.dto.WorkerRegisterRequest;
import gpufleet.orchestrator.api.internal.v1.dto.WorkerRegisterResponse;
import gpufleet.orchestrator.config.OrchestratorConfig;
import gpufleet.orchestrator.server.RouterHandler;
import gpufleet.orchestrator.service.WorkerAuthException;
import gpufleet.orchestrator.service.WorkerService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Controller for worker agents (internal API).
 * POST /internal/v1/worker/register - Record worker ports, bootstrap token
 * POST /internal/v1/worker/heartbeat - Worker heartbeat
 */
public class WorkerController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(WorkerController.class);

    private static final String REGISTER_PATH = "/internal/v1/worker/register";
    private static final String HEARTBEAT_PATH = "/internal/v1/worker/heartbeat";

    private final WorkerService workerService;
    private final OrchestratorConfig config;

    public WorkerController(WorkerService workerService, OrchestratorConfig config) {
        this.workerService = workerService;
        this.config = config;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (!method.equals(HttpMethod.POST)) {
            return false;
        }
        return REGISTER_PATH.equals(path) || HEARTBEAT_PATH.equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (path.equals(REGISTER_PATH)) {
                return handleRegister(ctx, req);
            } else {
                return handleHeartbeat(req);
            }
        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("invalid JSON body");
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (WorkerAuthException e) {
            log.warn("Worker auth failed on {}: {}", path, e.getMessage());
            return ControllerResponse.unauthorized(e.getMessage());
        } catch (IllegalStateException e) {
            return ControllerResponse.conflict(e.getMessage());
        } catch (Exception e) {
            log.error("Worker controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * POST /internal/v1/worker/register
     */
    private ControllerResponse handleRegister(ChannelHandlerContext ctx, FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        WorkerRegisterRequest request = RouterHandler.mapper().readValue(body, WorkerRegisterRequest.class);
        request.validate();

        int vllmPort = request.vllmPort() != null ? request.vllmPort() : config.vllmPort();
        int healthPort = request.healthPort() != null ? request.healthPort() : config.workerHealthPort();

        Optional<WorkerService.Registration> registration = workerService.registerWorker(
                request.instanceId(),
                request.modelId(),
                vllmPort,
                healthPort,
                request.metadataJson(),
                bearerToken(req),
                clientIp(ctx));

        if (registration.isEmpty()) {
            return ControllerResponse.json(HttpResponseStatus.NOT_FOUND,
                    RouterHandler.mapper().writeValueAsString(OperationResponse.instanceNotFound()));
        }

        WorkerService.Registration result = registration.get();
        WorkerRegisterResponse response = result.tokenIssued()
                ? WorkerRegisterResponse.withToken(result.token(), result.tokenPrefix())
                : WorkerRegisterResponse.ok();
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * POST /internal/v1/worker/heartbeat
     */
    private ControllerResponse handleHeartbeat(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        WorkerHeartbeatRequest request = RouterHandler.mapper().readValue(body, WorkerHeartbeatRequest.class);
        request.validate();

        boolean accepted = workerService.reportHeartbeat(
                request.instanceId(),
                bearerToken(req),
                request.status(),
                request.modelId(),
                request.queueDepth(),
                request.gpuUtilization(),
                request.metadataJson());

        if (!accepted) {
            return ControllerResponse.json(HttpResponseStatus.NOT_FOUND,
                    RouterHandler.mapper().writeValueAsString(OperationResponse.instanceNotFound()));
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(OperationResponse.success()));
    }

    static String bearerToken(FullHttpRequest req) {
        String header = req.headers().get(HttpHeaderNames.AUTHORIZATION);
        if (header == null || !header.regionMatches(true, 0, "Bearer ", 0, 7)) {
            return null;
        }
        String token = header.substring(7).trim();
        return token.isEmpty() ? null : token;
    }

    private static String clientIp(ChannelHandlerContext ctx) {
        SocketAddress remote = ctx.channel().remoteAddress();
        if (remote instanceof InetSocketAddress inet && inet.getAddress() != null) {
            return inet.getAddress().getHostAddress();
        }
        return null;
    }
}

package gpufleet.orchestrator.api.v1;

import gpufleet.orchestrator.api.Controller;
import gpufleet.orchestrator.api.v1.dto.RouteResponse;
import gpufleet.orchestrator.model.WorkerHandle;
import gpufleet.orchestrator.server.RouterHandler;
import gpufleet.orchestrator.service.NoReadyWorkerException;
import gpufleet.orchestrator.service.WorkerSelector;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Picks a worker for an inference request.
 * GET /api/v1/route?model=...&sticky=...
 */
public class RouteController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(RouteController.class);

    private final WorkerSelector selector;

    public RouteController(WorkerSelector selector) {
        this.selector = selector;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/route".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            QueryStringDecoder query = new QueryStringDecoder(req.uri());
            String model = param(query, "model");
            String sticky = param(query, "sticky");

            WorkerHandle handle = selector.select(model, sticky);
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(RouteResponse.from(handle)));

        } catch (NoReadyWorkerException e) {
            log.debug("Route miss: {}", e.getMessage());
            return ControllerResponse.unavailable(e.getMessage(), e.retryAfterSeconds());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Route controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    private static String param(QueryStringDecoder query, String name) {
        List<String> values = query.parameters().get(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return values.get(0);
    }
}

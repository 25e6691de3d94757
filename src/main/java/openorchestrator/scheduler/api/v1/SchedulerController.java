package openorchestrator.scheduler.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import openorchestrator.scheduler.api.Controller;
import openorchestrator.scheduler.api.v1.dto.OperationResponse;
import openorchestrator.scheduler.api.v1.dto.RunningJobResponse;
import openorchestrator.scheduler.api.v1.dto.SchedulerStatusResponse;
import openorchestrator.scheduler.api.v1.dto.ToggleRequest;
import openorchestrator.scheduler.loop.SchedulerLoop;
import openorchestrator.scheduler.server.RouterHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Operator switches of this scheduler.
 *
 * GET /api/v1/scheduler - machine name, switches and tracked jobs
 * POST /api/v1/scheduler/run - start picking up triggers
 * POST /api/v1/scheduler/pause - stop picking up triggers
 * POST /api/v1/scheduler/exclusive - {"enabled": true|false}
 */
public class SchedulerController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(SchedulerController.class);

    private static final String BASE = "/api/v1/scheduler";

    private final SchedulerLoop loop;
    private final String machineName;

    public SchedulerController(SchedulerLoop loop, String machineName) {
        this.loop = loop;
        this.machineName = machineName;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.GET)) {
            return BASE.equals(path);
        }
        if (method.equals(HttpMethod.POST)) {
            return (BASE + "/run").equals(path)
                    || (BASE + "/pause").equals(path)
                    || (BASE + "/exclusive").equals(path);
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (req.method().equals(HttpMethod.GET)) {
                return handleStatus();
            }

            switch (path.substring(BASE.length())) {
                case "/run":
                    return handleRun();
                case "/pause":
                    loop.pause();
                    return ok(OperationResponse.success("paused"));
                case "/exclusive":
                    return handleExclusive(req);
                default:
                    return ControllerResponse.notFound("unknown scheduler endpoint");
            }
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Scheduler controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    private ControllerResponse handleStatus() throws Exception {
        List<RunningJobResponse> jobs = loop.supervisor().runningJobs().stream()
                .map(RunningJobResponse::from)
                .toList();

        SchedulerStatusResponse response = new SchedulerStatusResponse(
                machineName,
                loop.mode().isRunning(),
                loop.mode().isExclusive(),
                jobs);

        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    private ControllerResponse handleRun() throws Exception {
        try {
            loop.run();
        } catch (IllegalStateException e) {
            log.warn("Refused to run: {}", e.getMessage());
            return ControllerResponse.conflict(e.getMessage());
        }
        return ok(OperationResponse.success("running"));
    }

    private ControllerResponse handleExclusive(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw new IllegalArgumentException("request body is required");
        }
        ToggleRequest request = RouterHandler.mapper().readValue(body, ToggleRequest.class);
        request.validate();

        loop.setExclusive(request.enabled());
        return ok(OperationResponse.success(request.enabled() ? "exclusive" : "shared"));
    }

    private static ControllerResponse ok(OperationResponse response) throws Exception {
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }
}

package openorchestrator.scheduler.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import openorchestrator.scheduler.api.Controller;
import openorchestrator.scheduler.api.v1.dto.OperationResponse;
import openorchestrator.scheduler.api.v1.dto.TriggerResponse;
import openorchestrator.scheduler.model.Trigger;
import openorchestrator.scheduler.model.TriggerStatus;
import openorchestrator.scheduler.repository.TriggerRepository;
import openorchestrator.scheduler.server.RouterHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for triggers.
 *
 * GET /api/v1/triggers - list all triggers
 * POST /api/v1/triggers/{triggerId}/pause - pause now if idle, after the current run if running
 * POST /api/v1/triggers/{triggerId}/resume - re-enable a paused or failed trigger
 */
public class TriggerController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TriggerController.class);

    private static final String LIST_PATH = "/api/v1/triggers";
    private static final Pattern ACTION_PATTERN = Pattern.compile("^/api/v1/triggers/([^/]+)/(pause|resume)$");

    private final TriggerRepository triggerRepository;

    public TriggerController(TriggerRepository triggerRepository) {
        this.triggerRepository = triggerRepository;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.GET)) {
            return LIST_PATH.equals(path);
        }
        return method.equals(HttpMethod.POST) && ACTION_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (req.method().equals(HttpMethod.GET)) {
                List<TriggerResponse> triggers = triggerRepository.findAll().stream()
                        .map(TriggerResponse::from)
                        .toList();
                return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(triggers));
            }

            Matcher matcher = ACTION_PATTERN.matcher(path);
            if (!matcher.matches()) {
                return ControllerResponse.notFound("unknown trigger endpoint");
            }
            String triggerId = matcher.group(1);

            Optional<Trigger> trigger = triggerRepository.findById(triggerId);
            if (trigger.isEmpty()) {
                return ControllerResponse.notFound("trigger not found: " + triggerId);
            }

            return "pause".equals(matcher.group(2))
                    ? handlePause(trigger.get())
                    : handleResume(trigger.get());

        } catch (Exception e) {
            log.error("Trigger controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    private ControllerResponse handlePause(Trigger trigger) throws Exception {
        Optional<TriggerStatus> status = triggerRepository.requestPause(trigger.id());
        if (status.isEmpty()) {
            return ControllerResponse.conflict("trigger cannot be paused from " + trigger.status());
        }
        log.info("Trigger '{}' paused by operator ({})", trigger.name(), status.get());
        return ControllerResponse.json(
                RouterHandler.mapper().writeValueAsString(OperationResponse.success(status.get().name())));
    }

    private ControllerResponse handleResume(Trigger trigger) throws Exception {
        if (!triggerRepository.resume(trigger.id())) {
            return ControllerResponse.conflict("trigger cannot be resumed from " + trigger.status());
        }
        log.info("Trigger '{}' resumed by operator", trigger.name());
        return ControllerResponse.json(
                RouterHandler.mapper().writeValueAsString(OperationResponse.success(TriggerStatus.IDLE.name())));
    }
}

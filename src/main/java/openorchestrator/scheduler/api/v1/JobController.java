package openorchestrator.scheduler.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import openorchestrator.scheduler.api.Controller;
import openorchestrator.scheduler.api.v1.dto.OperationResponse;
import openorchestrator.scheduler.loop.SchedulerLoop;
import openorchestrator.scheduler.server.RouterHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for running jobs.
 *
 * POST /api/v1/jobs/{jobId}/kill - forcibly terminate a job tracked by this scheduler
 */
public class JobController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(JobController.class);

    private static final Pattern KILL_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)/kill$");

    private final SchedulerLoop loop;
    private final long waitMillis;

    public JobController(SchedulerLoop loop, long killTimeoutMillis) {
        this.loop = loop;
        // Leave room for the kill itself plus the store writes after it
        this.waitMillis = killTimeoutMillis + 10_000;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && KILL_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        Matcher matcher = KILL_PATTERN.matcher(path);
        if (!matcher.matches()) {
            return ControllerResponse.notFound("unknown job endpoint");
        }
        String jobId = matcher.group(1);

        try {
            boolean killed = loop.killJob(jobId).get(waitMillis, TimeUnit.MILLISECONDS);
            if (!killed) {
                return ControllerResponse.notFound("job not running on this scheduler: " + jobId);
            }
            return ControllerResponse.json(
                    RouterHandler.mapper().writeValueAsString(OperationResponse.success("KILLED")));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ControllerResponse.error("interrupted");
        } catch (Exception e) {
            log.error("Failed to kill job {}", jobId, e);
            return ControllerResponse.error("failed to kill job " + jobId);
        }
    }
}

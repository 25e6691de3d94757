package openorchestrator;

import openorchestrator.scheduler.config.Dependencies;
import openorchestrator.scheduler.config.SchedulerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.concurrent.CountDownLatch;

/**
 * Scheduler entry point.
 *
 * Usage: {@code java -jar openorchestrator-scheduler.jar [scheduler.ini] [--run]}
 *
 * Without an INI file the configuration comes from the environment. With
 * {@code --run} the scheduler starts picking up triggers at once; otherwise it
 * waits for {@code POST /api/v1/scheduler/run}.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws IOException, InterruptedException {
        String iniPath = null;
        boolean runNow = false;
        for (String arg : args) {
            if ("--run".equals(arg)) {
                runNow = true;
            } else {
                iniPath = arg;
            }
        }

        SchedulerConfig config = iniPath != null
                ? SchedulerConfig.fromIni(new File(iniPath))
                : SchedulerConfig.fromEnv();

        Dependencies deps = Dependencies.create(config);
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested");
            deps.close();
            stopped.countDown();
        }, "openorchestrator-shutdown"));

        deps.startServer();

        if (runNow) {
            try {
                deps.loop().run();
            } catch (IllegalStateException e) {
                log.error("Scheduler cannot run: {}", e.getMessage());
            }
        }

        log.info("Scheduler '{}' started", config.machineName());
        stopped.await();
    }
}

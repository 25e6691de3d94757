package openorchestrator.scheduler.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerConfigTest {

    @TempDir
    Path tmp;

    @Test
    void defaults() {
        SchedulerConfig config = SchedulerConfig.defaults();

        assertEquals(Duration.ofSeconds(6), config.tickInterval());
        assertEquals(Duration.ofSeconds(5), config.killTimeout());
        assertEquals("python", config.processRuntime());
        assertEquals("main.py", config.entryPointName());
        assertEquals(".py", config.processExtension());
        assertFalse(config.hasCryptoKey());
        assertFalse(config.hasAdminKey());
        assertEquals(config.databaseUrl(), config.connectionString(), "connection string falls back to the db url");
        assertNotNull(config.machineName());
    }

    @Test
    void iniFile() throws Exception {
        Path ini = tmp.resolve("scheduler.ini");
        Files.writeString(ini, """
                [DATABASE]
                url = jdbc:h2:mem:from-ini
                pool_size = 2
                connection_string = jdbc:h2:tcp://db-host/orchestrator

                [SCHEDULER]
                machine_name = robot-01
                crypto_key = abc123
                tick_interval_ms = 1500
                kill_jobs_on_shutdown = true

                [PROCESS]
                runtime = /usr/bin/python3
                checkout_root = /var/tmp/repos

                [SERVER]
                port = 9090
                admin_key = hunter2
                """);

        SchedulerConfig config = SchedulerConfig.fromIni(new File(ini.toString()));

        // Environment variables override the file; only assert keys the test environment leaves alone
        if (System.getenv("OO_DB_URL") == null) {
            assertEquals("jdbc:h2:mem:from-ini", config.databaseUrl());
        }
        if (System.getenv("OO_MACHINE_NAME") == null) {
            assertEquals("robot-01", config.machineName());
        }
        assertEquals(2, config.databasePoolSize());
        assertEquals("jdbc:h2:tcp://db-host/orchestrator", config.connectionString());
        assertEquals(Duration.ofMillis(1500), config.tickInterval());
        assertTrue(config.killJobsOnShutdown());
        assertEquals("main.py", config.entryPointName(), "unset keys keep defaults");
        if (System.getenv("OO_PORT") == null) {
            assertEquals(9090, config.serverPort());
        }
        assertTrue(config.hasCryptoKey());
        assertTrue(config.hasAdminKey());
    }

    @Test
    void missingIniFile() {
        assertThrows(Exception.class, () -> SchedulerConfig.fromIni(tmp.resolve("absent.ini").toFile()));
    }
}

package openorchestrator.scheduler.config;

import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.File;
import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration holder for Scheduler settings.
 * All settings have sensible defaults; the crypto key has none and must be supplied
 * before the scheduler is allowed to run.
 */
public final class SchedulerConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/openorchestrator;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 4;

    // Values handed to every spawned process
    private String connectionString = null; // falls back to databaseUrl
    private String cryptoKey = null;

    // Scheduler settings
    private String machineName = defaultMachineName();
    private Duration tickInterval = Duration.ofSeconds(6);
    private Duration killTimeout = Duration.ofSeconds(5);
    private boolean killJobsOnShutdown = false;

    // Process settings
    private String processRuntime = "python";
    private String entryPointName = "main.py";
    private String processExtension = ".py";
    private String gitExecutable = "git";
    private Path checkoutRoot = Path.of(System.getProperty("java.io.tmpdir"), "openorchestrator-scheduler-repos");

    // Server settings
    private int serverPort = 8085;
    private String serverHost = "0.0.0.0";
    private String adminKey = null; // If set, POST requests must carry X-Orchestrator-Key

    private SchedulerConfig() {
    }

    public static SchedulerConfig defaults() {
        return new SchedulerConfig();
    }

    public static SchedulerConfig fromEnv() {
        SchedulerConfig config = new SchedulerConfig();
        config.applyEnv();
        return config;
    }

    /**
     * Load settings from an INI file, then let environment variables override them.
     * Sections: [DATABASE], [SCHEDULER], [PROCESS], [SERVER]; every key is optional.
     *
     * @throws IOException if the file cannot be read or parsed
     */
    public static SchedulerConfig fromIni(File file) throws IOException {
        SchedulerConfig config = new SchedulerConfig();
        Ini ini = new Ini(file);

        Profile.Section db = ini.get("DATABASE");
        if (db != null) {
            config.databaseUrl = opt(db, "url", config.databaseUrl);
            config.databasePoolSize = Integer.parseInt(opt(db, "pool_size", String.valueOf(config.databasePoolSize)));
            config.connectionString = opt(db, "connection_string", config.connectionString);
        }

        Profile.Section scheduler = ini.get("SCHEDULER");
        if (scheduler != null) {
            config.machineName = opt(scheduler, "machine_name", config.machineName);
            config.cryptoKey = opt(scheduler, "crypto_key", config.cryptoKey);
            config.tickInterval = Duration.ofMillis(Long.parseLong(
                    opt(scheduler, "tick_interval_ms", String.valueOf(config.tickInterval.toMillis()))));
            config.killTimeout = Duration.ofMillis(Long.parseLong(
                    opt(scheduler, "kill_timeout_ms", String.valueOf(config.killTimeout.toMillis()))));
            config.killJobsOnShutdown = Boolean.parseBoolean(
                    opt(scheduler, "kill_jobs_on_shutdown", String.valueOf(config.killJobsOnShutdown)));
        }

        Profile.Section process = ini.get("PROCESS");
        if (process != null) {
            config.processRuntime = opt(process, "runtime", config.processRuntime);
            config.entryPointName = opt(process, "entry_point", config.entryPointName);
            config.processExtension = opt(process, "extension", config.processExtension);
            config.gitExecutable = opt(process, "git", config.gitExecutable);
            String root = opt(process, "checkout_root", null);
            if (root != null) {
                config.checkoutRoot = Path.of(root);
            }
        }

        Profile.Section server = ini.get("SERVER");
        if (server != null) {
            config.serverHost = opt(server, "host", config.serverHost);
            config.serverPort = Integer.parseInt(opt(server, "port", String.valueOf(config.serverPort)));
            config.adminKey = opt(server, "admin_key", config.adminKey);
        }

        config.applyEnv();
        return config;
    }

    private void applyEnv() {
        String dbUrl = System.getenv("OO_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            databaseUrl = dbUrl;
        }

        String machine = System.getenv("OO_MACHINE_NAME");
        if (machine != null && !machine.isBlank()) {
            machineName = machine;
        }

        String key = System.getenv("OO_CRYPTO_KEY");
        if (key != null && !key.isBlank()) {
            cryptoKey = key;
        }

        String port = System.getenv("OO_PORT");
        if (port != null && !port.isBlank()) {
            serverPort = Integer.parseInt(port);
        }

        String admin = System.getenv("OO_ADMIN_KEY");
        if (admin != null && !admin.isBlank()) {
            adminKey = admin;
        }

        String root = System.getenv("OO_CHECKOUT_ROOT");
        if (root != null && !root.isBlank()) {
            checkoutRoot = Path.of(root);
        }

        String runtime = System.getenv("OO_RUNTIME");
        if (runtime != null && !runtime.isBlank()) {
            processRuntime = runtime;
        }
    }

    private static String opt(Profile.Section section, String key, String fallback) {
        String value = section.get(key);
        return value != null && !value.isBlank() ? value.trim() : fallback;
    }

    private static String defaultMachineName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            String env = System.getenv("HOSTNAME");
            return env != null && !env.isBlank() ? env : "localhost";
        }
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public String connectionString() {
        return connectionString != null ? connectionString : databaseUrl;
    }

    public String cryptoKey() {
        return cryptoKey;
    }

    public boolean hasCryptoKey() {
        return cryptoKey != null && !cryptoKey.isBlank();
    }

    public String machineName() {
        return machineName;
    }

    public Duration tickInterval() {
        return tickInterval;
    }

    public Duration killTimeout() {
        return killTimeout;
    }

    public boolean killJobsOnShutdown() {
        return killJobsOnShutdown;
    }

    public String processRuntime() {
        return processRuntime;
    }

    public String entryPointName() {
        return entryPointName;
    }

    public String processExtension() {
        return processExtension;
    }

    public String gitExecutable() {
        return gitExecutable;
    }

    public Path checkoutRoot() {
        return checkoutRoot;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public String adminKey() {
        return adminKey;
    }

    public boolean hasAdminKey() {
        return adminKey != null && !adminKey.isBlank();
    }

    // Fluent setters for testing/customization
    public SchedulerConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public SchedulerConfig withConnectionString(String connectionString) {
        this.connectionString = connectionString;
        return this;
    }

    public SchedulerConfig withCryptoKey(String key) {
        this.cryptoKey = key;
        return this;
    }

    public SchedulerConfig withMachineName(String name) {
        this.machineName = name;
        return this;
    }

    public SchedulerConfig withTickInterval(Duration interval) {
        this.tickInterval = interval;
        return this;
    }

    public SchedulerConfig withKillTimeout(Duration timeout) {
        this.killTimeout = timeout;
        return this;
    }

    public SchedulerConfig withKillJobsOnShutdown(boolean kill) {
        this.killJobsOnShutdown = kill;
        return this;
    }

    public SchedulerConfig withProcessRuntime(String runtime) {
        this.processRuntime = runtime;
        return this;
    }

    public SchedulerConfig withEntryPoint(String entryPointName, String extension) {
        this.entryPointName = entryPointName;
        this.processExtension = extension;
        return this;
    }

    public SchedulerConfig withGitExecutable(String git) {
        this.gitExecutable = git;
        return this;
    }

    public SchedulerConfig withCheckoutRoot(Path root) {
        this.checkoutRoot = root;
        return this;
    }

    public SchedulerConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public SchedulerConfig withAdminKey(String key) {
        this.adminKey = key;
        return this;
    }

    @Override
    public String toString() {
        return "SchedulerConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", machineName='" + machineName + '\'' +
                ", tickInterval=" + tickInterval +
                ", runtime='" + processRuntime + '\'' +
                ", checkoutRoot=" + checkoutRoot +
                ", serverPort=" + serverPort +
                ", cryptoKeySet=" + hasCryptoKey() +
                ", adminKeySet=" + hasAdminKey() +
                '}';
    }
}

package openorchestrator.scheduler.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable domain model of a persisted rule that launches a process.
 * Shared fields live here; the kind-specific part is the {@link TriggerSchedule}.
 */
public final class Trigger {
    private final String id;
    private final String name;
    private final String processName;
    private final String processPath; // file path, or repository URL when gitRepo
    private final String processArgs;
    private final boolean gitRepo;
    private final String gitBranch;
    private final boolean blocking;
    private final int priority;
    private final List<String> schedulerWhitelist; // empty = any machine
    private final TriggerStatus status;
    private final Instant lastRun;
    private final TriggerSchedule schedule;

    private Trigger(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.processName = Objects.requireNonNull(builder.processName, "processName is required");
        this.processPath = Objects.requireNonNull(builder.processPath, "processPath is required");
        this.processArgs = builder.processArgs != null ? builder.processArgs : "";
        this.gitRepo = builder.gitRepo;
        this.gitBranch = builder.gitBranch;
        this.blocking = builder.blocking;
        this.priority = builder.priority;
        this.schedulerWhitelist = builder.schedulerWhitelist != null
                ? List.copyOf(builder.schedulerWhitelist)
                : List.of();
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.lastRun = builder.lastRun;
        this.schedule = Objects.requireNonNull(builder.schedule, "schedule is required");
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String processName() {
        return processName;
    }

    public String processPath() {
        return processPath;
    }

    public String processArgs() {
        return processArgs;
    }

    public boolean gitRepo() {
        return gitRepo;
    }

    public String gitBranch() {
        return gitBranch;
    }

    public boolean blocking() {
        return blocking;
    }

    public int priority() {
        return priority;
    }

    public List<String> schedulerWhitelist() {
        return schedulerWhitelist;
    }

    public TriggerStatus status() {
        return status;
    }

    public Instant lastRun() {
        return lastRun;
    }

    public TriggerSchedule schedule() {
        return schedule;
    }

    public TriggerType type() {
        return schedule.type();
    }

    /**
     * Whether the given machine may run this trigger.
     *
     * @param machineName   name of the scheduler machine
     * @param exclusiveMode if true, only explicitly whitelisted triggers are allowed
     */
    public boolean allowsMachine(String machineName, boolean exclusiveMode) {
        if (schedulerWhitelist.isEmpty()) {
            return !exclusiveMode;
        }
        return schedulerWhitelist.contains(machineName);
    }

    /** Scheduled and queue triggers fire repeatedly; single triggers fire once. */
    public boolean isRecurring() {
        return !(schedule instanceof TriggerSchedule.SingleSchedule);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .processName(processName)
                .processPath(processPath)
                .processArgs(processArgs)
                .gitRepo(gitRepo)
                .gitBranch(gitBranch)
                .blocking(blocking)
                .priority(priority)
                .schedulerWhitelist(schedulerWhitelist)
                .status(status)
                .lastRun(lastRun)
                .schedule(schedule);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String name;
        private String processName;
        private String processPath;
        private String processArgs;
        private boolean gitRepo;
        private String gitBranch;
        private boolean blocking;
        private int priority = 0;
        private List<String> schedulerWhitelist;
        private TriggerStatus status = TriggerStatus.IDLE;
        private Instant lastRun;
        private TriggerSchedule schedule;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder processName(String processName) {
            this.processName = processName;
            return this;
        }

        public Builder processPath(String processPath) {
            this.processPath = processPath;
            return this;
        }

        public Builder processArgs(String processArgs) {
            this.processArgs = processArgs;
            return this;
        }

        public Builder gitRepo(boolean gitRepo) {
            this.gitRepo = gitRepo;
            return this;
        }

        public Builder gitBranch(String gitBranch) {
            this.gitBranch = gitBranch;
            return this;
        }

        public Builder blocking(boolean blocking) {
            this.blocking = blocking;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder schedulerWhitelist(List<String> schedulerWhitelist) {
            this.schedulerWhitelist = schedulerWhitelist;
            return this;
        }

        public Builder status(TriggerStatus status) {
            this.status = status;
            return this;
        }

        public Builder lastRun(Instant lastRun) {
            this.lastRun = lastRun;
            return this;
        }

        public Builder schedule(TriggerSchedule schedule) {
            this.schedule = schedule;
            return this;
        }

        public Trigger build() {
            return new Trigger(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Trigger trigger))
            return false;
        return Objects.equals(id, trigger.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Trigger{id='" + id + "', name='" + name + "', type=" + type() + ", status=" + status + "}";
    }
}

package openorchestrator.scheduler.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable record of one process execution launched by a scheduler.
 * {@code endTime} is set exactly when the status leaves RUNNING.
 */
public final class Job {
    private final String id;
    private final String processName;
    private final String schedulerName;
    private final JobStatus status;
    private final Instant startTime;
    private final Instant endTime;

    private Job(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.processName = Objects.requireNonNull(builder.processName, "processName is required");
        this.schedulerName = Objects.requireNonNull(builder.schedulerName, "schedulerName is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.startTime = builder.startTime;
        this.endTime = builder.endTime;
    }

    public String id() {
        return id;
    }

    public String processName() {
        return processName;
    }

    public String schedulerName() {
        return schedulerName;
    }

    public JobStatus status() {
        return status;
    }

    public Instant startTime() {
        return startTime;
    }

    public Instant endTime() {
        return endTime;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String processName;
        private String schedulerName;
        private JobStatus status = JobStatus.RUNNING;
        private Instant startTime;
        private Instant endTime;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder processName(String processName) {
            this.processName = processName;
            return this;
        }

        public Builder schedulerName(String schedulerName) {
            this.schedulerName = schedulerName;
            return this;
        }

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public Job build() {
            return new Job(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Job job))
            return false;
        return Objects.equals(id, job.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Job{id='" + id + "', process='" + processName + "', status=" + status + "}";
    }
}

package openorchestrator.scheduler.loop;

/**
 * Operator switches read once per tick.
 */
public final class OperatingMode {

    private volatile boolean running;
    private volatile boolean exclusive;

    public boolean isRunning() {
        return running;
    }

    public void setRunning(boolean running) {
        this.running = running;
    }

    /** When set, only triggers that whitelist this machine are picked up. */
    public boolean isExclusive() {
        return exclusive;
    }

    public void setExclusive(boolean exclusive) {
        this.exclusive = exclusive;
    }

    @Override
    public String toString() {
        return "OperatingMode{running=" + running + ", exclusive=" + exclusive + "}";
    }
}

package fr.lapetina.lex.core.domain.model;

/**
 * Scheduling priority of a queued request. A lower level is dispatched first.
 */
public enum RequestPriority {
    CRITICAL(1),
    HIGH(2),
    NORMAL(3),
    LOW(4),
    BATCH(5);

    private final int level;

    RequestPriority(int level) {
        this.level = level;
    }

    public int level() {
        return level;
    }

    /**
     * Low and batch requests tolerate being buffered with others before dispatch.
     */
    public boolean isDeferrable() {
        return this == LOW || this == BATCH;
    }

    public static RequestPriority fromLevel(int level) {
        for (RequestPriority priority : values()) {
            if (priority.level == level) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown priority level: " + level);
    }
}

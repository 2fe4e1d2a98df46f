package refinery.engine.model;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Worker slot status.
 */
public enum WorkerStatus {
    /** Waiting for a task */
    IDLE,
    /** Executing a task */
    BUSY,
    /** Its task outlived the timeout and was taken away; still stuck in the call */
    STALLED,
    /** Loop has exited */
    STOPPED;

    private static final Map<WorkerStatus, Set<WorkerStatus>> TRANSITIONS = new EnumMap<>(WorkerStatus.class);

    static {
        TRANSITIONS.put(IDLE, EnumSet.of(BUSY, STOPPED));
        TRANSITIONS.put(BUSY, EnumSet.of(IDLE, STALLED, STOPPED));
        TRANSITIONS.put(STALLED, EnumSet.of(IDLE, STOPPED));
        TRANSITIONS.put(STOPPED, EnumSet.of(IDLE));
    }

    public boolean canTransitionTo(WorkerStatus next) {
        return this == next || TRANSITIONS.get(this).contains(next);
    }
}

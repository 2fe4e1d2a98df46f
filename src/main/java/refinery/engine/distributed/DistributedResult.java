package refinery.engine.distributed;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one {@code processDistributed} call.
 *
 * @param results ordered list of completed results, or the aggregate when an aggregate function was given
 * @param errors  last error message per failed task ID, in submission order
 * @param <V>     result type
 */
public record DistributedResult<V>(
        int totalTasks,
        int completedTasks,
        int failedTasks,
        V results,
        Map<String, String> errors,
        int totalRetries,
        Duration elapsed) {

    public DistributedResult {
        errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    public boolean hasFailures() {
        return failedTasks > 0;
    }
}

package graphql.consulting.incremental.result;

import graphql.PublicApi;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One payload of the stream following an {@link IncrementalExecutionResult}.
 */
@PublicApi
public class SubsequentIncrementalExecutionResult {

    private final boolean hasNext;
    private final List<PendingResult> pending;
    private final List<IncrementalResult> incremental;
    private final List<CompletedResult> completed;

    public SubsequentIncrementalExecutionResult(boolean hasNext,
                                                List<PendingResult> pending,
                                                List<IncrementalResult> incremental,
                                                List<CompletedResult> completed) {
        this.hasNext = hasNext;
        this.pending = emptyToNull(pending);
        this.incremental = emptyToNull(incremental);
        this.completed = emptyToNull(completed);
    }

    public boolean hasNext() {
        return hasNext;
    }

    /**
     * @return ids announced with this payload, or null
     */
    public List<PendingResult> getPending() {
        return pending;
    }

    public List<IncrementalResult> getIncremental() {
        return incremental;
    }

    public List<CompletedResult> getCompleted() {
        return completed;
    }

    public Map<String, Object> toSpecification() {
        Map<String, Object> result = new LinkedHashMap<>();
        if (pending != null) {
            List<Map<String, Object>> list = new ArrayList<>();
            for (PendingResult pendingResult : pending) {
                list.add(pendingResult.toSpecification());
            }
            result.put("pending", list);
        }
        if (incremental != null) {
            List<Map<String, Object>> list = new ArrayList<>();
            for (IncrementalResult incrementalResult : incremental) {
                list.add(incrementalResult.toSpecification());
            }
            result.put("incremental", list);
        }
        if (completed != null) {
            List<Map<String, Object>> list = new ArrayList<>();
            for (CompletedResult completedResult : completed) {
                list.add(completedResult.toSpecification());
            }
            result.put("completed", list);
        }
        result.put("hasNext", hasNext);
        return result;
    }

    private static <T> List<T> emptyToNull(List<T> list) {
        return list == null || list.isEmpty() ? null : new ArrayList<>(list);
    }

    @Override
    public String toString() {
        return "SubsequentIncrementalExecutionResult" + toSpecification();
    }
}

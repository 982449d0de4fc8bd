package graphql.consulting.incremental.result;

import graphql.ExecutionResultImpl;
import graphql.GraphQLError;
import graphql.PublicApi;
import org.reactivestreams.Publisher;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The initial result of an operation using {@code @defer} or {@code @stream}. The rest of the
 * response is delivered through {@link #getSubsequentResults()}.
 */
@PublicApi
public class IncrementalExecutionResult extends ExecutionResultImpl {

    private final List<PendingResult> pending;
    private final boolean hasNext;
    private final Publisher<SubsequentIncrementalExecutionResult> subsequentResults;

    public IncrementalExecutionResult(Object data,
                                      List<? extends GraphQLError> errors,
                                      List<PendingResult> pending,
                                      boolean hasNext,
                                      Publisher<SubsequentIncrementalExecutionResult> subsequentResults) {
        super(data, errors, null);
        this.pending = pending;
        this.hasNext = hasNext;
        this.subsequentResults = subsequentResults;
    }

    public List<PendingResult> getPending() {
        return pending;
    }

    public boolean hasNext() {
        return hasNext;
    }

    /**
     * The remaining payloads. Can be subscribed to once; cancelling releases streamed sources.
     */
    public Publisher<SubsequentIncrementalExecutionResult> getSubsequentResults() {
        return subsequentResults;
    }

    @Override
    public Map<String, Object> toSpecification() {
        Map<String, Object> result = new LinkedHashMap<>(super.toSpecification());
        List<Map<String, Object>> pendingList = new ArrayList<>();
        for (PendingResult pendingResult : pending) {
            pendingList.add(pendingResult.toSpecification());
        }
        result.put("pending", pendingList);
        result.put("hasNext", hasNext);
        return result;
    }
}

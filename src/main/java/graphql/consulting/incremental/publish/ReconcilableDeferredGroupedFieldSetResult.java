package graphql.consulting.incremental.publish;

import graphql.GraphQLError;
import graphql.Internal;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A deferred grouped field set that completed with data, possibly with field errors.
 */
@Internal
public class ReconcilableDeferredGroupedFieldSetResult extends DeferredGroupedFieldSetResult {

    private final Map<String, Object> data;
    private final List<GraphQLError> errors;
    private final List<IncrementalDataRecord> incrementalDataRecords;
    // both guarded by the graph
    private boolean sent;
    private boolean handled;

    public ReconcilableDeferredGroupedFieldSetResult(List<DeferredFragmentRecord> deferredFragmentRecords,
                                                     List<Object> path,
                                                     Map<String, Object> data,
                                                     List<GraphQLError> errors,
                                                     List<IncrementalDataRecord> incrementalDataRecords) {
        super(deferredFragmentRecords, path);
        this.data = data;
        this.errors = errors == null || errors.isEmpty() ? null : errors;
        this.incrementalDataRecords = incrementalDataRecords == null ? Collections.<IncrementalDataRecord>emptyList() : incrementalDataRecords;
    }

    public Map<String, Object> getData() {
        return data;
    }

    /**
     * @return the field errors, or null if there were none
     */
    public List<GraphQLError> getErrors() {
        return errors;
    }

    public List<IncrementalDataRecord> getIncrementalDataRecords() {
        return incrementalDataRecords;
    }

    boolean isSent() {
        return sent;
    }

    void markSent() {
        sent = true;
    }

    boolean isHandled() {
        return handled;
    }

    void markHandled() {
        handled = true;
    }
}

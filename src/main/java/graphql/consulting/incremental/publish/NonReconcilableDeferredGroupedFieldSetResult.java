package graphql.consulting.incremental.publish;

import graphql.GraphQLError;
import graphql.Internal;

import java.util.List;

/**
 * A deferred grouped field set whose data was nulled entirely by a non-null violation.
 */
@Internal
public class NonReconcilableDeferredGroupedFieldSetResult extends DeferredGroupedFieldSetResult {

    private final List<GraphQLError> errors;

    public NonReconcilableDeferredGroupedFieldSetResult(List<DeferredFragmentRecord> deferredFragmentRecords,
                                                        List<Object> path,
                                                        List<GraphQLError> errors) {
        super(deferredFragmentRecords, path);
        this.errors = errors;
    }

    public List<GraphQLError> getErrors() {
        return errors;
    }
}

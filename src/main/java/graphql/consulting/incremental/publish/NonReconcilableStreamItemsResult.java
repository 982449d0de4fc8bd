package graphql.consulting.incremental.publish;

import graphql.GraphQLError;
import graphql.Internal;

import java.util.List;

/**
 * The stream failed: its source errored or a non-null item could not be completed.
 */
@Internal
public class NonReconcilableStreamItemsResult extends StreamItemsResult {

    private final List<GraphQLError> errors;

    public NonReconcilableStreamItemsResult(StreamRecord streamRecord, List<GraphQLError> errors) {
        super(streamRecord);
        this.errors = errors;
    }

    public List<GraphQLError> getErrors() {
        return errors;
    }
}

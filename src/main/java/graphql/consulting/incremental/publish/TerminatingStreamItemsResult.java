package graphql.consulting.incremental.publish;

import graphql.Internal;

/**
 * The source of a stream is exhausted.
 */
@Internal
public class TerminatingStreamItemsResult extends StreamItemsResult {

    public TerminatingStreamItemsResult(StreamRecord streamRecord) {
        super(streamRecord);
    }
}

package graphql.consulting.incremental.publish;

import graphql.Internal;
import graphql.execution.ResultPath;

/**
 * A streamed list field at one path.
 */
@Internal
public class StreamRecord extends SubsequentResultRecord {

    public StreamRecord(ResultPath path, String label) {
        super(path, label);
    }
}

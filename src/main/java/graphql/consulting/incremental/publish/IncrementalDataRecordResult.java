package graphql.consulting.incremental.publish;

import graphql.Internal;

/**
 * The completed value of an {@link IncrementalDataRecord}.
 */
@Internal
public interface IncrementalDataRecordResult {
}

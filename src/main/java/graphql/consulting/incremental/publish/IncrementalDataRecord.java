package graphql.consulting.incremental.publish;

import graphql.Internal;

/**
 * A unit of asynchronous incremental work: a deferred grouped field set or a batch of stream items.
 */
@Internal
public interface IncrementalDataRecord {
}

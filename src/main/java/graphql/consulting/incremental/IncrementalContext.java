package graphql.consulting.incremental;

import graphql.GraphQLError;
import graphql.Internal;
import graphql.consulting.incremental.collect.DeferUsage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Collects the field errors of one unit of delivery: the initial result, one deferred grouped
 * field set or one streamed item.
 */
@Internal
public class IncrementalContext {

    private final List<GraphQLError> errors = Collections.synchronizedList(new ArrayList<>());
    private final Set<DeferUsage> deferUsageSet;

    public IncrementalContext(Set<DeferUsage> deferUsageSet) {
        this.deferUsageSet = deferUsageSet;
    }

    public static IncrementalContext initial() {
        return new IncrementalContext(null);
    }

    /**
     * @return the defer usages already in effect, null outside of deferred execution
     */
    public Set<DeferUsage> getDeferUsageSet() {
        return deferUsageSet;
    }

    public void addError(GraphQLError error) {
        errors.add(error);
    }

    public List<GraphQLError> getErrors() {
        synchronized (errors) {
            return new ArrayList<>(errors);
        }
    }
}

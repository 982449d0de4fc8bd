package graphql.consulting.incremental.result;

import graphql.GraphQLError;
import graphql.PublicApi;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Data delivered for a pending id, either the fields of a deferred fragment or streamed items.
 */
@PublicApi
public abstract class IncrementalResult {

    private final String id;
    private final List<Object> subPath;
    private final List<GraphQLError> errors;

    protected IncrementalResult(String id, List<Object> subPath, List<GraphQLError> errors) {
        this.id = id;
        this.subPath = subPath;
        this.errors = errors;
    }

    public String getId() {
        return id;
    }

    /**
     * @return the path below the pending path the data belongs at, or null
     */
    public List<Object> getSubPath() {
        return subPath;
    }

    public List<GraphQLError> getErrors() {
        return errors;
    }

    public Map<String, Object> toSpecification() {
        Map<String, Object> result = new LinkedHashMap<>();
        putPayload(result);
        result.put("id", id);
        if (subPath != null) {
            result.put("subPath", subPath);
        }
        if (errors != null) {
            result.put("errors", errorsToSpecification(errors));
        }
        return result;
    }

    protected abstract void putPayload(Map<String, Object> result);

    static List<Map<String, Object>> errorsToSpecification(List<GraphQLError> errors) {
        List<Map<String, Object>> result = new ArrayList<>(errors.size());
        for (GraphQLError error : errors) {
            result.add(error.toSpecification());
        }
        return result;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + toSpecification();
    }
}

package graphql.consulting.incremental.result;

import graphql.GraphQLError;
import graphql.PublicApi;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tells the client that a pending id is done, with the errors that ended it if it failed.
 */
@PublicApi
public class CompletedResult {

    private final String id;
    private final List<GraphQLError> errors;

    public CompletedResult(String id) {
        this(id, null);
    }

    public CompletedResult(String id, List<GraphQLError> errors) {
        this.id = id;
        this.errors = errors;
    }

    public String getId() {
        return id;
    }

    public List<GraphQLError> getErrors() {
        return errors;
    }

    public Map<String, Object> toSpecification() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("id", id);
        if (errors != null) {
            result.put("errors", IncrementalResult.errorsToSpecification(errors));
        }
        return result;
    }

    @Override
    public String toString() {
        return "CompletedResult" + toSpecification();
    }
}

package graphql.consulting.incremental.values;

import graphql.GraphQLError;
import graphql.PublicApi;

import java.util.List;
import java.util.Map;

/**
 * Either the coerced variable values of an operation, or the errors that prevented coercion.
 */
@PublicApi
public class CoercedVariableValues {

    private final Map<String, Object> coerced;
    private final List<GraphQLError> errors;

    private CoercedVariableValues(Map<String, Object> coerced, List<GraphQLError> errors) {
        this.coerced = coerced;
        this.errors = errors;
    }

    public static CoercedVariableValues coerced(Map<String, Object> coerced) {
        return new CoercedVariableValues(coerced, null);
    }

    public static CoercedVariableValues errors(List<GraphQLError> errors) {
        return new CoercedVariableValues(null, errors);
    }

    public boolean hasErrors() {
        return errors != null;
    }

    public Map<String, Object> getCoerced() {
        return coerced;
    }

    public List<GraphQLError> getErrors() {
        return errors;
    }
}

package graphql.consulting.incremental.values;

import graphql.GraphQLError;
import graphql.PublicApi;

import java.util.List;

/**
 * Receives every problem found while coercing an input value. {@code path} leads from the coerced
 * value to the invalid part of it.
 */
@PublicApi
@FunctionalInterface
public interface InputValueErrorHandler {

    void onError(List<Object> path, Object invalidValue, GraphQLError error);
}

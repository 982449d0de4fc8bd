package graphql.consulting.incremental;

import graphql.GraphQLError;
import graphql.PublicApi;

import java.util.List;

/**
 * The request cannot be executed at all: no operation could be selected or its variables are
 * invalid.
 */
@PublicApi
public class InvalidRequestException extends RuntimeException {

    private final List<GraphQLError> errors;

    public InvalidRequestException(List<GraphQLError> errors) {
        super(errors.isEmpty() ? "Invalid request" : errors.get(0).getMessage());
        this.errors = errors;
    }

    public List<GraphQLError> getErrors() {
        return errors;
    }
}

package graphql.consulting.incremental;

import graphql.ErrorType;
import graphql.GraphQLError;
import graphql.GraphqlErrorHelper;
import graphql.PublicApi;
import graphql.language.SourceLocation;

import java.util.List;

/**
 * This is the base error that indicates that a non null field value was in fact null.
 * It is raised without location and located like every other field error.
 */
@PublicApi
public class NonNullableFieldWasNullError extends RuntimeException implements GraphQLError {

    private final String message;
    private final List<Object> path;

    public NonNullableFieldWasNullError(ResolveInfo info) {
        this.path = info.getPath().toList();
        this.message = String.format("Cannot return null for non-nullable field %s.%s.",
                info.getParentType().getName(), info.getFieldName());
    }

    @Override
    public String getMessage() {
        return message;
    }

    @Override
    public List<Object> getPath() {
        return path;
    }

    @Override
    public List<SourceLocation> getLocations() {
        return null;
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.NullValueInNonNullableField;
    }

    @Override
    public String toString() {
        return "NonNullableFieldWasNullError{" +
                "message='" + message + '\'' +
                ", path=" + path +
                '}';
    }

    @SuppressWarnings("EqualsWhichDoesntCheckParameterClass")
    @Override
    public boolean equals(Object o) {
        return GraphqlErrorHelper.equals(this, o);
    }

    @Override
    public int hashCode() {
        return GraphqlErrorHelper.hashCode(this);
    }
}

package graphql.consulting.incremental;

import graphql.ErrorClassification;
import graphql.ErrorType;
import graphql.GraphQLError;
import graphql.GraphqlErrorHelper;
import graphql.PublicApi;
import graphql.execution.ResultPath;
import graphql.language.Node;
import graphql.language.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * A {@link GraphQLError} that knows the AST nodes and the response path that caused it.
 * <p>
 * Raw exceptions thrown by resolvers, serializers and the engine itself are converted with
 * {@link #locate(Throwable, List, ResultPath)} before they are recorded in a result.
 */
@PublicApi
public class LocatedError extends RuntimeException implements GraphQLError {

    private final String message;
    private final List<SourceLocation> locations;
    private final List<Object> path;
    private final Throwable originalError;
    private final Map<String, Object> extensions;

    public LocatedError(String message) {
        this(message, Collections.<Node>emptyList(), null, null, null);
    }

    public LocatedError(String message, Node<?> node) {
        this(message, node == null ? Collections.<Node>emptyList() : Collections.<Node>singletonList(node), null, null, null);
    }

    public LocatedError(String message, List<? extends Node> nodes) {
        this(message, nodes, null, null, null);
    }

    public LocatedError(String message,
                        List<? extends Node> nodes,
                        List<Object> path,
                        Throwable originalError,
                        Map<String, Object> extensions) {
        super(message, originalError);
        this.message = message;
        this.locations = locationsOf(nodes);
        this.path = path;
        this.originalError = originalError;
        this.extensions = extensions;
    }

    private LocatedError(String message,
                         List<SourceLocation> locations,
                         List<Object> path,
                         Throwable originalError,
                         Map<String, Object> extensions,
                         boolean ignored) {
        super(message, originalError);
        this.message = message;
        this.locations = locations;
        this.path = path;
        this.originalError = originalError;
        this.extensions = extensions;
    }

    /**
     * Attaches nodes and path to an arbitrary error. An error that is already located keeps its own
     * locations and path.
     */
    public static LocatedError locate(Throwable rawError, List<? extends Node> nodes, ResultPath path) {
        Throwable error = rawError;
        while (error instanceof CompletionException && error.getCause() != null) {
            error = error.getCause();
        }
        if (error instanceof LocatedError && ((LocatedError) error).getPath() != null) {
            return (LocatedError) error;
        }
        List<Object> pathList = path == null ? null : path.toList();
        if (error instanceof GraphQLError) {
            GraphQLError graphQLError = (GraphQLError) error;
            List<SourceLocation> locations = graphQLError.getLocations();
            if (locations == null || locations.isEmpty()) {
                locations = locationsOf(nodes);
            }
            Throwable original = error instanceof LocatedError ? ((LocatedError) error).getOriginalError() : error;
            return new LocatedError(graphQLError.getMessage(), locations, pathList, original, graphQLError.getExtensions(), true);
        }
        String message = error.getMessage() != null ? error.getMessage() : "Unexpected error value: " + Inspector.inspect(error);
        return new LocatedError(message, locationsOf(nodes), pathList, error, null, true);
    }

    private static List<SourceLocation> locationsOf(List<? extends Node> nodes) {
        if (nodes == null || nodes.isEmpty()) {
            return Collections.emptyList();
        }
        List<SourceLocation> result = new ArrayList<>();
        for (Node<?> node : nodes) {
            if (node != null && node.getSourceLocation() != null) {
                result.add(node.getSourceLocation());
            }
        }
        return result;
    }

    public Throwable getOriginalError() {
        return originalError;
    }

    @Override
    public String getMessage() {
        return message;
    }

    @Override
    public List<SourceLocation> getLocations() {
        return locations;
    }

    @Override
    public List<Object> getPath() {
        return path;
    }

    @Override
    public Map<String, Object> getExtensions() {
        return extensions;
    }

    @Override
    public ErrorClassification getErrorType() {
        if (originalError instanceof GraphQLError && originalError != this) {
            return ((GraphQLError) originalError).getErrorType();
        }
        return ErrorType.DataFetchingException;
    }

    @Override
    public String toString() {
        return "LocatedError{" +
                "message='" + message + '\'' +
                ", locations=" + locations +
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

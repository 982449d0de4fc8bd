package graphql.consulting.incremental;

import graphql.Internal;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Wraps field resolvers with the registered middlewares.
 * <p>
 * The first middleware is closest to the resolver and the last registered one is the outermost.
 * Wrapped resolvers are cached per resolver instance.
 */
@Internal
public class MiddlewareChain {

    private final List<FieldMiddleware> middlewares;
    private final Map<FieldResolver, FieldResolver> cachedResolvers = new ConcurrentHashMap<>();

    public MiddlewareChain(List<FieldMiddleware> middlewares) {
        this.middlewares = new ArrayList<>(middlewares);
    }

    public FieldResolver getFieldResolver(FieldResolver fieldResolver) {
        if (middlewares.isEmpty()) {
            return fieldResolver;
        }
        return cachedResolvers.computeIfAbsent(fieldResolver, this::chain);
    }

    private FieldResolver chain(FieldResolver baseResolver) {
        FieldResolver current = baseResolver;
        for (FieldMiddleware middleware : middlewares) {
            FieldResolver next = current;
            current = (source, arguments, info) -> middleware.resolve(next, source, arguments, info);
        }
        return current;
    }
}

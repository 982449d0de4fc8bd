package graphql.consulting.incremental;

import graphql.PublicApi;

import java.util.Map;

/**
 * Wraps every field resolver. Implementations call {@code next} to continue the chain.
 */
@PublicApi
public interface FieldMiddleware {

    Object resolve(FieldResolver next, Object source, Map<String, Object> arguments, ResolveInfo info) throws Exception;
}

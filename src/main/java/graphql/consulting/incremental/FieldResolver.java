package graphql.consulting.incremental;

import graphql.PublicApi;

import java.util.Map;

/**
 * Resolves the value of one field. The result may be a plain value, a {@link reactor.core.publisher.Mono}
 * or {@link java.util.concurrent.CompletionStage} for values that are not ready yet, or a
 * {@link org.reactivestreams.Publisher} for list fields whose items arrive over time.
 */
@PublicApi
public interface FieldResolver {

    Object resolve(Object source, Map<String, Object> arguments, ResolveInfo info) throws Exception;
}

package graphql.consulting.incremental;

import graphql.PublicApi;

/**
 * Returns a {@link Boolean} or a pending {@link Boolean}.
 */
@PublicApi
public interface IsTypeOf {

    Object isTypeOf(Object value, ResolveInfo info);
}

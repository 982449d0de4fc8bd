package graphql.consulting.incremental;

import graphql.PublicApi;
import graphql.schema.GraphQLNamedOutputType;

/**
 * Finds the object type of a value returned for an interface or union field.
 * <p>
 * Returns a type name, a {@link graphql.schema.GraphQLObjectType}, or a pending value of either.
 */
@PublicApi
public interface TypeResolver {

    Object resolveType(Object value, ResolveInfo info, GraphQLNamedOutputType abstractType);
}

package graphql.consulting.incremental;

import graphql.Internal;
import graphql.schema.GraphQLInterfaceType;
import graphql.schema.GraphQLNamedOutputType;
import graphql.schema.GraphQLObjectType;
import graphql.schema.GraphQLUnionType;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Uses the {@code __typename} entry of a map value, otherwise asks the is-type-of predicate of
 * every possible type. Pending predicates are awaited in the order of the possible types.
 */
@Internal
public class DefaultTypeResolver implements TypeResolver {

    private final ResolverRegistry resolverRegistry;

    public DefaultTypeResolver(ResolverRegistry resolverRegistry) {
        this.resolverRegistry = resolverRegistry;
    }

    @Override
    public Object resolveType(Object value, ResolveInfo info, GraphQLNamedOutputType abstractType) {
        if (value instanceof Map) {
            Object typename = ((Map<?, ?>) value).get("__typename");
            if (typename instanceof String) {
                return typename;
            }
        }

        List<GraphQLObjectType> pendingTypes = new ArrayList<>();
        List<Mono<Object>> pendingResults = new ArrayList<>();
        for (GraphQLObjectType possibleType : possibleTypes(info, abstractType)) {
            IsTypeOf isTypeOf = resolverRegistry.getIsTypeOf(possibleType.getName());
            if (isTypeOf == null) {
                continue;
            }
            Object isTypeOfResult = isTypeOf.isTypeOf(value, info);
            if (Async.isPending(isTypeOfResult)) {
                pendingTypes.add(possibleType);
                pendingResults.add(Async.toMono(isTypeOfResult));
            } else if (Boolean.TRUE.equals(isTypeOfResult)) {
                return possibleType.getName();
            }
        }
        if (pendingResults.isEmpty()) {
            return null;
        }
        return Flux.range(0, pendingResults.size())
                .concatMap(index -> pendingResults.get(index)
                        .filter(Boolean.TRUE::equals)
                        .map(matched -> pendingTypes.get(index).getName()))
                .next();
    }

    private List<GraphQLObjectType> possibleTypes(ResolveInfo info, GraphQLNamedOutputType abstractType) {
        if (abstractType instanceof GraphQLInterfaceType) {
            return info.getSchema().getImplementations((GraphQLInterfaceType) abstractType);
        }
        if (abstractType instanceof GraphQLUnionType) {
            List<GraphQLObjectType> result = new ArrayList<>();
            for (GraphQLNamedOutputType type : ((GraphQLUnionType) abstractType).getTypes()) {
                result.add((GraphQLObjectType) type);
            }
            return result;
        }
        return Collections.emptyList();
    }
}

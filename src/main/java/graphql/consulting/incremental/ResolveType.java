package graphql.consulting.incremental;

import graphql.Internal;
import graphql.consulting.incremental.collect.FieldGroup;
import graphql.schema.GraphQLNamedOutputType;
import graphql.schema.GraphQLObjectType;
import graphql.schema.GraphQLType;
import reactor.core.publisher.Mono;

/**
 * Determines the object type of a value completed for an interface or union type.
 */
@Internal
public class ResolveType {

    public Mono<GraphQLObjectType> resolveType(ExecutionContext executionContext,
                                               GraphQLNamedOutputType abstractType,
                                               FieldGroup fieldGroup,
                                               ResolveInfo info,
                                               Object value) {
        TypeResolver typeResolver = executionContext.getTypeResolver(abstractType);
        Object runtimeType = typeResolver.resolveType(value, info, abstractType);

        Mono<Object> runtimeTypeMono;
        if (Async.isPending(runtimeType)) {
            runtimeTypeMono = Async.toMono(runtimeType).publishOn(executionContext.getScheduler());
        } else {
            runtimeTypeMono = Mono.justOrEmpty(runtimeType);
        }
        return runtimeTypeMono
                .map(resolved -> ensureValidRuntimeType(resolved, executionContext, abstractType, fieldGroup, info, value))
                .switchIfEmpty(Mono.defer(() -> Mono.error(unresolvedTypeError(abstractType, fieldGroup, info))));
    }

    private GraphQLObjectType ensureValidRuntimeType(Object runtimeTypeOrName,
                                                     ExecutionContext executionContext,
                                                     GraphQLNamedOutputType abstractType,
                                                     FieldGroup fieldGroup,
                                                     ResolveInfo info,
                                                     Object value) {
        String runtimeTypeName;
        if (runtimeTypeOrName instanceof GraphQLObjectType) {
            runtimeTypeName = ((GraphQLObjectType) runtimeTypeOrName).getName();
        } else if (runtimeTypeOrName instanceof String) {
            runtimeTypeName = (String) runtimeTypeOrName;
        } else {
            throw new LocatedError("Abstract type '" + abstractType.getName() + "' must resolve to an Object type at runtime for field '"
                    + info.getParentType().getName() + "." + info.getFieldName() + "' with value " + Inspector.inspect(value)
                    + ", received '" + Inspector.inspect(runtimeTypeOrName) + "'.", fieldGroup.toNodes());
        }

        GraphQLType runtimeType = executionContext.getGraphQLSchema().getType(runtimeTypeName);
        if (runtimeType == null) {
            throw new LocatedError("Abstract type '" + abstractType.getName() + "' was resolved to a type '" + runtimeTypeName
                    + "' that does not exist inside the schema.", fieldGroup.toNodes());
        }
        if (!(runtimeType instanceof GraphQLObjectType)) {
            throw new LocatedError("Abstract type '" + abstractType.getName() + "' was resolved to a non-object type '"
                    + runtimeTypeName + "'.", fieldGroup.toNodes());
        }
        GraphQLObjectType objectType = (GraphQLObjectType) runtimeType;
        if (!executionContext.getGraphQLSchema().isPossibleType(abstractType, objectType)) {
            throw new LocatedError("Runtime Object type '" + objectType.getName() + "' is not a possible type for '"
                    + abstractType.getName() + "'.", fieldGroup.toNodes());
        }
        return objectType;
    }

    private LocatedError unresolvedTypeError(GraphQLNamedOutputType abstractType, FieldGroup fieldGroup, ResolveInfo info) {
        return new LocatedError("Abstract type '" + abstractType.getName() + "' must resolve to an Object type at runtime for field '"
                + info.getParentType().getName() + "." + info.getFieldName() + "'. Either the '" + abstractType.getName()
                + "' type should provide a type resolver or each possible type should provide an is-type-of predicate.",
                fieldGroup.toNodes());
    }
}

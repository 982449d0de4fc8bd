package graphql.consulting.incremental;

import graphql.PublicApi;
import graphql.schema.FieldCoordinates;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Holds the resolvers of a schema: field and subscribe resolvers per field coordinates, type
 * resolvers per abstract type, is-type-of predicates per object type and the internal names
 * under which arguments are handed to resolvers.
 */
@PublicApi
public class ResolverRegistry {

    private final Map<FieldCoordinates, FieldResolver> fieldResolvers = new LinkedHashMap<>();
    private final Map<FieldCoordinates, FieldResolver> subscribeResolvers = new LinkedHashMap<>();
    private final Map<String, TypeResolver> typeResolvers = new LinkedHashMap<>();
    private final Map<String, IsTypeOf> isTypeOfs = new LinkedHashMap<>();
    private final Map<FieldCoordinates, Map<String, String>> argumentOutNames = new LinkedHashMap<>();

    public ResolverRegistry addFieldResolver(FieldCoordinates fieldCoordinates, FieldResolver fieldResolver) {
        fieldResolvers.put(fieldCoordinates, fieldResolver);
        return this;
    }

    public ResolverRegistry addFieldResolver(String typeName, String fieldName, FieldResolver fieldResolver) {
        return addFieldResolver(FieldCoordinates.coordinates(typeName, fieldName), fieldResolver);
    }

    public ResolverRegistry addSubscribeResolver(String typeName, String fieldName, FieldResolver subscribeResolver) {
        subscribeResolvers.put(FieldCoordinates.coordinates(typeName, fieldName), subscribeResolver);
        return this;
    }

    public ResolverRegistry addTypeResolver(String abstractTypeName, TypeResolver typeResolver) {
        typeResolvers.put(abstractTypeName, typeResolver);
        return this;
    }

    public ResolverRegistry addIsTypeOf(String objectTypeName, IsTypeOf isTypeOf) {
        isTypeOfs.put(objectTypeName, isTypeOf);
        return this;
    }

    /**
     * Hands the argument {@code argumentName} of the given field to its resolver as {@code outName}.
     */
    public ResolverRegistry addArgumentOutName(String typeName, String fieldName, String argumentName, String outName) {
        argumentOutNames.computeIfAbsent(FieldCoordinates.coordinates(typeName, fieldName), k -> new LinkedHashMap<>())
                .put(argumentName, outName);
        return this;
    }

    public FieldResolver getFieldResolver(FieldCoordinates fieldCoordinates) {
        return fieldResolvers.get(fieldCoordinates);
    }

    public FieldResolver getSubscribeResolver(FieldCoordinates fieldCoordinates) {
        return subscribeResolvers.get(fieldCoordinates);
    }

    public TypeResolver getTypeResolver(String abstractTypeName) {
        return typeResolvers.get(abstractTypeName);
    }

    public IsTypeOf getIsTypeOf(String objectTypeName) {
        return isTypeOfs.get(objectTypeName);
    }

    public Map<String, String> getArgumentOutNames(FieldCoordinates fieldCoordinates) {
        return argumentOutNames.get(fieldCoordinates);
    }
}

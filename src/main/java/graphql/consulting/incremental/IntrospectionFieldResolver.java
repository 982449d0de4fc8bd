package graphql.consulting.incremental;

import graphql.Internal;
import graphql.execution.MergedField;
import graphql.introspection.Introspection;
import graphql.schema.DataFetcher;
import graphql.schema.DataFetchingEnvironment;
import graphql.schema.DataFetchingEnvironmentImpl;
import graphql.schema.FieldCoordinates;
import graphql.schema.GraphQLFieldDefinition;

import java.util.Locale;
import java.util.Map;

/**
 * Resolves {@code __schema}, {@code __type} and the fields of the introspection types with the
 * data fetchers graphql-java registers for them.
 */
@Internal
public class IntrospectionFieldResolver implements FieldResolver {

    public static final IntrospectionFieldResolver INSTANCE = new IntrospectionFieldResolver();

    public static final FieldResolver TYPENAME = (source, arguments, info) -> info.getParentType().getName();

    public static boolean isIntrospectionField(GraphQLFieldDefinition fieldDefinition, String parentTypeName) {
        return fieldDefinition == Introspection.SchemaMetaFieldDef ||
                fieldDefinition == Introspection.TypeMetaFieldDef ||
                parentTypeName.startsWith("__");
    }

    @Override
    public Object resolve(Object source, Map<String, Object> arguments, ResolveInfo info) throws Exception {
        GraphQLFieldDefinition fieldDefinition = info.getFieldDefinition();
        FieldCoordinates coordinates;
        if (fieldDefinition == Introspection.SchemaMetaFieldDef || fieldDefinition == Introspection.TypeMetaFieldDef) {
            coordinates = FieldCoordinates.systemCoordinates(fieldDefinition.getName());
        } else {
            coordinates = FieldCoordinates.coordinates(info.getParentType(), fieldDefinition);
        }
        DataFetcher<?> dataFetcher = info.getSchema().getCodeRegistry().getDataFetcher(coordinates, fieldDefinition);
        DataFetchingEnvironment env = DataFetchingEnvironmentImpl.newDataFetchingEnvironment()
                .source(source)
                .arguments(arguments)
                .fieldDefinition(fieldDefinition)
                .fieldType(fieldDefinition.getType())
                .parentType(info.getParentType())
                .graphQLSchema(info.getSchema())
                .graphQLContext(info.getGraphQLContext())
                .mergedField(MergedField.newMergedField(info.getFieldNodes()).build())
                .root(info.getRootValue())
                .variables(info.getVariableValues())
                .fragmentsByName(info.getFragments())
                .operationDefinition(info.getOperation())
                .locale(Locale.getDefault())
                .build();
        return dataFetcher.get(env);
    }
}

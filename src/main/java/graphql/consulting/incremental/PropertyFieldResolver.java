package graphql.consulting.incremental;

import graphql.PublicApi;
import graphql.schema.DataFetchingEnvironment;
import graphql.schema.DataFetchingEnvironmentImpl;
import graphql.schema.PropertyDataFetcher;

import java.util.Map;

/**
 * The default field resolver: reads the property named like the field from the source (map key,
 * getter or public field). A property that is itself a {@link FieldResolver} is invoked with the
 * field arguments.
 */
@PublicApi
public class PropertyFieldResolver implements FieldResolver {

    public static final PropertyFieldResolver INSTANCE = new PropertyFieldResolver();

    @Override
    public Object resolve(Object source, Map<String, Object> arguments, ResolveInfo info) throws Exception {
        if (source == null) {
            return null;
        }
        DataFetchingEnvironment env = DataFetchingEnvironmentImpl.newDataFetchingEnvironment()
                .source(source)
                .arguments(arguments)
                .fieldDefinition(info.getFieldDefinition())
                .fieldType(info.getReturnType())
                .parentType(info.getParentType())
                .graphQLSchema(info.getSchema())
                .build();
        Object property = PropertyDataFetcher.fetching(info.getFieldName()).get(env);
        if (property instanceof FieldResolver) {
            return ((FieldResolver) property).resolve(source, arguments, info);
        }
        return property;
    }
}

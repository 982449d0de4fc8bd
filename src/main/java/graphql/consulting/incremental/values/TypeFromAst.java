package graphql.consulting.incremental.values;

import graphql.Internal;
import graphql.language.ListType;
import graphql.language.NonNullType;
import graphql.language.Type;
import graphql.language.TypeName;
import graphql.schema.GraphQLList;
import graphql.schema.GraphQLNonNull;
import graphql.schema.GraphQLSchema;
import graphql.schema.GraphQLType;

@Internal
public final class TypeFromAst {

    private TypeFromAst() {
    }

    /**
     * The schema type a type reference of a document points to, or null if the schema does not
     * know the named type.
     */
    public static GraphQLType typeFromAst(GraphQLSchema schema, Type<?> type) {
        if (type instanceof ListType) {
            GraphQLType inner = typeFromAst(schema, ((ListType) type).getType());
            return inner == null ? null : GraphQLList.list(inner);
        }
        if (type instanceof NonNullType) {
            GraphQLType inner = typeFromAst(schema, ((NonNullType) type).getType());
            return inner == null ? null : GraphQLNonNull.nonNull(inner);
        }
        return schema.getType(((TypeName) type).getName());
    }
}

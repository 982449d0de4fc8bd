package graphql.consulting.incremental.collect;

import graphql.PublicApi;
import graphql.schema.GraphQLDirective;

import static graphql.Scalars.GraphQLBoolean;
import static graphql.Scalars.GraphQLInt;
import static graphql.Scalars.GraphQLString;
import static graphql.introspection.Introspection.DirectiveLocation.FIELD;
import static graphql.introspection.Introspection.DirectiveLocation.FRAGMENT_SPREAD;
import static graphql.introspection.Introspection.DirectiveLocation.INLINE_FRAGMENT;
import static graphql.schema.GraphQLArgument.newArgument;
import static graphql.schema.GraphQLNonNull.nonNull;

/**
 * Definitions of the incremental delivery directives. Their arguments are coerced against these
 * definitions, so a schema does not have to declare them.
 */
@PublicApi
public final class IncrementalDirectives {

    public static final String DEFER = "defer";
    public static final String STREAM = "stream";

    public static final GraphQLDirective DeferDirective = GraphQLDirective.newDirective()
            .name(DEFER)
            .description("Directs the executor to deliver this fragment incrementally.")
            .argument(newArgument()
                    .name("if")
                    .type(nonNull(GraphQLBoolean))
                    .defaultValueProgrammatic(true))
            .argument(newArgument()
                    .name("label")
                    .type(GraphQLString))
            .validLocations(FRAGMENT_SPREAD, INLINE_FRAGMENT)
            .build();

    public static final GraphQLDirective StreamDirective = GraphQLDirective.newDirective()
            .name(STREAM)
            .description("Directs the executor to deliver the items of this list incrementally.")
            .argument(newArgument()
                    .name("if")
                    .type(nonNull(GraphQLBoolean))
                    .defaultValueProgrammatic(true))
            .argument(newArgument()
                    .name("label")
                    .type(GraphQLString))
            .argument(newArgument()
                    .name("initialCount")
                    .type(GraphQLInt)
                    .defaultValueProgrammatic(0))
            .validLocations(FIELD)
            .build();

    private IncrementalDirectives() {
    }
}

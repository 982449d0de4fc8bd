package graphql.consulting.incremental.collect;

import graphql.Assert;
import graphql.Internal;
import graphql.language.FragmentDefinition;
import graphql.language.OperationDefinition;
import graphql.schema.GraphQLObjectType;
import graphql.schema.GraphQLSchema;

import java.util.LinkedHashMap;
import java.util.Map;

@Internal
public class FieldCollectorParameters {

    private final GraphQLSchema graphQLSchema;
    private final Map<String, FragmentDefinition> fragmentsByName;
    private final Map<String, Object> variables;
    private final GraphQLObjectType objectType;
    private final OperationDefinition.Operation operation;
    private final boolean incrementalDelivery;

    private FieldCollectorParameters(Builder builder) {
        this.graphQLSchema = builder.graphQLSchema;
        this.fragmentsByName = builder.fragmentsByName;
        this.variables = builder.variables;
        this.objectType = builder.objectType;
        this.operation = builder.operation;
        this.incrementalDelivery = builder.incrementalDelivery;
    }

    public GraphQLSchema getGraphQLSchema() {
        return graphQLSchema;
    }

    public Map<String, FragmentDefinition> getFragmentsByName() {
        return fragmentsByName;
    }

    public Map<String, Object> getVariables() {
        return variables;
    }

    public GraphQLObjectType getObjectType() {
        return objectType;
    }

    public OperationDefinition.Operation getOperation() {
        return operation;
    }

    public boolean isIncrementalDelivery() {
        return incrementalDelivery;
    }

    public static Builder newParameters() {
        return new Builder();
    }

    public static class Builder {
        private GraphQLSchema graphQLSchema;
        private final Map<String, FragmentDefinition> fragmentsByName = new LinkedHashMap<>();
        private final Map<String, Object> variables = new LinkedHashMap<>();
        private GraphQLObjectType objectType;
        private OperationDefinition.Operation operation = OperationDefinition.Operation.QUERY;
        private boolean incrementalDelivery = true;

        private Builder() {
        }

        public Builder schema(GraphQLSchema graphQLSchema) {
            this.graphQLSchema = graphQLSchema;
            return this;
        }

        public Builder objectType(GraphQLObjectType objectType) {
            this.objectType = objectType;
            return this;
        }

        public Builder fragments(Map<String, FragmentDefinition> fragmentsByName) {
            this.fragmentsByName.putAll(fragmentsByName);
            return this;
        }

        public Builder variables(Map<String, Object> variables) {
            this.variables.putAll(variables);
            return this;
        }

        public Builder operation(OperationDefinition.Operation operation) {
            this.operation = operation;
            return this;
        }

        public Builder incrementalDelivery(boolean incrementalDelivery) {
            this.incrementalDelivery = incrementalDelivery;
            return this;
        }

        public FieldCollectorParameters build() {
            Assert.assertNotNull(graphQLSchema, () -> "You must provide a schema");
            Assert.assertNotNull(objectType, () -> "You must provide an object type");
            return new FieldCollectorParameters(this);
        }
    }
}

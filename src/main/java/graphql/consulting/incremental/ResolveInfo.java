package graphql.consulting.incremental;

import graphql.GraphQLContext;
import graphql.PublicApi;
import graphql.execution.ResultPath;
import graphql.language.Field;
import graphql.language.FragmentDefinition;
import graphql.language.OperationDefinition;
import graphql.schema.GraphQLFieldDefinition;
import graphql.schema.GraphQLObjectType;
import graphql.schema.GraphQLOutputType;
import graphql.schema.GraphQLSchema;

import java.util.List;
import java.util.Map;

/**
 * Everything a resolver may want to know about the field it resolves.
 */
@PublicApi
public class ResolveInfo {

    private final String fieldName;
    private final List<Field> fieldNodes;
    private final GraphQLFieldDefinition fieldDefinition;
    private final GraphQLOutputType returnType;
    private final GraphQLObjectType parentType;
    private final ResultPath path;
    private final GraphQLSchema schema;
    private final Map<String, FragmentDefinition> fragments;
    private final Object rootValue;
    private final OperationDefinition operation;
    private final Map<String, Object> variableValues;
    private final Object context;
    private final GraphQLContext graphQLContext;

    public ResolveInfo(String fieldName,
                       List<Field> fieldNodes,
                       GraphQLFieldDefinition fieldDefinition,
                       GraphQLObjectType parentType,
                       ResultPath path,
                       GraphQLSchema schema,
                       Map<String, FragmentDefinition> fragments,
                       Object rootValue,
                       OperationDefinition operation,
                       Map<String, Object> variableValues,
                       Object context,
                       GraphQLContext graphQLContext) {
        this.fieldName = fieldName;
        this.fieldNodes = fieldNodes;
        this.fieldDefinition = fieldDefinition;
        this.returnType = fieldDefinition.getType();
        this.parentType = parentType;
        this.path = path;
        this.schema = schema;
        this.fragments = fragments;
        this.rootValue = rootValue;
        this.operation = operation;
        this.variableValues = variableValues;
        this.context = context;
        this.graphQLContext = graphQLContext;
    }

    public String getFieldName() {
        return fieldName;
    }

    public List<Field> getFieldNodes() {
        return fieldNodes;
    }

    public GraphQLFieldDefinition getFieldDefinition() {
        return fieldDefinition;
    }

    public GraphQLOutputType getReturnType() {
        return returnType;
    }

    public GraphQLObjectType getParentType() {
        return parentType;
    }

    public ResultPath getPath() {
        return path;
    }

    public GraphQLSchema getSchema() {
        return schema;
    }

    public Map<String, FragmentDefinition> getFragments() {
        return fragments;
    }

    public Object getRootValue() {
        return rootValue;
    }

    public OperationDefinition getOperation() {
        return operation;
    }

    public Map<String, Object> getVariableValues() {
        return variableValues;
    }

    @SuppressWarnings("unchecked")
    public <T> T getContext() {
        return (T) context;
    }

    public GraphQLContext getGraphQLContext() {
        return graphQLContext;
    }

    @Override
    public String toString() {
        return "ResolveInfo{" +
                "fieldName='" + fieldName + '\'' +
                ", parentType=" + parentType.getName() +
                ", path=" + path +
                '}';
    }
}

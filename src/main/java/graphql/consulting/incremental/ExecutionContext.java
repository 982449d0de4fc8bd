package graphql.consulting.incremental;

import graphql.GraphQLContext;
import graphql.GraphQLError;
import graphql.Internal;
import graphql.consulting.incremental.collect.CollectedFields;
import graphql.consulting.incremental.collect.FieldCollector;
import graphql.consulting.incremental.collect.FieldCollectorParameters;
import graphql.consulting.incremental.collect.FieldGroup;
import graphql.consulting.incremental.collect.FieldPlanBuilder;
import graphql.consulting.incremental.publish.CancellableStreamRecord;
import graphql.consulting.incremental.values.CoercedVariableValues;
import graphql.consulting.incremental.values.VariableValues;
import graphql.execution.ResultPath;
import graphql.introspection.Introspection;
import graphql.language.Definition;
import graphql.language.Document;
import graphql.language.FragmentDefinition;
import graphql.language.OperationDefinition;
import graphql.schema.FieldCoordinates;
import graphql.schema.GraphQLFieldDefinition;
import graphql.schema.GraphQLNamedOutputType;
import graphql.schema.GraphQLObjectType;
import graphql.schema.GraphQLSchema;
import reactor.core.scheduler.Scheduler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per request state: the selected operation, its coerced variables, the resolvers to call and the
 * caches of collected fields. Field errors are kept by {@link IncrementalContext}s.
 */
@Internal
public class ExecutionContext {

    private final IncrementalGraphQL graphQL;
    private final GraphQLSchema graphQLSchema;
    private final Map<String, FragmentDefinition> fragmentsByName;
    private final OperationDefinition operationDefinition;
    private final Map<String, Object> variables;
    private final Object root;
    private final Object context;
    private final GraphQLContext graphQLContext;
    private final Scheduler scheduler;

    private final FieldCollector fieldCollector = new FieldCollector();
    private final FieldPlanBuilder fieldPlanBuilder = new FieldPlanBuilder();
    private final Map<GraphQLObjectType, Map<FieldGroup, CollectedFields>> subfieldsCache = new ConcurrentHashMap<>();
    private final Map<FieldGroup, StreamUsage> streamUsageCache = new ConcurrentHashMap<>();
    private final Set<CancellableStreamRecord> cancellableStreams = ConcurrentHashMap.newKeySet();

    private ExecutionContext(IncrementalGraphQL graphQL,
                             Map<String, FragmentDefinition> fragmentsByName,
                             OperationDefinition operationDefinition,
                             Map<String, Object> variables,
                             Object root,
                             Object context,
                             GraphQLContext graphQLContext,
                             Scheduler scheduler) {
        this.graphQL = graphQL;
        this.graphQLSchema = graphQL.getGraphQLSchema();
        this.fragmentsByName = fragmentsByName;
        this.operationDefinition = operationDefinition;
        this.variables = variables;
        this.root = root;
        this.context = context;
        this.graphQLContext = graphQLContext;
        this.scheduler = scheduler;
    }

    /**
     * Selects the operation and coerces its variables.
     *
     * @throws InvalidRequestException if there is no operation to run or the variables are invalid
     */
    public static ExecutionContext build(IncrementalGraphQL graphQL, ExecutionArgs executionArgs, Scheduler scheduler) {
        Document document = executionArgs.getDocument();
        String operationName = executionArgs.getOperationName();
        OperationDefinition operation = null;
        Map<String, FragmentDefinition> fragments = new LinkedHashMap<>();
        List<GraphQLError> errors = new ArrayList<>();
        boolean multipleOperations = false;

        for (Definition<?> definition : document.getDefinitions()) {
            if (definition instanceof OperationDefinition) {
                OperationDefinition operationDefinition = (OperationDefinition) definition;
                if (operationName == null) {
                    if (operation != null) {
                        multipleOperations = true;
                    }
                    operation = operationDefinition;
                } else if (operationName.equals(operationDefinition.getName())) {
                    operation = operationDefinition;
                }
            } else if (definition instanceof FragmentDefinition) {
                FragmentDefinition fragmentDefinition = (FragmentDefinition) definition;
                fragments.put(fragmentDefinition.getName(), fragmentDefinition);
            }
        }

        if (multipleOperations) {
            errors.add(new LocatedError("Must provide operation name if query contains multiple operations."));
        } else if (operation == null) {
            if (operationName != null) {
                errors.add(new LocatedError("Unknown operation named '" + operationName + "'."));
            } else {
                errors.add(new LocatedError("Must provide an operation."));
            }
        }
        if (!errors.isEmpty()) {
            throw new InvalidRequestException(errors);
        }

        Map<String, Object> rawVariables = executionArgs.getVariables() != null ? executionArgs.getVariables() : Collections.<String, Object>emptyMap();
        CoercedVariableValues coercedVariableValues = VariableValues.coerceVariableValues(graphQL.getGraphQLSchema(),
                operation.getVariableDefinitions(), rawVariables, graphQL.getMaxVariableErrors());
        if (coercedVariableValues.hasErrors()) {
            throw new InvalidRequestException(coercedVariableValues.getErrors());
        }

        return new ExecutionContext(graphQL,
                fragments,
                operation,
                coercedVariableValues.getCoerced(),
                executionArgs.getRoot(),
                executionArgs.getContext(),
                executionArgs.getGraphQLContext(),
                scheduler);
    }

    /**
     * The context for executing the operation once more against one subscription event. Caches
     * are not shared with this context.
     */
    public ExecutionContext forEvent(Object event) {
        return new ExecutionContext(graphQL, fragmentsByName, operationDefinition, variables, event, context, graphQLContext, scheduler);
    }

    public GraphQLSchema getGraphQLSchema() {
        return graphQLSchema;
    }

    public Map<String, FragmentDefinition> getFragmentsByName() {
        return fragmentsByName;
    }

    public OperationDefinition getOperationDefinition() {
        return operationDefinition;
    }

    public Map<String, Object> getVariables() {
        return variables;
    }

    public Object getRoot() {
        return root;
    }

    public Object getContext() {
        return context;
    }

    public GraphQLContext getGraphQLContext() {
        return graphQLContext;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public boolean isIncrementalDelivery() {
        return graphQL.isIncrementalDelivery();
    }

    public FieldPlanBuilder getFieldPlanBuilder() {
        return fieldPlanBuilder;
    }

    public Set<CancellableStreamRecord> getCancellableStreams() {
        return cancellableStreams;
    }

    public Map<FieldGroup, StreamUsage> getStreamUsageCache() {
        return streamUsageCache;
    }

    public CollectedFields collectFields(GraphQLObjectType rootType) {
        return fieldCollector.collectFields(collectorParameters(rootType), operationDefinition);
    }

    /**
     * Collects the sub fields of a field group for one runtime type, once per request.
     */
    public CollectedFields collectSubfields(GraphQLObjectType returnType, FieldGroup fieldGroup) {
        Map<FieldGroup, CollectedFields> byFieldGroup = subfieldsCache.computeIfAbsent(returnType, k -> new ConcurrentHashMap<>());
        CollectedFields collectedFields = byFieldGroup.get(fieldGroup);
        if (collectedFields == null) {
            collectedFields = fieldCollector.collectSubfields(collectorParameters(returnType), fieldGroup);
            CollectedFields existing = byFieldGroup.putIfAbsent(fieldGroup, collectedFields);
            if (existing != null) {
                collectedFields = existing;
            }
        }
        return collectedFields;
    }

    private FieldCollectorParameters collectorParameters(GraphQLObjectType objectType) {
        return FieldCollectorParameters.newParameters()
                .schema(graphQLSchema)
                .objectType(objectType)
                .fragments(fragmentsByName)
                .variables(variables)
                .operation(operationDefinition.getOperation())
                .incrementalDelivery(graphQL.isIncrementalDelivery())
                .build();
    }

    /**
     * The definition of a field of the parent type, including the introspection meta fields.
     *
     * @return the definition or null if the parent type has no such field
     */
    public GraphQLFieldDefinition getFieldDefinition(GraphQLObjectType parentType, String fieldName) {
        if (fieldName.equals(Introspection.SchemaMetaFieldDef.getName()) && parentType == graphQLSchema.getQueryType()) {
            return Introspection.SchemaMetaFieldDef;
        }
        if (fieldName.equals(Introspection.TypeMetaFieldDef.getName()) && parentType == graphQLSchema.getQueryType()) {
            return Introspection.TypeMetaFieldDef;
        }
        if (fieldName.equals(Introspection.TypeNameMetaFieldDef.getName())) {
            return Introspection.TypeNameMetaFieldDef;
        }
        return parentType.getFieldDefinition(fieldName);
    }

    public FieldResolver getFieldResolver(GraphQLObjectType parentType, GraphQLFieldDefinition fieldDefinition) {
        FieldResolver fieldResolver;
        if (fieldDefinition == Introspection.TypeNameMetaFieldDef) {
            fieldResolver = IntrospectionFieldResolver.TYPENAME;
        } else if (IntrospectionFieldResolver.isIntrospectionField(fieldDefinition, parentType.getName())) {
            fieldResolver = IntrospectionFieldResolver.INSTANCE;
        } else {
            fieldResolver = graphQL.getResolverRegistry().getFieldResolver(FieldCoordinates.coordinates(parentType, fieldDefinition));
            if (fieldResolver == null) {
                fieldResolver = graphQL.getDefaultFieldResolver();
            }
        }
        return graphQL.getMiddlewareChain().getFieldResolver(fieldResolver);
    }

    public FieldResolver getSubscribeResolver(GraphQLObjectType parentType, GraphQLFieldDefinition fieldDefinition) {
        FieldResolver subscribeResolver = graphQL.getResolverRegistry().getSubscribeResolver(FieldCoordinates.coordinates(parentType, fieldDefinition));
        return subscribeResolver != null ? subscribeResolver : graphQL.getSubscribeFieldResolver();
    }

    public Map<String, String> getArgumentOutNames(GraphQLObjectType parentType, GraphQLFieldDefinition fieldDefinition) {
        return graphQL.getResolverRegistry().getArgumentOutNames(FieldCoordinates.coordinates(parentType, fieldDefinition));
    }

    public TypeResolver getTypeResolver(GraphQLNamedOutputType abstractType) {
        TypeResolver typeResolver = graphQL.getResolverRegistry().getTypeResolver(abstractType.getName());
        return typeResolver != null ? typeResolver : graphQL.getDefaultTypeResolver();
    }

    public IsTypeOf getIsTypeOf(GraphQLObjectType objectType) {
        return graphQL.getResolverRegistry().getIsTypeOf(objectType.getName());
    }

    public ResolveInfo newResolveInfo(GraphQLFieldDefinition fieldDefinition,
                                      FieldGroup fieldGroup,
                                      GraphQLObjectType parentType,
                                      ResultPath path) {
        return new ResolveInfo(fieldDefinition.getName(),
                fieldGroup.toNodes(),
                fieldDefinition,
                parentType,
                path,
                graphQLSchema,
                fragmentsByName,
                root,
                operationDefinition,
                variables,
                context,
                graphQLContext);
    }
}

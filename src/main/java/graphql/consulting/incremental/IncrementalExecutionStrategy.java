package graphql.consulting.incremental;

import graphql.Assert;
import graphql.ExecutionResult;
import graphql.ExecutionResultImpl;
import graphql.GraphQLContext;
import graphql.GraphQLError;
import graphql.Internal;
import graphql.consulting.incremental.collect.CollectedFields;
import graphql.consulting.incremental.collect.DeferUsage;
import graphql.consulting.incremental.collect.FieldGroup;
import graphql.consulting.incremental.collect.FieldPlan;
import graphql.consulting.incremental.collect.GroupedFieldSet;
import graphql.consulting.incremental.collect.IncrementalDirectives;
import graphql.consulting.incremental.publish.CancellableStreamRecord;
import graphql.consulting.incremental.publish.DeferredFragmentRecord;
import graphql.consulting.incremental.publish.DeferredGroupedFieldSetRecord;
import graphql.consulting.incremental.publish.DeferredGroupedFieldSetResult;
import graphql.consulting.incremental.publish.IncrementalDataRecord;
import graphql.consulting.incremental.publish.IncrementalPublisher;
import graphql.consulting.incremental.publish.NonReconcilableDeferredGroupedFieldSetResult;
import graphql.consulting.incremental.publish.NonReconcilableStreamItemsResult;
import graphql.consulting.incremental.publish.ReconcilableDeferredGroupedFieldSetResult;
import graphql.consulting.incremental.publish.ReconcilableStreamItemsResult;
import graphql.consulting.incremental.publish.StreamItemsRecord;
import graphql.consulting.incremental.publish.StreamItemsResult;
import graphql.consulting.incremental.publish.StreamRecord;
import graphql.consulting.incremental.publish.TerminatingStreamItemsResult;
import graphql.consulting.incremental.values.ArgumentValues;
import graphql.execution.ResultPath;
import graphql.language.Field;
import graphql.language.OperationDefinition;
import graphql.schema.GraphQLEnumType;
import graphql.schema.GraphQLEnumValueDefinition;
import graphql.schema.GraphQLFieldDefinition;
import graphql.schema.GraphQLInterfaceType;
import graphql.schema.GraphQLList;
import graphql.schema.GraphQLNamedOutputType;
import graphql.schema.GraphQLNonNull;
import graphql.schema.GraphQLObjectType;
import graphql.schema.GraphQLOutputType;
import graphql.schema.GraphQLScalarType;
import graphql.schema.GraphQLSchema;
import graphql.schema.GraphQLUnionType;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuple2;
import reactor.util.function.Tuples;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Executes one operation: resolves fields, completes their values according to their output type
 * and propagates errors to the nearest nullable field. Deferred grouped field sets and streamed list
 * items are returned as incremental data records together with the values they belong to.
 */
@Internal
public class IncrementalExecutionStrategy {

    private static final Logger log = LoggerFactory.getLogger(IncrementalExecutionStrategy.class);

    private final ResolveType resolveType = new ResolveType();

    public Mono<ExecutionResult> execute(ExecutionContext executionContext) {
        OperationDefinition operation = executionContext.getOperationDefinition();
        IncrementalContext incrementalContext = IncrementalContext.initial();
        log.debug("executing {} operation '{}'", operation.getOperation(), operation.getName());

        return Mono.defer(() -> executeOperation(executionContext, incrementalContext))
                .map(wrappedResult -> buildDataResponse(executionContext,
                        wrappedResult.getValue(),
                        incrementalContext.getErrors(),
                        wrappedResult.getIncrementalDataRecords()))
                .onErrorResume(GraphQLError.class::isInstance, throwable -> {
                    List<GraphQLError> errors = incrementalContext.getErrors();
                    errors.add((GraphQLError) throwable);
                    return Mono.just(ExecutionResultImpl.newExecutionResult()
                            .data(null)
                            .addErrors(ErrorOrdering.sorted(errors))
                            .build());
                })
                .doOnNext(result -> log.debug("finished {} operation '{}' with {} errors",
                        operation.getOperation(), operation.getName(), result.getErrors().size()))
                .subscribeOn(executionContext.getScheduler());
    }

    private ExecutionResult buildDataResponse(ExecutionContext executionContext,
                                              Map<String, Object> data,
                                              List<GraphQLError> errors,
                                              List<IncrementalDataRecord> incrementalDataRecords) {
        List<GraphQLError> sortedErrors = ErrorOrdering.sorted(errors);
        if (incrementalDataRecords.isEmpty()) {
            return ExecutionResultImpl.newExecutionResult()
                    .data(data)
                    .addErrors(sortedErrors)
                    .build();
        }
        IncrementalPublisher incrementalPublisher = new IncrementalPublisher(executionContext.getScheduler(), executionContext.getCancellableStreams());
        return incrementalPublisher.buildResponse(data, sortedErrors, incrementalDataRecords);
    }

    private Mono<WrappedResult> executeOperation(ExecutionContext executionContext, IncrementalContext incrementalContext) {
        OperationDefinition operation = executionContext.getOperationDefinition();
        GraphQLObjectType rootType = getRootType(executionContext.getGraphQLSchema(), operation);
        CollectedFields collectedFields = executionContext.collectFields(rootType);
        GroupedFieldSet groupedFieldSet = collectedFields.getGroupedFieldSet();
        List<DeferUsage> newDeferUsages = collectedFields.getNewDeferUsages();
        ResultPath path = ResultPath.rootPath();
        Object root = executionContext.getRoot();

        if (newDeferUsages.isEmpty()) {
            return executeRootGroupedFieldSet(executionContext, operation.getOperation(), rootType, root, groupedFieldSet, incrementalContext, null);
        }
        FieldPlan fieldPlan = collectedFields.getFieldPlan(executionContext.getFieldPlanBuilder(), null);
        Map<DeferUsage, DeferredFragmentRecord> deferMap = addNewDeferredFragments(newDeferUsages, null, path);
        Mono<WrappedResult> data = executeRootGroupedFieldSet(executionContext, operation.getOperation(), rootType, root,
                fieldPlan.getGroupedFieldSet(), incrementalContext, deferMap);
        if (!fieldPlan.getNewGroupedFieldSets().isEmpty()) {
            List<IncrementalDataRecord> records = executeDeferredGroupedFieldSets(executionContext, rootType, root, path, null,
                    fieldPlan.getNewGroupedFieldSets(), deferMap);
            data = data.map(wrappedResult -> wrappedResult.withIncrementalDataRecords(records));
        }
        return data;
    }

    static GraphQLObjectType getRootType(GraphQLSchema schema, OperationDefinition operation) {
        GraphQLObjectType rootType;
        switch (operation.getOperation()) {
            case MUTATION:
                rootType = schema.getMutationType();
                break;
            case SUBSCRIPTION:
                rootType = schema.getSubscriptionType();
                break;
            default:
                rootType = schema.getQueryType();
        }
        if (rootType == null) {
            throw new LocatedError("Schema is not configured to execute "
                    + operation.getOperation().name().toLowerCase(Locale.ROOT) + " operation.", operation);
        }
        return rootType;
    }

    private Mono<WrappedResult> executeRootGroupedFieldSet(ExecutionContext executionContext,
                                                           OperationDefinition.Operation operation,
                                                           GraphQLObjectType rootType,
                                                           Object root,
                                                           GroupedFieldSet groupedFieldSet,
                                                           IncrementalContext incrementalContext,
                                                           Map<DeferUsage, DeferredFragmentRecord> deferMap) {
        if (operation == OperationDefinition.Operation.MUTATION) {
            return executeFieldsSerially(executionContext, rootType, root, ResultPath.rootPath(), groupedFieldSet, incrementalContext, deferMap);
        }
        return executeFields(executionContext, rootType, root, ResultPath.rootPath(), groupedFieldSet, incrementalContext, deferMap);
    }

    /**
     * Mutation root fields: each field is resolved and completed before the next one starts.
     */
    private Mono<WrappedResult> executeFieldsSerially(ExecutionContext executionContext,
                                                      GraphQLObjectType parentType,
                                                      Object source,
                                                      ResultPath path,
                                                      GroupedFieldSet groupedFieldSet,
                                                      IncrementalContext incrementalContext,
                                                      Map<DeferUsage, DeferredFragmentRecord> deferMap) {
        return Flux.fromIterable(groupedFieldSet.entrySet())
                .concatMap(entry -> executeField(executionContext, parentType, source, entry.getValue(),
                        path.segment(entry.getKey()), incrementalContext, deferMap)
                        .map(wrappedResult -> Tuples.of(entry.getKey(), wrappedResult)))
                .collectList()
                .map(this::toObjectResult);
    }

    /**
     * Sibling fields are resolved concurrently; the result keeps the order of the grouped field set.
     */
    private Mono<WrappedResult> executeFields(ExecutionContext executionContext,
                                              GraphQLObjectType parentType,
                                              Object source,
                                              ResultPath path,
                                              GroupedFieldSet groupedFieldSet,
                                              IncrementalContext incrementalContext,
                                              Map<DeferUsage, DeferredFragmentRecord> deferMap) {
        List<Mono<Tuple2<String, WrappedResult>>> monoChildren = new ArrayList<>(groupedFieldSet.size());
        for (Map.Entry<String, FieldGroup> entry : groupedFieldSet.entrySet()) {
            String responseKey = entry.getKey();
            monoChildren.add(executeField(executionContext, parentType, source, entry.getValue(),
                    path.segment(responseKey), incrementalContext, deferMap)
                    .map(wrappedResult -> Tuples.of(responseKey, wrappedResult)));
        }
        return Flux.fromIterable(monoChildren)
                .flatMapSequential(Function.identity())
                .collectList()
                .map(this::toObjectResult);
    }

    private WrappedResult toObjectResult(List<Tuple2<String, WrappedResult>> fieldResults) {
        Map<String, Object> data = new LinkedHashMap<>();
        List<IncrementalDataRecord> records = new ArrayList<>();
        for (Tuple2<String, WrappedResult> fieldResult : fieldResults) {
            data.put(fieldResult.getT1(), fieldResult.getT2().getValue());
            records.addAll(fieldResult.getT2().getIncrementalDataRecords());
        }
        return WrappedResult.of(data, records);
    }

    /**
     * Resolves a field and completes its value. Completes empty if the parent type does not define
     * the field, so the response key is left out.
     */
    private Mono<WrappedResult> executeField(ExecutionContext executionContext,
                                             GraphQLObjectType parentType,
                                             Object source,
                                             FieldGroup fieldGroup,
                                             ResultPath path,
                                             IncrementalContext incrementalContext,
                                             Map<DeferUsage, DeferredFragmentRecord> deferMap) {
        return Mono.defer(() -> {
            Field fieldNode = fieldGroup.getFirstField();
            GraphQLFieldDefinition fieldDefinition = executionContext.getFieldDefinition(parentType, fieldNode.getName());
            if (fieldDefinition == null) {
                return Mono.empty();
            }
            GraphQLOutputType returnType = fieldDefinition.getType();
            ResolveInfo info = executionContext.newResolveInfo(fieldDefinition, fieldGroup, parentType, path);

            Object result;
            try {
                Map<String, Object> arguments = ArgumentValues.coerceArgumentValues(fieldDefinition.getArguments(),
                        fieldNode.getArguments(),
                        fieldNode,
                        executionContext.getVariables(),
                        executionContext.getArgumentOutNames(parentType, fieldDefinition));
                FieldResolver fieldResolver = executionContext.getFieldResolver(parentType, fieldDefinition);
                result = fieldResolver.resolve(source, arguments, info);
            } catch (Exception e) {
                return handleFieldError(e, returnType, fieldGroup, path, incrementalContext);
            }

            Mono<WrappedResult> completed;
            if (Async.isPending(result)) {
                completed = completePromisedValue(executionContext, returnType, fieldGroup, info, path, result, incrementalContext, deferMap);
            } else {
                completed = completeValueMono(executionContext, returnType, fieldGroup, info, path, result, incrementalContext, deferMap);
            }
            return completed.onErrorResume(throwable -> handleFieldError(throwable, returnType, fieldGroup, path, incrementalContext));
        });
    }

    /**
     * Locates the error. On a non-null field it is raised again so the parent becomes null, otherwise
     * it is recorded and the field becomes null.
     */
    private Mono<WrappedResult> handleFieldError(Throwable rawError,
                                                 GraphQLOutputType returnType,
                                                 FieldGroup fieldGroup,
                                                 ResultPath path,
                                                 IncrementalContext incrementalContext) {
        LocatedError error = LocatedError.locate(rawError, fieldGroup.toNodes(), path);
        if (returnType instanceof GraphQLNonNull) {
            return Mono.error(error);
        }
        incrementalContext.addError(error);
        return Mono.just(WrappedResult.nullValue());
    }

    private Mono<WrappedResult> completePromisedValue(ExecutionContext executionContext,
                                                      GraphQLOutputType returnType,
                                                      FieldGroup fieldGroup,
                                                      ResolveInfo info,
                                                      ResultPath path,
                                                      Object pending,
                                                      IncrementalContext incrementalContext,
                                                      Map<DeferUsage, DeferredFragmentRecord> deferMap) {
        return Async.toMono(pending)
                .publishOn(executionContext.getScheduler())
                .flatMap(resolved -> completeValueMono(executionContext, returnType, fieldGroup, info, path, resolved, incrementalContext, deferMap))
                .switchIfEmpty(Mono.defer(() -> completeValueMono(executionContext, returnType, fieldGroup, info, path, null, incrementalContext, deferMap)));
    }

    private Mono<WrappedResult> completeValueMono(ExecutionContext executionContext,
                                                  GraphQLOutputType returnType,
                                                  FieldGroup fieldGroup,
                                                  ResolveInfo info,
                                                  ResultPath path,
                                                  Object result,
                                                  IncrementalContext incrementalContext,
                                                  Map<DeferUsage, DeferredFragmentRecord> deferMap) {
        return Mono.defer(() -> completeValue(executionContext, returnType, fieldGroup, info, path, result, incrementalContext, deferMap));
    }

    private Mono<WrappedResult> completeValue(ExecutionContext executionContext,
                                              GraphQLOutputType returnType,
                                              FieldGroup fieldGroup,
                                              ResolveInfo info,
                                              ResultPath path,
                                              Object result,
                                              IncrementalContext incrementalContext,
                                              Map<DeferUsage, DeferredFragmentRecord> deferMap) {
        // a resolver may return an error instead of throwing it
        if (result instanceof Throwable) {
            return Mono.error((Throwable) result);
        }

        if (returnType instanceof GraphQLNonNull) {
            GraphQLOutputType wrappedType = (GraphQLOutputType) ((GraphQLNonNull) returnType).getWrappedType();
            return completeValue(executionContext, wrappedType, fieldGroup, info, path, result, incrementalContext, deferMap)
                    .flatMap(completed -> {
                        if (completed.getValue() == null) {
                            return Mono.error(new NonNullableFieldWasNullError(info));
                        }
                        return Mono.just(completed);
                    });
        }

        if (result == null) {
            return Mono.just(WrappedResult.nullValue());
        }

        if (returnType instanceof GraphQLList) {
            return completeListValue(executionContext, (GraphQLList) returnType, fieldGroup, info, path, result, incrementalContext, deferMap);
        }
        if (returnType instanceof GraphQLScalarType) {
            return Mono.just(WrappedResult.of(completeScalarValue((GraphQLScalarType) returnType, result, executionContext.getGraphQLContext())));
        }
        if (returnType instanceof GraphQLEnumType) {
            return Mono.just(WrappedResult.of(completeEnumValue((GraphQLEnumType) returnType, result)));
        }
        if (returnType instanceof GraphQLInterfaceType || returnType instanceof GraphQLUnionType) {
            return resolveType.resolveType(executionContext, (GraphQLNamedOutputType) returnType, fieldGroup, info, result)
                    .flatMap(runtimeType -> completeObjectValue(executionContext, runtimeType, fieldGroup, info, path, result, incrementalContext, deferMap));
        }
        if (returnType instanceof GraphQLObjectType) {
            return completeObjectValue(executionContext, (GraphQLObjectType) returnType, fieldGroup, info, path, result, incrementalContext, deferMap);
        }
        return Assert.assertShouldNeverHappen("Cannot complete value of unexpected output type: %s", Inspector.inspect(returnType));
    }

    private Object completeScalarValue(GraphQLScalarType scalarType, Object result, GraphQLContext graphQLContext) {
        Object serialized = scalarType.getCoercing().serialize(result, graphQLContext, Locale.getDefault());
        if (serialized == null) {
            throw new LocatedError("Expected `" + scalarType.getName() + ".serialize(" + Inspector.inspect(result)
                    + ")` to return non-nullable value, returned: null");
        }
        return serialized;
    }

    /**
     * Enum values are matched by their internal value first and then by name.
     */
    private Object completeEnumValue(GraphQLEnumType enumType, Object result) {
        for (GraphQLEnumValueDefinition definition : enumType.getValues()) {
            if (Objects.equals(definition.getValue(), result)) {
                return definition.getName();
            }
        }
        String name = result instanceof Enum ? ((Enum<?>) result).name() : result instanceof String ? (String) result : null;
        if (name != null && enumType.getValue(name) != null) {
            return name;
        }
        throw new LocatedError("Enum '" + enumType.getName() + "' cannot represent value: " + Inspector.inspect(result));
    }

    private Mono<WrappedResult> completeObjectValue(ExecutionContext executionContext,
                                                    GraphQLObjectType returnType,
                                                    FieldGroup fieldGroup,
                                                    ResolveInfo info,
                                                    ResultPath path,
                                                    Object result,
                                                    IncrementalContext incrementalContext,
                                                    Map<DeferUsage, DeferredFragmentRecord> deferMap) {
        IsTypeOf isTypeOf = executionContext.getIsTypeOf(returnType);
        if (isTypeOf != null) {
            Object isTypeOfResult = isTypeOf.isTypeOf(result, info);
            if (Async.isPending(isTypeOfResult)) {
                return Async.toMono(isTypeOfResult)
                        .publishOn(executionContext.getScheduler())
                        .defaultIfEmpty(Boolean.FALSE)
                        .flatMap(matches -> {
                            if (!Boolean.TRUE.equals(matches)) {
                                return Mono.error(invalidReturnTypeError(returnType, result, fieldGroup));
                            }
                            return collectAndExecuteSubfields(executionContext, returnType, fieldGroup, path, result, incrementalContext, deferMap);
                        });
            }
            if (!Boolean.TRUE.equals(isTypeOfResult)) {
                return Mono.error(invalidReturnTypeError(returnType, result, fieldGroup));
            }
        }
        return collectAndExecuteSubfields(executionContext, returnType, fieldGroup, path, result, incrementalContext, deferMap);
    }

    private LocatedError invalidReturnTypeError(GraphQLObjectType returnType, Object result, FieldGroup fieldGroup) {
        return new LocatedError("Expected value of type '" + returnType.getName() + "' but got: " + Inspector.inspect(result) + ".",
                fieldGroup.toNodes());
    }

    private Mono<WrappedResult> collectAndExecuteSubfields(ExecutionContext executionContext,
                                                           GraphQLObjectType returnType,
                                                           FieldGroup fieldGroup,
                                                           ResultPath path,
                                                           Object result,
                                                           IncrementalContext incrementalContext,
                                                           Map<DeferUsage, DeferredFragmentRecord> deferMap) {
        CollectedFields collectedSubfields = executionContext.collectSubfields(returnType, fieldGroup);
        List<DeferUsage> newDeferUsages = collectedSubfields.getNewDeferUsages();
        if (deferMap == null && newDeferUsages.isEmpty()) {
            return executeFields(executionContext, returnType, result, path, collectedSubfields.getGroupedFieldSet(), incrementalContext, null);
        }

        Set<DeferUsage> parentDeferUsages = incrementalContext.getDeferUsageSet();
        FieldPlan subFieldPlan = collectedSubfields.getFieldPlan(executionContext.getFieldPlanBuilder(), parentDeferUsages);
        Map<DeferUsage, DeferredFragmentRecord> newDeferMap = addNewDeferredFragments(newDeferUsages, deferMap, path);
        Mono<WrappedResult> subFields = executeFields(executionContext, returnType, result, path,
                subFieldPlan.getGroupedFieldSet(), incrementalContext, newDeferMap);
        if (subFieldPlan.getNewGroupedFieldSets().isEmpty()) {
            return subFields;
        }
        List<IncrementalDataRecord> records = executeDeferredGroupedFieldSets(executionContext, returnType, result, path,
                parentDeferUsages, subFieldPlan.getNewGroupedFieldSets(), newDeferMap);
        return subFields.map(wrappedResult -> wrappedResult.withIncrementalDataRecords(records));
    }

    /**
     * Creates a fragment record for every defer usage met for the first time at this path.
     */
    private Map<DeferUsage, DeferredFragmentRecord> addNewDeferredFragments(List<DeferUsage> newDeferUsages,
                                                                            Map<DeferUsage, DeferredFragmentRecord> deferMap,
                                                                            ResultPath path) {
        if (newDeferUsages.isEmpty()) {
            return deferMap != null ? deferMap : Collections.<DeferUsage, DeferredFragmentRecord>emptyMap();
        }
        Map<DeferUsage, DeferredFragmentRecord> newDeferMap = deferMap != null ? new HashMap<>(deferMap) : new HashMap<>();
        for (DeferUsage deferUsage : newDeferUsages) {
            DeferUsage parentDeferUsage = deferUsage.getParentDeferUsage();
            DeferredFragmentRecord parent = null;
            if (parentDeferUsage != null) {
                parent = Assert.assertNotNull(newDeferMap.get(parentDeferUsage), () -> "Missing record of the enclosing defer");
            }
            newDeferMap.put(deferUsage, new DeferredFragmentRecord(path, deferUsage.getLabel(), parent));
        }
        return newDeferMap;
    }

    /**
     * Starts the deferred grouped field sets. Those introducing a new defer run in a later task on
     * the processing scheduler, the others start right away.
     */
    private List<IncrementalDataRecord> executeDeferredGroupedFieldSets(ExecutionContext executionContext,
                                                                        GraphQLObjectType parentType,
                                                                        Object source,
                                                                        ResultPath path,
                                                                        Set<DeferUsage> parentDeferUsages,
                                                                        Map<Set<DeferUsage>, GroupedFieldSet> newGroupedFieldSets,
                                                                        Map<DeferUsage, DeferredFragmentRecord> deferMap) {
        List<IncrementalDataRecord> records = new ArrayList<>(newGroupedFieldSets.size());
        for (Map.Entry<Set<DeferUsage>, GroupedFieldSet> entry : newGroupedFieldSets.entrySet()) {
            Set<DeferUsage> deferUsageSet = entry.getKey();
            List<DeferredFragmentRecord> deferredFragmentRecords = new ArrayList<>();
            for (DeferUsage deferUsage : FieldPlan.gatingDeferUsages(deferUsageSet)) {
                deferredFragmentRecords.add(Assert.assertNotNull(deferMap.get(deferUsage), () -> "Missing deferred fragment record"));
            }
            DeferredGroupedFieldSetRecord record = new DeferredGroupedFieldSetRecord(deferredFragmentRecords);
            Mono<DeferredGroupedFieldSetResult> executor = Mono.defer(() -> executeDeferredGroupedFieldSet(record, executionContext,
                    parentType, source, path, entry.getValue(), new IncrementalContext(deferUsageSet), deferMap));
            if (FieldPlan.shouldInitiateDefer(parentDeferUsages, deferUsageSet)) {
                executor = executor.subscribeOn(executionContext.getScheduler());
            }
            record.setResult(executor.toFuture());
            records.add(record);
        }
        return records;
    }

    private Mono<DeferredGroupedFieldSetResult> executeDeferredGroupedFieldSet(DeferredGroupedFieldSetRecord record,
                                                                               ExecutionContext executionContext,
                                                                               GraphQLObjectType parentType,
                                                                               Object source,
                                                                               ResultPath path,
                                                                               GroupedFieldSet groupedFieldSet,
                                                                               IncrementalContext incrementalContext,
                                                                               Map<DeferUsage, DeferredFragmentRecord> deferMap) {
        List<Object> pathList = path.toList();
        return executeFields(executionContext, parentType, source, path, groupedFieldSet, incrementalContext, deferMap)
                .<DeferredGroupedFieldSetResult>map(wrappedResult -> new ReconcilableDeferredGroupedFieldSetResult(
                        record.getDeferredFragmentRecords(),
                        pathList,
                        wrappedResult.getValue(),
                        incrementalContext.getErrors(),
                        wrappedResult.getIncrementalDataRecords()))
                .onErrorResume(throwable -> Mono.just(new NonReconcilableDeferredGroupedFieldSetResult(
                        record.getDeferredFragmentRecords(),
                        pathList,
                        withError(incrementalContext, throwable, Collections.<Field>emptyList(), path))));
    }

    private Mono<WrappedResult> completeListValue(ExecutionContext executionContext,
                                                  GraphQLList returnType,
                                                  FieldGroup fieldGroup,
                                                  ResolveInfo info,
                                                  ResultPath path,
                                                  Object result,
                                                  IncrementalContext incrementalContext,
                                                  Map<DeferUsage, DeferredFragmentRecord> deferMap) {
        GraphQLOutputType itemType = (GraphQLOutputType) returnType.getWrappedType();

        if (result instanceof Publisher && !(result instanceof Mono)) {
            PublisherIterator iterator = new PublisherIterator((Publisher<?>) result);
            StreamUsage streamUsage = getStreamUsage(executionContext, fieldGroup, path);
            return completeAsyncIteratorValue(executionContext, itemType, fieldGroup, info, path, iterator, 0,
                    new ArrayList<>(), streamUsage, incrementalContext, deferMap);
        }

        Iterator<?> iterator = toIterator(result);
        if (iterator == null) {
            throw new LocatedError("Expected Iterable, but did not find one for field '"
                    + info.getParentType().getName() + "." + info.getFieldName() + "'.");
        }

        StreamUsage streamUsage = getStreamUsage(executionContext, fieldGroup, path);
        List<Mono<WrappedResult>> completedResults = new ArrayList<>();
        StreamItemsRecord firstStreamItems = null;
        int index = 0;
        while (iterator.hasNext()) {
            Object item = iterator.next();
            if (streamUsage != null && index >= streamUsage.getInitialCount()) {
                StreamRecord streamRecord = new StreamRecord(path, streamUsage.getLabel());
                firstStreamItems = firstSyncStreamItems(streamRecord, path, item, index, iterator, executionContext,
                        streamUsage.getFieldGroup(), info, itemType);
                break;
            }
            completedResults.add(completeListItemValue(executionContext, itemType, fieldGroup, info, path.segment(index), item, incrementalContext, deferMap));
            index++;
        }
        return toListResult(completedResults, firstStreamItems);
    }

    private Mono<WrappedResult> toListResult(List<Mono<WrappedResult>> completedResults, StreamItemsRecord firstStreamItems) {
        return Async.each(completedResults)
                .map(itemResults -> {
                    List<Object> values = new ArrayList<>(itemResults.size());
                    List<IncrementalDataRecord> records = new ArrayList<>();
                    for (WrappedResult itemResult : itemResults) {
                        values.add(itemResult.getValue());
                        records.addAll(itemResult.getIncrementalDataRecords());
                    }
                    if (firstStreamItems != null) {
                        records.add(firstStreamItems);
                    }
                    return WrappedResult.of(values, records);
                });
    }

    private Mono<WrappedResult> completeListItemValue(ExecutionContext executionContext,
                                                      GraphQLOutputType itemType,
                                                      FieldGroup fieldGroup,
                                                      ResolveInfo info,
                                                      ResultPath itemPath,
                                                      Object item,
                                                      IncrementalContext incrementalContext,
                                                      Map<DeferUsage, DeferredFragmentRecord> deferMap) {
        Mono<WrappedResult> completed;
        if (Async.isPending(item)) {
            completed = completePromisedValue(executionContext, itemType, fieldGroup, info, itemPath, item, incrementalContext, deferMap);
        } else {
            completed = completeValueMono(executionContext, itemType, fieldGroup, info, itemPath, item, incrementalContext, deferMap);
        }
        return completed.onErrorResume(throwable -> handleFieldError(throwable, itemType, fieldGroup, itemPath, incrementalContext));
    }

    private Mono<WrappedResult> completeAsyncIteratorValue(ExecutionContext executionContext,
                                                           GraphQLOutputType itemType,
                                                           FieldGroup fieldGroup,
                                                           ResolveInfo info,
                                                           ResultPath path,
                                                           PublisherIterator iterator,
                                                           int index,
                                                           List<Mono<WrappedResult>> completedResults,
                                                           StreamUsage streamUsage,
                                                           IncrementalContext incrementalContext,
                                                           Map<DeferUsage, DeferredFragmentRecord> deferMap) {
        if (streamUsage != null && index >= streamUsage.getInitialCount()) {
            CancellableStreamRecord streamRecord = new CancellableStreamRecord(path, streamUsage.getLabel(), iterator::earlyReturn);
            executionContext.getCancellableStreams().add(streamRecord);
            StreamItemsRecord firstStreamItems = new StreamItemsRecord(streamRecord,
                    getNextAsyncStreamItemsResult(streamRecord, path, index, iterator, executionContext,
                            streamUsage.getFieldGroup(), info, itemType).toFuture());
            return toListResult(completedResults, firstStreamItems);
        }
        return iterator.next()
                .onErrorMap(throwable -> LocatedError.locate(throwable, fieldGroup.toNodes(), path))
                .publishOn(executionContext.getScheduler())
                .flatMap(item -> {
                    completedResults.add(completeListItemValue(executionContext, itemType, fieldGroup, info, path.segment(index),
                            item, incrementalContext, deferMap));
                    return completeAsyncIteratorValue(executionContext, itemType, fieldGroup, info, path, iterator, index + 1,
                            completedResults, streamUsage, incrementalContext, deferMap);
                })
                .switchIfEmpty(Mono.defer(() -> toListResult(completedResults, null)));
    }

    /**
     * The {@code @stream} applied to a list field, if enabled. Inner lists of nested lists are never
     * streamed.
     */
    private StreamUsage getStreamUsage(ExecutionContext executionContext, FieldGroup fieldGroup, ResultPath path) {
        if (!executionContext.isIncrementalDelivery() || path.isListSegment()) {
            return null;
        }
        StreamUsage cached = executionContext.getStreamUsageCache().get(fieldGroup);
        if (cached != null) {
            return cached;
        }
        Map<String, Object> stream = ArgumentValues.getDirectiveValues(IncrementalDirectives.StreamDirective,
                fieldGroup.getFirstField().getDirectives(), executionContext.getVariables());
        if (stream == null || Boolean.FALSE.equals(stream.get("if"))) {
            return null;
        }
        Object initialCount = stream.get("initialCount");
        if (!(initialCount instanceof Integer) || (Integer) initialCount < 0) {
            throw new LocatedError("initialCount must be a positive integer", fieldGroup.toNodes());
        }
        if (executionContext.getOperationDefinition().getOperation() == OperationDefinition.Operation.SUBSCRIPTION) {
            throw new LocatedError("`@stream` directive not supported on subscription operations."
                    + " Disable `@stream` by setting the `if` argument to `false`.", fieldGroup.toNodes());
        }
        StreamUsage streamUsage = new StreamUsage((String) stream.get("label"), (Integer) initialCount, fieldGroup.withoutDeferUsages());
        StreamUsage existing = executionContext.getStreamUsageCache().putIfAbsent(fieldGroup, streamUsage);
        return existing != null ? existing : streamUsage;
    }

    /**
     * Completes the remaining items of a synchronous list in one later task. Every item becomes its
     * own stream items result, each one carrying the record of the next, the last one followed by a
     * terminating result.
     */
    private StreamItemsRecord firstSyncStreamItems(StreamRecord streamRecord,
                                                   ResultPath path,
                                                   Object initialItem,
                                                   int initialIndex,
                                                   Iterator<?> iterator,
                                                   ExecutionContext executionContext,
                                                   FieldGroup fieldGroup,
                                                   ResolveInfo info,
                                                   GraphQLOutputType itemType) {
        Mono<StreamItemsResult> streamItems = Mono.defer(() -> {
            CompletableFuture<StreamItemsResult> result = completeStreamItems(streamRecord, path.segment(initialIndex), initialItem,
                    executionContext, fieldGroup, info, itemType).toFuture();
            StreamItemsRecord firstStreamItems = new StreamItemsRecord(streamRecord, result);
            StreamItemsRecord currentStreamItems = firstStreamItems;
            int currentIndex = initialIndex;
            boolean erroredSynchronously = false;
            while (iterator.hasNext()) {
                if (result.isDone() && !(result.getNow(null) instanceof ReconcilableStreamItemsResult)) {
                    erroredSynchronously = true;
                    break;
                }
                Object item = iterator.next();
                currentIndex++;
                result = completeStreamItems(streamRecord, path.segment(currentIndex), item, executionContext, fieldGroup, info, itemType).toFuture();
                StreamItemsRecord nextStreamItems = new StreamItemsRecord(streamRecord, result);
                currentStreamItems.setResult(prependNextStreamItems(currentStreamItems.getResult(), nextStreamItems));
                currentStreamItems = nextStreamItems;
            }
            // a stream that failed is not terminated again
            if (!erroredSynchronously) {
                StreamItemsRecord terminator = new StreamItemsRecord(streamRecord,
                        CompletableFuture.<StreamItemsResult>completedFuture(new TerminatingStreamItemsResult(streamRecord)));
                currentStreamItems.setResult(prependNextStreamItems(currentStreamItems.getResult(), terminator));
            }
            return Mono.fromFuture(firstStreamItems.getResult());
        }).subscribeOn(executionContext.getScheduler());
        return new StreamItemsRecord(streamRecord, streamItems.toFuture());
    }

    private CompletableFuture<StreamItemsResult> prependNextStreamItems(CompletableFuture<StreamItemsResult> result, StreamItemsRecord nextStreamItems) {
        return result.thenApply(resolved -> {
            if (resolved instanceof ReconcilableStreamItemsResult) {
                return ((ReconcilableStreamItemsResult) resolved).prependIncrementalDataRecord(nextStreamItems);
            }
            return resolved;
        });
    }

    /**
     * Pulls the next item of a streamed publisher. The pull after it starts as soon as this item
     * arrived.
     */
    private Mono<StreamItemsResult> getNextAsyncStreamItemsResult(CancellableStreamRecord streamRecord,
                                                                  ResultPath path,
                                                                  int index,
                                                                  PublisherIterator iterator,
                                                                  ExecutionContext executionContext,
                                                                  FieldGroup fieldGroup,
                                                                  ResolveInfo info,
                                                                  GraphQLOutputType itemType) {
        return iterator.next()
                .publishOn(executionContext.getScheduler())
                .flatMap(item -> {
                    Mono<StreamItemsResult> result = completeStreamItems(streamRecord, path.segment(index), item,
                            executionContext, fieldGroup, info, itemType);
                    StreamItemsRecord nextStreamItems = new StreamItemsRecord(streamRecord,
                            Mono.defer(() -> getNextAsyncStreamItemsResult(streamRecord, path, index + 1, iterator,
                                    executionContext, fieldGroup, info, itemType)).toFuture());
                    return result.map(resolved -> {
                        if (resolved instanceof ReconcilableStreamItemsResult) {
                            return (StreamItemsResult) ((ReconcilableStreamItemsResult) resolved).prependIncrementalDataRecord(nextStreamItems);
                        }
                        return resolved;
                    });
                })
                .switchIfEmpty(Mono.fromSupplier(() -> new TerminatingStreamItemsResult(streamRecord)))
                .onErrorResume(throwable -> {
                    List<GraphQLError> errors = new ArrayList<>();
                    errors.add(LocatedError.locate(throwable, fieldGroup.toNodes(), path));
                    return Mono.just(new NonReconcilableStreamItemsResult(streamRecord, errors));
                });
    }

    /**
     * Completes one streamed item in its own error context. A non-null violation fails the stream.
     */
    private Mono<StreamItemsResult> completeStreamItems(StreamRecord streamRecord,
                                                        ResultPath itemPath,
                                                        Object item,
                                                        ExecutionContext executionContext,
                                                        FieldGroup fieldGroup,
                                                        ResolveInfo info,
                                                        GraphQLOutputType itemType) {
        IncrementalContext incrementalContext = IncrementalContext.initial();
        Map<DeferUsage, DeferredFragmentRecord> deferMap = Collections.emptyMap();
        return completeListItemValue(executionContext, itemType, fieldGroup, info, itemPath, item, incrementalContext, deferMap)
                .<StreamItemsResult>map(wrappedResult -> new ReconcilableStreamItemsResult(streamRecord,
                        Collections.singletonList(wrappedResult.getValue()),
                        incrementalContext.getErrors(),
                        wrappedResult.getIncrementalDataRecords()))
                .onErrorResume(throwable -> Mono.just(new NonReconcilableStreamItemsResult(streamRecord,
                        withError(incrementalContext, throwable, fieldGroup.toNodes(), itemPath))));
    }

    private List<GraphQLError> withError(IncrementalContext incrementalContext, Throwable throwable, List<Field> nodes, ResultPath path) {
        List<GraphQLError> errors = incrementalContext.getErrors();
        errors.add(LocatedError.locate(throwable, nodes, path));
        return errors;
    }

    private static Iterator<?> toIterator(Object result) {
        if (result instanceof Iterable) {
            return ((Iterable<?>) result).iterator();
        }
        if (result instanceof Iterator) {
            return (Iterator<?>) result;
        }
        if (result.getClass().isArray()) {
            List<Object> items = new ArrayList<>();
            for (int i = 0; i < Array.getLength(result); i++) {
                items.add(Array.get(result, i));
            }
            return items.iterator();
        }
        return null;
    }
}

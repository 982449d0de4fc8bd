package graphql.consulting.incremental;

import graphql.ExecutionResult;
import graphql.ExecutionResultImpl;
import graphql.GraphQLError;
import graphql.Internal;
import graphql.consulting.incremental.collect.FieldGroup;
import graphql.consulting.incremental.collect.GroupedFieldSet;
import graphql.consulting.incremental.values.ArgumentValues;
import graphql.execution.ResultPath;
import graphql.language.Field;
import graphql.language.OperationDefinition;
import graphql.schema.GraphQLFieldDefinition;
import graphql.schema.GraphQLObjectType;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Resolves the event stream of a subscription and maps every event to the execution of the
 * operation with the event as root value.
 */
@Internal
public class SubscriptionExecutionStrategy {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionExecutionStrategy.class);

    private static final Object NO_EVENT_STREAM = new Object();

    private final IncrementalExecutionStrategy executionStrategy;

    public SubscriptionExecutionStrategy(IncrementalExecutionStrategy executionStrategy) {
        this.executionStrategy = executionStrategy;
    }

    /**
     * @return a result whose data is the {@code Publisher} of response results, or an errors-only
     * result if the event stream could not be created
     */
    public Mono<ExecutionResult> subscribe(ExecutionContext executionContext) {
        return createSourceEventStream(executionContext)
                .map(result -> {
                    if (!(result.getData() instanceof Publisher)) {
                        return result;
                    }
                    Publisher<Object> sourceStream = result.getData();
                    Flux<ExecutionResult> responseStream = Flux.from(sourceStream)
                            .concatMap(event -> executionStrategy.execute(executionContext.forEvent(event)));
                    return ExecutionResultImpl.newExecutionResult().data(responseStream).build();
                });
    }

    /**
     * @return a result whose data is the {@code Publisher} returned by the subscribe resolver of the
     * root field, or an errors-only result
     */
    public Mono<ExecutionResult> createSourceEventStream(ExecutionContext executionContext) {
        return Mono.defer(() -> executeSubscription(executionContext))
                .map(eventStream -> ExecutionResultImpl.newExecutionResult().data(eventStream).build())
                .onErrorResume(GraphQLError.class::isInstance, throwable -> {
                    log.debug("could not create the event stream of subscription '{}': {}",
                            executionContext.getOperationDefinition().getName(), throwable.getMessage());
                    return Mono.just(ExecutionResultImpl.newExecutionResult()
                            .addError((GraphQLError) throwable)
                            .build());
                })
                .subscribeOn(executionContext.getScheduler());
    }

    private Mono<Publisher<?>> executeSubscription(ExecutionContext executionContext) {
        OperationDefinition operation = executionContext.getOperationDefinition();
        GraphQLObjectType rootType = IncrementalExecutionStrategy.getRootType(executionContext.getGraphQLSchema(), operation);
        GroupedFieldSet groupedFieldSet = executionContext.collectFields(rootType).getGroupedFieldSet();
        if (groupedFieldSet.isEmpty()) {
            throw new LocatedError("Subscription operation must select one top level field.", operation);
        }
        String responseKey = groupedFieldSet.getResponseKeys().iterator().next();
        FieldGroup fieldGroup = groupedFieldSet.get(responseKey);
        Field fieldNode = fieldGroup.getFirstField();

        GraphQLFieldDefinition fieldDefinition = executionContext.getFieldDefinition(rootType, fieldNode.getName());
        if (fieldDefinition == null) {
            throw new LocatedError("The subscription field '" + fieldNode.getName() + "' is not defined.", fieldGroup.toNodes());
        }

        ResultPath path = ResultPath.rootPath().segment(responseKey);
        ResolveInfo info = executionContext.newResolveInfo(fieldDefinition, fieldGroup, rootType, path);
        Object eventStream;
        try {
            Map<String, Object> arguments = ArgumentValues.coerceArgumentValues(fieldDefinition.getArguments(),
                    fieldNode.getArguments(),
                    fieldNode,
                    executionContext.getVariables(),
                    executionContext.getArgumentOutNames(rootType, fieldDefinition));
            FieldResolver subscribeResolver = executionContext.getSubscribeResolver(rootType, fieldDefinition);
            eventStream = subscribeResolver.resolve(executionContext.getRoot(), arguments, info);
        } catch (Exception e) {
            throw LocatedError.locate(e, fieldGroup.toNodes(), path);
        }

        Mono<Object> resolved = Async.isPending(eventStream)
                ? Async.toMono(eventStream).publishOn(executionContext.getScheduler())
                : Mono.justOrEmpty(eventStream);
        return resolved
                .defaultIfEmpty(NO_EVENT_STREAM)
                .<Publisher<?>>handle((value, sink) -> {
                    if (value instanceof Throwable) {
                        sink.error((Throwable) value);
                    } else if (value instanceof Publisher) {
                        sink.next((Publisher<?>) value);
                    } else {
                        sink.error(new LocatedError("Subscription field must return a Publisher. Received: "
                                + Inspector.inspect(value == NO_EVENT_STREAM ? null : value) + "."));
                    }
                })
                .onErrorMap(throwable -> LocatedError.locate(throwable, fieldGroup.toNodes(), path));
    }
}

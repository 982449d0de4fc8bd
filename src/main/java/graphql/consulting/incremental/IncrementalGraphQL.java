package graphql.consulting.incremental;

import graphql.Assert;
import graphql.ExecutionResult;
import graphql.ExecutionResultImpl;
import graphql.GraphQLException;
import graphql.PublicApi;
import graphql.consulting.incremental.result.IncrementalExecutionResult;
import graphql.schema.GraphQLSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Function;

/**
 * Executes GraphQL operations against a schema with support for {@code @defer} and {@code @stream}.
 * <p>
 * The documents are expected to be valid against the schema. Every request runs on one of the
 * engine's single threaded processing schedulers, which are released by {@link #close()}.
 */
@PublicApi
public class IncrementalGraphQL implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(IncrementalGraphQL.class);

    private final GraphQLSchema graphQLSchema;
    private final ResolverRegistry resolverRegistry;
    private final FieldResolver defaultFieldResolver;
    private final TypeResolver defaultTypeResolver;
    private final FieldResolver subscribeFieldResolver;
    private final MiddlewareChain middlewareChain;
    private final boolean incrementalDelivery;
    private final Integer maxVariableErrors;

    private final List<Scheduler> processingSchedulers;
    private final IncrementalExecutionStrategy executionStrategy = new IncrementalExecutionStrategy();
    private final SubscriptionExecutionStrategy subscriptionStrategy = new SubscriptionExecutionStrategy(executionStrategy);

    private IncrementalGraphQL(Builder builder) {
        this.graphQLSchema = builder.graphQLSchema;
        this.resolverRegistry = builder.resolverRegistry;
        this.defaultFieldResolver = builder.defaultFieldResolver;
        this.defaultTypeResolver = builder.defaultTypeResolver != null ? builder.defaultTypeResolver : new DefaultTypeResolver(builder.resolverRegistry);
        this.subscribeFieldResolver = builder.subscribeFieldResolver != null ? builder.subscribeFieldResolver : builder.defaultFieldResolver;
        this.middlewareChain = new MiddlewareChain(builder.middlewares);
        this.incrementalDelivery = builder.incrementalDelivery;
        this.maxVariableErrors = builder.maxVariableErrors;
        this.processingSchedulers = new ArrayList<>();
        for (int i = 0; i < builder.processingThreads; i++) {
            processingSchedulers.add(Schedulers.newSingle("processing-thread-" + i));
        }
    }

    public static Builder newGraphQL(GraphQLSchema graphQLSchema) {
        return new Builder(graphQLSchema);
    }

    /**
     * Executes a query or mutation that is expected to produce one payload.
     *
     * @return the result, or a future failed with a {@link GraphQLException} if the operation uses
     * {@code @defer} or {@code @stream}
     */
    public CompletableFuture<ExecutionResult> execute(ExecutionArgs executionArgs) {
        return executeIncrementally(executionArgs).thenApply(result -> {
            if (result instanceof IncrementalExecutionResult) {
                throw new GraphQLException("Executing this GraphQL operation would unexpectedly produce multiple payloads (due to @defer or @stream directive)");
            }
            return result;
        });
    }

    /**
     * Executes a query or mutation.
     *
     * @return a plain result or an {@link IncrementalExecutionResult} followed by subsequent payloads
     */
    public CompletableFuture<ExecutionResult> executeIncrementally(ExecutionArgs executionArgs) {
        return run(executionArgs, executionStrategy::execute);
    }

    /**
     * Subscribes to the event stream of a subscription operation.
     *
     * @return a result whose data is a {@code Publisher} of {@link ExecutionResult}s, or an errors-only result
     */
    public CompletableFuture<ExecutionResult> subscribe(ExecutionArgs executionArgs) {
        return run(executionArgs, subscriptionStrategy::subscribe);
    }

    /**
     * @return a result whose data is the {@code Publisher} of source events, or an errors-only result
     */
    public CompletableFuture<ExecutionResult> createSourceEventStream(ExecutionArgs executionArgs) {
        return run(executionArgs, subscriptionStrategy::createSourceEventStream);
    }

    private CompletableFuture<ExecutionResult> run(ExecutionArgs executionArgs, Function<ExecutionContext, Mono<ExecutionResult>> strategy) {
        Assert.assertNotNull(executionArgs.getDocument(), () -> "document must be provided");
        Scheduler scheduler = processingSchedulers.get(ThreadLocalRandom.current().nextInt(processingSchedulers.size()));
        ExecutionContext executionContext;
        try {
            executionContext = ExecutionContext.build(this, executionArgs, scheduler);
        } catch (InvalidRequestException e) {
            log.debug("request rejected with {} errors", e.getErrors().size());
            return CompletableFuture.completedFuture(ExecutionResultImpl.newExecutionResult()
                    .addErrors(e.getErrors())
                    .build());
        }
        return strategy.apply(executionContext)
                .subscribeOn(scheduler)
                .toFuture();
    }

    /**
     * Disposes the processing schedulers. Requests still in flight are not completed.
     */
    @Override
    public void close() {
        for (Scheduler scheduler : processingSchedulers) {
            scheduler.dispose();
        }
    }

    public GraphQLSchema getGraphQLSchema() {
        return graphQLSchema;
    }

    public ResolverRegistry getResolverRegistry() {
        return resolverRegistry;
    }

    public FieldResolver getDefaultFieldResolver() {
        return defaultFieldResolver;
    }

    public TypeResolver getDefaultTypeResolver() {
        return defaultTypeResolver;
    }

    public FieldResolver getSubscribeFieldResolver() {
        return subscribeFieldResolver;
    }

    public MiddlewareChain getMiddlewareChain() {
        return middlewareChain;
    }

    public boolean isIncrementalDelivery() {
        return incrementalDelivery;
    }

    public Integer getMaxVariableErrors() {
        return maxVariableErrors;
    }

    public static class Builder {

        private final GraphQLSchema graphQLSchema;
        private ResolverRegistry resolverRegistry = new ResolverRegistry();
        private FieldResolver defaultFieldResolver = PropertyFieldResolver.INSTANCE;
        private TypeResolver defaultTypeResolver;
        private FieldResolver subscribeFieldResolver;
        private final List<FieldMiddleware> middlewares = new ArrayList<>();
        private boolean incrementalDelivery = true;
        private Integer maxVariableErrors = 50;
        private int processingThreads = Runtime.getRuntime().availableProcessors();

        private Builder(GraphQLSchema graphQLSchema) {
            this.graphQLSchema = Assert.assertNotNull(graphQLSchema, () -> "graphQLSchema must be provided");
        }

        public Builder resolvers(ResolverRegistry resolverRegistry) {
            this.resolverRegistry = Assert.assertNotNull(resolverRegistry);
            return this;
        }

        public Builder defaultFieldResolver(FieldResolver defaultFieldResolver) {
            this.defaultFieldResolver = Assert.assertNotNull(defaultFieldResolver);
            return this;
        }

        public Builder defaultTypeResolver(TypeResolver defaultTypeResolver) {
            this.defaultTypeResolver = defaultTypeResolver;
            return this;
        }

        public Builder subscribeFieldResolver(FieldResolver subscribeFieldResolver) {
            this.subscribeFieldResolver = subscribeFieldResolver;
            return this;
        }

        public Builder middleware(FieldMiddleware... middlewares) {
            this.middlewares.addAll(Arrays.asList(middlewares));
            return this;
        }

        public Builder incrementalDelivery(boolean incrementalDelivery) {
            this.incrementalDelivery = incrementalDelivery;
            return this;
        }

        /**
         * @param maxVariableErrors the number of variable errors after which coercion is aborted, null for no limit
         */
        public Builder maxVariableErrors(Integer maxVariableErrors) {
            this.maxVariableErrors = maxVariableErrors;
            return this;
        }

        public Builder processingThreads(int processingThreads) {
            Assert.assertTrue(processingThreads > 0, () -> "processingThreads must be positive");
            this.processingThreads = processingThreads;
            return this;
        }

        public IncrementalGraphQL build() {
            return new IncrementalGraphQL(this);
        }
    }
}

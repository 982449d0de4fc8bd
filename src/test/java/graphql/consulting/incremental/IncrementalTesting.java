package graphql.consulting.incremental;

import graphql.ExecutionResult;
import graphql.consulting.incremental.result.IncrementalExecutionResult;
import graphql.consulting.incremental.result.SubsequentIncrementalExecutionResult;
import graphql.schema.GraphQLSchema;
import graphql.schema.idl.RuntimeWiring;
import graphql.schema.idl.SchemaGenerator;
import graphql.schema.idl.SchemaParser;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

final class IncrementalTesting {

    static final Duration TIMEOUT = Duration.ofSeconds(5);

    private IncrementalTesting() {
    }

    static GraphQLSchema schema(String sdl) {
        return new SchemaGenerator().makeExecutableSchema(new SchemaParser().parse(sdl), RuntimeWiring.MOCKED_WIRING);
    }

    static ExecutionResult await(CompletableFuture<ExecutionResult> future) {
        try {
            return future.get(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (Exception e) {
            throw new AssertionError("execution did not complete", e);
        }
    }

    /**
     * The initial payload followed by all subsequent payloads, each in its specification form.
     */
    static List<Map<String, Object>> payloads(ExecutionResult result) {
        List<Map<String, Object>> payloads = new ArrayList<>();
        payloads.add(result.toSpecification());
        if (result instanceof IncrementalExecutionResult) {
            List<SubsequentIncrementalExecutionResult> subsequent = Flux.from(((IncrementalExecutionResult) result).getSubsequentResults())
                    .collectList()
                    .block(TIMEOUT);
            for (SubsequentIncrementalExecutionResult payload : subsequent) {
                payloads.add(payload.toSpecification());
            }
        }
        return payloads;
    }

    static List<SubsequentIncrementalExecutionResult> subsequentResults(ExecutionResult result) {
        return Flux.from(((IncrementalExecutionResult) result).getSubsequentResults())
                .collectList()
                .block(TIMEOUT);
    }

    /**
     * All entries of the given kind ("pending", "incremental" or "completed") across the subsequent payloads.
     */
    @SuppressWarnings("unchecked")
    static List<Map<String, Object>> entries(List<Map<String, Object>> payloads, String kind) {
        List<Map<String, Object>> entries = new ArrayList<>();
        for (int i = 1; i < payloads.size(); i++) {
            List<Map<String, Object>> list = (List<Map<String, Object>>) payloads.get(i).get(kind);
            if (list != null) {
                entries.addAll(list);
            }
        }
        return entries;
    }

    /**
     * The streamed items of one stream id in delivery order.
     */
    @SuppressWarnings("unchecked")
    static List<Object> streamedItems(List<Map<String, Object>> payloads, String id) {
        List<Object> items = new ArrayList<>();
        for (Map<String, Object> entry : entries(payloads, "incremental")) {
            if (id.equals(entry.get("id")) && entry.containsKey("items")) {
                items.addAll((List<Object>) entry.get("items"));
            }
        }
        return items;
    }

    static Object lastHasNext(List<Map<String, Object>> payloads) {
        return payloads.get(payloads.size() - 1).get("hasNext");
    }
}

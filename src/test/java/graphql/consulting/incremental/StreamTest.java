package graphql.consulting.incremental;

import graphql.ExecutionResult;
import graphql.consulting.incremental.result.IncrementalExecutionResult;
import graphql.consulting.incremental.result.PendingResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static graphql.consulting.incremental.IncrementalTesting.TIMEOUT;
import static graphql.consulting.incremental.IncrementalTesting.await;
import static graphql.consulting.incremental.IncrementalTesting.entries;
import static graphql.consulting.incremental.IncrementalTesting.lastHasNext;
import static graphql.consulting.incremental.IncrementalTesting.payloads;
import static graphql.consulting.incremental.IncrementalTesting.schema;
import static graphql.consulting.incremental.IncrementalTesting.streamedItems;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class StreamTest {

    private static final String SDL = "type Query {\n" +
            "  tags: [String]\n" +
            "  nonNullTags: [String!]\n" +
            "  heroes: [Hero]\n" +
            "  matrix: [[Int]]\n" +
            "  counts: [Int!]\n" +
            "}\n" +
            "type Hero {\n" +
            "  name: String\n" +
            "}\n";

    private final IncrementalGraphQL graphQL = IncrementalGraphQL.newGraphQL(schema(SDL)).processingThreads(2).build();

    @AfterEach
    void tearDown() {
        graphQL.close();
    }

    private ExecutionResult execute(String query, Map<String, Object> root) {
        return await(graphQL.executeIncrementally(ExecutionArgs.newExecutionArgs(query).root(root).build()));
    }

    private static Map<String, Object> root(String key, Object value) {
        Map<String, Object> root = new HashMap<>();
        root.put(key, value);
        return root;
    }

    @Test
    void streamsListItemsAfterInitialCount() {
        ExecutionResult result = execute("{ tags @stream(initialCount: 1, label: \"S\") }", root("tags", Arrays.asList("a", "b", "c")));

        assertInstanceOf(IncrementalExecutionResult.class, result);
        assertEquals(Collections.singletonMap("tags", Collections.singletonList("a")), result.getData());
        PendingResult pending = ((IncrementalExecutionResult) result).getPending().get(0);
        assertEquals("0", pending.getId());
        assertEquals(Collections.singletonList("tags"), pending.getPath());
        assertEquals("S", pending.getLabel());

        List<Map<String, Object>> payloads = payloads(result);
        assertEquals(Arrays.asList("b", "c"), streamedItems(payloads, "0"));
        List<Map<String, Object>> completed = entries(payloads, "completed");
        assertEquals(Collections.singletonList(Collections.singletonMap("id", "0")), completed);
        assertEquals(Boolean.FALSE, lastHasNext(payloads));
    }

    @Test
    void streamsObjectItemsWithTheirSubfields() {
        ExecutionResult result = execute("{ heroes @stream { name } }",
                root("heroes", Arrays.asList(Collections.singletonMap("name", "Luke"), Collections.singletonMap("name", "Leia"))));

        assertEquals(Collections.singletonMap("heroes", Collections.emptyList()), result.getData());
        List<Map<String, Object>> payloads = payloads(result);
        assertEquals(Arrays.asList(Collections.singletonMap("name", "Luke"), Collections.singletonMap("name", "Leia")),
                streamedItems(payloads, "0"));
    }

    @Test
    void onlyTheOuterListIsStreamed() {
        ExecutionResult result = execute("{ matrix @stream(initialCount: 1) }",
                root("matrix", Arrays.asList(Arrays.asList(1, 2), Collections.singletonList(3))));

        assertEquals(Collections.singletonMap("matrix", Collections.singletonList(Arrays.asList(1, 2))), result.getData());
        assertEquals(Collections.singletonList(Collections.singletonList(3)), streamedItems(payloads(result), "0"));
    }

    @Test
    void streamsItemsOfAPublisher() {
        ExecutionResult result = execute("{ tags @stream(initialCount: 2) }", root("tags", Flux.just("a", "b", "c")));

        assertEquals(Collections.singletonMap("tags", Arrays.asList("a", "b")), result.getData());
        List<Map<String, Object>> payloads = payloads(result);
        assertEquals(Collections.singletonList("c"), streamedItems(payloads, "0"));
        assertEquals(Boolean.FALSE, lastHasNext(payloads));
    }

    @Test
    void publisherWithoutStreamIsCollected() {
        ExecutionResult result = execute("{ tags }", root("tags", Flux.just("a", "b")));

        assertFalse(result instanceof IncrementalExecutionResult);
        assertEquals(Collections.singletonMap("tags", Arrays.asList("a", "b")), result.getData());
    }

    @Test
    void publisherErrorCompletesTheStreamWithErrors() {
        Flux<String> tags = Flux.just("a", "b").concatWith(Flux.<String>error(new RuntimeException("source failed")));

        ExecutionResult result = execute("{ tags @stream(initialCount: 1) }", root("tags", tags));

        assertEquals(Collections.singletonMap("tags", Collections.singletonList("a")), result.getData());
        List<Map<String, Object>> payloads = payloads(result);
        assertEquals(Collections.singletonList("b"), streamedItems(payloads, "0"));
        List<Map<String, Object>> completed = entries(payloads, "completed");
        assertEquals(1, completed.size());
        List<Map<String, Object>> errors = (List<Map<String, Object>>) completed.get(0).get("errors");
        assertEquals("source failed", errors.get(0).get("message"));
        assertEquals(Collections.singletonList("tags"), errors.get(0).get("path"));
        assertEquals(Boolean.FALSE, lastHasNext(payloads));
    }

    @Test
    void nullInNonNullStreamedItemCompletesTheStreamWithErrors() {
        ExecutionResult result = execute("{ nonNullTags @stream(initialCount: 1) }", root("nonNullTags", Arrays.asList("a", null, "c")));

        assertEquals(Collections.singletonMap("nonNullTags", Collections.singletonList("a")), result.getData());
        List<Map<String, Object>> payloads = payloads(result);
        assertTrue(streamedItems(payloads, "0").isEmpty());
        List<Map<String, Object>> completed = entries(payloads, "completed");
        assertEquals(1, completed.size());
        List<Map<String, Object>> errors = (List<Map<String, Object>>) completed.get(0).get("errors");
        assertEquals("Cannot return null for non-nullable field Query.nonNullTags.", errors.get(0).get("message"));
        assertEquals(Arrays.asList("nonNullTags", 1), errors.get(0).get("path"));
    }

    @Test
    void negativeInitialCountIsAFieldError() {
        ExecutionResult result = execute("{ tags @stream(initialCount: -1) }", root("tags", Arrays.asList("a", "b")));

        assertFalse(result instanceof IncrementalExecutionResult);
        assertEquals(Collections.singletonMap("tags", null), result.getData());
        assertEquals("initialCount must be a positive integer", result.getErrors().get(0).getMessage());
    }

    @Test
    void disabledStreamReturnsTheWholeList() {
        ExecutionResult result = execute("{ tags @stream(if: false) }", root("tags", Arrays.asList("a", "b")));

        assertFalse(result instanceof IncrementalExecutionResult);
        assertEquals(Collections.singletonMap("tags", Arrays.asList("a", "b")), result.getData());
    }

    @Test
    void cancellingSubsequentResultsReturnsTheStreamedPublisher() throws InterruptedException {
        CountDownLatch cancelled = new CountDownLatch(1);
        Flux<String> tags = Flux.just("a").concatWith(Flux.<String>never()).doOnCancel(cancelled::countDown);

        ExecutionResult result = execute("{ tags @stream(initialCount: 1) }", root("tags", tags));

        assertEquals(Collections.singletonMap("tags", Collections.singletonList("a")), result.getData());
        StepVerifier.create(((IncrementalExecutionResult) result).getSubsequentResults())
                .expectSubscription()
                .thenCancel()
                .verify(TIMEOUT);
        assertTrue(cancelled.await(5, TimeUnit.SECONDS));
    }

    @RepeatedTest(10)
    void cancellingRightAfterSubscribingReturnsTheStreamedPublisher() throws InterruptedException {
        CountDownLatch cancelled = new CountDownLatch(1);
        Flux<String> tags = Flux.just("a").concatWith(Flux.<String>never()).doOnCancel(cancelled::countDown);

        ExecutionResult result = execute("{ tags @stream(initialCount: 1) }", root("tags", tags));

        Disposable subscription = Flux.from(((IncrementalExecutionResult) result).getSubsequentResults()).subscribe();
        subscription.dispose();
        assertTrue(cancelled.await(5, TimeUnit.SECONDS));
    }

    @Test
    void streamedPublisherIsReturnedWhenAnItemFailsTheStream() throws InterruptedException {
        CountDownLatch cancelled = new CountDownLatch(1);
        Flux<Object> counts = Flux.<Object>just(1, "not a number").concatWith(Flux.never()).doOnCancel(cancelled::countDown);

        ExecutionResult result = execute("{ counts @stream(initialCount: 1) }", root("counts", counts));

        assertEquals(Collections.singletonMap("counts", Collections.singletonList(1)), result.getData());
        List<Map<String, Object>> payloads = payloads(result);
        assertTrue(streamedItems(payloads, "0").isEmpty());
        List<Map<String, Object>> completed = entries(payloads, "completed");
        assertEquals(1, completed.size());
        List<Map<String, Object>> errors = (List<Map<String, Object>>) completed.get(0).get("errors");
        assertEquals(Arrays.asList("counts", 1), errors.get(0).get("path"));
        assertEquals(Boolean.FALSE, lastHasNext(payloads));
        assertTrue(cancelled.await(5, TimeUnit.SECONDS));
    }
}

package graphql.consulting.incremental;

import graphql.ExecutionResult;
import graphql.GraphQLError;
import graphql.GraphQLException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static graphql.consulting.incremental.IncrementalTesting.await;
import static graphql.consulting.incremental.IncrementalTesting.schema;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ExecuteTest {

    private static final String SDL = "type Query {\n" +
            "  hero: Hero\n" +
            "  heroes: [Hero]\n" +
            "  greeting(name: String = \"World\"): String\n" +
            "  failing: String\n" +
            "  nonNullFailing: String!\n" +
            "  nested: Nested\n" +
            "  count: Int\n" +
            "  tags: [String]\n" +
            "  color: Color\n" +
            "  later: String\n" +
            "  laterMono: String\n" +
            "  required(n: Int!): Int\n" +
            "}\n" +
            "type Mutation {\n" +
            "  first: String\n" +
            "  second: String\n" +
            "}\n" +
            "type Hero {\n" +
            "  id: ID!\n" +
            "  name: String\n" +
            "  friends: [Hero]\n" +
            "}\n" +
            "type Nested {\n" +
            "  value: String!\n" +
            "  other: String\n" +
            "}\n" +
            "enum Color { RED GREEN }\n";

    enum Color {
        RED, BLUE
    }

    private final IncrementalGraphQL graphQL = IncrementalGraphQL.newGraphQL(schema(SDL)).processingThreads(2).build();

    @AfterEach
    void tearDown() {
        graphQL.close();
    }

    private Map<String, Object> hero(String id, String name, Object friends) {
        Map<String, Object> hero = new HashMap<>();
        hero.put("id", id);
        hero.put("name", name);
        hero.put("friends", friends);
        return hero;
    }

    private ExecutionResult execute(String query, Object root) {
        return await(graphQL.execute(ExecutionArgs.newExecutionArgs(query).root(root).build()));
    }

    @Test
    void resolvesNestedObjectsAndListsInSelectionOrder() {
        Map<String, Object> root = new HashMap<>();
        root.put("hero", hero("1", "Luke", Arrays.asList(hero("2", "Han", null), hero("3", "Leia", null))));

        ExecutionResult result = execute("{ hero { name id friends { name } __typename alias: name } }", root);

        assertTrue(result.getErrors().isEmpty());
        Map<String, Object> data = result.getData();
        Map<String, Object> hero = (Map<String, Object>) data.get("hero");
        assertEquals(Arrays.asList("name", "id", "friends", "__typename", "alias"), new ArrayList<>(hero.keySet()));
        assertEquals("Luke", hero.get("name"));
        assertEquals("1", hero.get("id"));
        assertEquals("Hero", hero.get("__typename"));
        assertEquals("Luke", hero.get("alias"));
        List<Object> friends = (List<Object>) hero.get("friends");
        assertEquals(Collections.singletonMap("name", "Han"), friends.get(0));
        assertEquals(Collections.singletonMap("name", "Leia"), friends.get(1));
    }

    @Test
    void usesArgumentDefaultsAndVariables() {
        Map<String, Object> root = new HashMap<>();
        root.put("greeting", (FieldResolver) (source, arguments, info) -> "Hello " + arguments.get("name"));

        ExecutionResult withDefault = execute("{ greeting }", root);
        assertEquals(Collections.singletonMap("greeting", "Hello World"), withDefault.getData());

        ExecutionResult withVariable = await(graphQL.execute(ExecutionArgs.newExecutionArgs("query Q($n: String) { greeting(name: $n) }")
                .root(root)
                .variables(Collections.<String, Object>singletonMap("n", "Ada"))
                .build()));
        assertEquals(Collections.singletonMap("greeting", "Hello Ada"), withVariable.getData());
    }

    @Test
    void nullableFieldErrorBecomesNullWithLocatedError() {
        Map<String, Object> root = new HashMap<>();
        root.put("failing", (FieldResolver) (source, arguments, info) -> {
            throw new RuntimeException("boom");
        });
        root.put("count", 3);

        ExecutionResult result = execute("{ failing count }", root);

        Map<String, Object> data = result.getData();
        assertTrue(data.containsKey("failing"));
        assertNull(data.get("failing"));
        assertEquals(3, data.get("count"));
        assertEquals(1, result.getErrors().size());
        GraphQLError error = result.getErrors().get(0);
        assertEquals("boom", error.getMessage());
        assertEquals(Collections.singletonList("failing"), error.getPath());
        assertEquals(1, error.getLocations().get(0).getLine());
        assertEquals(3, error.getLocations().get(0).getColumn());
    }

    @Test
    void resolverMayReturnAnErrorInsteadOfThrowing() {
        Map<String, Object> root = new HashMap<>();
        root.put("failing", (FieldResolver) (source, arguments, info) -> new IllegalStateException("returned"));

        ExecutionResult result = execute("{ failing }", root);

        assertEquals(Collections.singletonMap("failing", null), result.getData());
        assertEquals("returned", result.getErrors().get(0).getMessage());
    }

    @Test
    void nullInNonNullFieldPropagatesToNearestNullableParent() {
        Map<String, Object> nested = new HashMap<>();
        nested.put("value", null);
        nested.put("other", "x");
        Map<String, Object> root = new HashMap<>();
        root.put("nested", nested);
        root.put("count", 1);

        ExecutionResult result = execute("{ nested { other value } count }", root);

        Map<String, Object> data = result.getData();
        assertTrue(data.containsKey("nested"));
        assertNull(data.get("nested"));
        assertEquals(1, data.get("count"));
        assertEquals(1, result.getErrors().size());
        GraphQLError error = result.getErrors().get(0);
        assertEquals("Cannot return null for non-nullable field Nested.value.", error.getMessage());
        assertEquals(Arrays.asList("nested", "value"), error.getPath());
    }

    @Test
    void nullInNonNullRootFieldNullsData() {
        ExecutionResult result = execute("{ count nonNullFailing }", new HashMap<String, Object>());

        assertTrue(result.isDataPresent());
        assertNull(result.getData());
        assertEquals("Cannot return null for non-nullable field Query.nonNullFailing.", result.getErrors().get(0).getMessage());
        assertTrue(result.toSpecification().containsKey("data"));
    }

    @Test
    void completesAsynchronousValues() {
        Map<String, Object> root = new HashMap<>();
        root.put("later", (FieldResolver) (source, arguments, info) -> CompletableFuture.supplyAsync(() -> "future"));
        root.put("laterMono", (FieldResolver) (source, arguments, info) -> Mono.delay(Duration.ofMillis(20)).map(tick -> "mono"));
        root.put("count", (FieldResolver) (source, arguments, info) -> Mono.empty());

        ExecutionResult result = execute("{ laterMono later count }", root);

        Map<String, Object> data = result.getData();
        assertEquals(Arrays.asList("laterMono", "later", "count"), new ArrayList<>(data.keySet()));
        assertEquals("mono", data.get("laterMono"));
        assertEquals("future", data.get("later"));
        assertNull(data.get("count"));
        assertTrue(result.getErrors().isEmpty());
    }

    @Test
    void listItemsKeepTheirOrderWhenCompletedInReverse() {
        List<String> completions = Collections.synchronizedList(new ArrayList<>());
        List<Object> tags = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            String tag = "tag" + i;
            tags.add(Mono.delay(Duration.ofMillis(40L * (4 - i))).map(tick -> {
                completions.add(tag);
                return tag;
            }));
        }

        ExecutionResult result = execute("{ tags }", Collections.singletonMap("tags", tags));

        assertEquals(Arrays.asList("tag3", "tag2", "tag1", "tag0"), completions);
        assertEquals(Collections.singletonMap("tags", Arrays.asList("tag0", "tag1", "tag2", "tag3")), result.getData());
    }

    @Test
    void errorsAreOrderedByLocationThenPath() {
        Map<String, Object> root = new HashMap<>();
        root.put("failing", (FieldResolver) (source, arguments, info) ->
                Mono.delay(Duration.ofMillis(100)).then(Mono.error(new IllegalStateException("failed last"))));
        root.put("later", (FieldResolver) (source, arguments, info) -> Mono.error(new IllegalStateException("failed first")));
        root.put("tags", Arrays.asList(
                Mono.delay(Duration.ofMillis(50)).then(Mono.error(new IllegalStateException("item 0"))),
                Mono.error(new IllegalStateException("item 1"))));

        ExecutionResult result = execute("{ failing later tags }", root);

        List<String> messages = new ArrayList<>();
        List<Object> paths = new ArrayList<>();
        for (GraphQLError error : result.getErrors()) {
            messages.add(error.getMessage());
            paths.add(error.getPath());
        }
        assertEquals(Arrays.asList("failed last", "failed first", "item 0", "item 1"), messages);
        assertEquals(Arrays.asList(
                Collections.singletonList("failing"),
                Collections.singletonList("later"),
                Arrays.asList("tags", 0),
                Arrays.asList("tags", 1)), paths);
        assertEquals(result.getErrors().get(2).getLocations(), result.getErrors().get(3).getLocations());
    }

    @Test
    void mutationFieldsRunSerially() {
        List<String> events = Collections.synchronizedList(new ArrayList<>());
        Map<String, Object> root = new HashMap<>();
        root.put("first", (FieldResolver) (source, arguments, info) -> {
            events.add("first started");
            return Mono.delay(Duration.ofMillis(50)).map(tick -> {
                events.add("first finished");
                return "one";
            });
        });
        root.put("second", (FieldResolver) (source, arguments, info) -> {
            events.add("second started");
            return "two";
        });

        ExecutionResult result = execute("mutation { first second }", root);

        Map<String, Object> expected = new LinkedHashMap<>();
        expected.put("first", "one");
        expected.put("second", "two");
        assertEquals(expected, result.getData());
        assertEquals(Arrays.asList("first started", "first finished", "second started"), events);
    }

    @Test
    void serializesLeafValues() {
        Map<String, Object> root = new HashMap<>();
        root.put("color", Color.RED);
        root.put("count", 7L);
        root.put("tags", new String[]{"a", "b"});

        ExecutionResult result = execute("{ color count tags }", root);

        Map<String, Object> data = result.getData();
        assertEquals("RED", data.get("color"));
        assertEquals(7, data.get("count"));
        assertEquals(Arrays.asList("a", "b"), data.get("tags"));
    }

    @Test
    void invalidLeafValuesAreFieldErrors() {
        Map<String, Object> root = new HashMap<>();
        root.put("color", Color.BLUE);
        root.put("tags", "not a list");

        ExecutionResult result = execute("{ color tags }", root);

        Map<String, Object> data = result.getData();
        assertNull(data.get("color"));
        assertNull(data.get("tags"));
        assertEquals(2, result.getErrors().size());
        assertEquals("Enum 'Color' cannot represent value: BLUE", result.getErrors().get(0).getMessage());
        assertEquals("Expected Iterable, but did not find one for field 'Query.tags'.", result.getErrors().get(1).getMessage());
        assertEquals(Collections.singletonList("tags"), result.getErrors().get(1).getPath());
    }

    @Test
    void operationSelectionErrorsOmitData() {
        ExecutionResult result = execute("query A { count } query B { count }", new HashMap<String, Object>());

        assertFalse(result.isDataPresent());
        assertFalse(result.toSpecification().containsKey("data"));
        assertEquals("Must provide operation name if query contains multiple operations.", result.getErrors().get(0).getMessage());

        ExecutionResult unknown = await(graphQL.execute(ExecutionArgs.newExecutionArgs("query A { count }").operationName("C").build()));
        assertEquals("Unknown operation named 'C'.", unknown.getErrors().get(0).getMessage());
    }

    @Test
    void variableErrorsOmitData() {
        ExecutionResult result = execute("query Q($n: Int!) { required(n: $n) }", new HashMap<String, Object>());

        assertFalse(result.isDataPresent());
        assertEquals("Variable '$n' of required type 'Int!' was not provided.", result.getErrors().get(0).getMessage());
    }

    @Test
    void missingRootTypeIsAnError() {
        IncrementalGraphQL queryOnly = IncrementalGraphQL.newGraphQL(schema("type Query { a: String }")).processingThreads(1).build();
        try {
            ExecutionResult result = await(queryOnly.execute(ExecutionArgs.newExecutionArgs("mutation { a }").build()));

            assertTrue(result.isDataPresent());
            assertNull(result.getData());
            assertEquals("Schema is not configured to execute mutation operation.", result.getErrors().get(0).getMessage());
        } finally {
            queryOnly.close();
        }
    }

    @Test
    void executeRejectsIncrementalResults() {
        Map<String, Object> root = new HashMap<>();
        root.put("count", 1);

        CompletableFuture<ExecutionResult> future = graphQL.execute(ExecutionArgs.newExecutionArgs("{ ... @defer { count } }").root(root).build());

        ExecutionException exception = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertInstanceOf(GraphQLException.class, exception.getCause());
        assertEquals("Executing this GraphQL operation would unexpectedly produce multiple payloads (due to @defer or @stream directive)",
                exception.getCause().getMessage());
    }

    @Test
    void disabledIncrementalDeliveryInlinesDeferredFragments() {
        IncrementalGraphQL inline = IncrementalGraphQL.newGraphQL(schema(SDL)).incrementalDelivery(false).processingThreads(1).build();
        try {
            Map<String, Object> root = new HashMap<>();
            root.put("count", 1);
            root.put("tags", Arrays.asList("a", "b", "c"));

            ExecutionResult result = await(inline.execute(ExecutionArgs.newExecutionArgs("{ ... @defer { count } tags @stream(initialCount: 1) }")
                    .root(root)
                    .build()));

            Map<String, Object> expected = new LinkedHashMap<>();
            expected.put("count", 1);
            expected.put("tags", Arrays.asList("a", "b", "c"));
            assertEquals(expected, result.getData());
        } finally {
            inline.close();
        }
    }
}

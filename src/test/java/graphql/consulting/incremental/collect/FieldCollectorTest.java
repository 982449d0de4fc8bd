package graphql.consulting.incremental.collect;

import graphql.consulting.incremental.LocatedError;
import graphql.language.Document;
import graphql.language.FragmentDefinition;
import graphql.language.OperationDefinition;
import graphql.parser.Parser;
import graphql.schema.GraphQLSchema;
import graphql.schema.idl.RuntimeWiring;
import graphql.schema.idl.SchemaGenerator;
import graphql.schema.idl.SchemaParser;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FieldCollectorTest {

    private static final GraphQLSchema SCHEMA = new SchemaGenerator().makeExecutableSchema(new SchemaParser().parse(
            "interface Named { name: String }\n" +
                    "type Dog implements Named { name: String barks: Boolean owner: Dog }\n" +
                    "type Cat implements Named { name: String meows: Boolean }\n" +
                    "type Query { dog: Dog named: Named }\n" +
                    "type Subscription { dog: Dog }\n"), RuntimeWiring.MOCKED_WIRING);

    private final FieldCollector fieldCollector = new FieldCollector();

    private CollectedFields collect(String query, Map<String, Object> variables, boolean incrementalDelivery) {
        Document document = Parser.parse(query);
        OperationDefinition operation = document.getDefinitionsOfType(OperationDefinition.class).get(0);
        Map<String, FragmentDefinition> fragments = new LinkedHashMap<>();
        for (FragmentDefinition fragment : document.getDefinitionsOfType(FragmentDefinition.class)) {
            fragments.put(fragment.getName(), fragment);
        }
        FieldCollectorParameters parameters = FieldCollectorParameters.newParameters()
                .schema(SCHEMA)
                .objectType(operation.getOperation() == OperationDefinition.Operation.SUBSCRIPTION
                        ? SCHEMA.getSubscriptionType() : SCHEMA.getQueryType())
                .fragments(fragments)
                .variables(variables)
                .operation(operation.getOperation())
                .incrementalDelivery(incrementalDelivery)
                .build();
        return fieldCollector.collectFields(parameters, operation);
    }

    private CollectedFields collect(String query) {
        return collect(query, Collections.<String, Object>emptyMap(), true);
    }

    @Test
    void groupsFieldsByResponseKeyInOrder() {
        CollectedFields collected = collect("{ dog { name } d: dog { barks } ...F dog { owner { name } } } fragment F on Query { named { name } }");

        GroupedFieldSet groupedFieldSet = collected.getGroupedFieldSet();
        assertEquals(Arrays.asList("dog", "d", "named"), new ArrayList<>(groupedFieldSet.getResponseKeys()));
        assertEquals(2, groupedFieldSet.get("dog").getFields().size());
        assertTrue(collected.getNewDeferUsages().isEmpty());
    }

    @Test
    void honoursSkipAndInclude() {
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("yes", true);
        variables.put("no", false);

        CollectedFields collected = collect("query Q($yes: Boolean!, $no: Boolean!) { " +
                "dog @skip(if: $yes) { name } " +
                "named @include(if: $no) { name } " +
                "... @include(if: $yes) { alias: dog { name } } }", variables, true);

        assertEquals(Collections.singletonList("alias"), new ArrayList<>(collected.getGroupedFieldSet().getResponseKeys()));
    }

    @Test
    void expandsEachFragmentOnce() {
        CollectedFields collected = collect("{ ...F ...F } fragment F on Query { dog { name } }");

        assertEquals(1, collected.getGroupedFieldSet().get("dog").getFields().size());
    }

    @Test
    void recordsDeferUsagesWithTheirParents() {
        CollectedFields collected = collect("{ dog { name } ... @defer(label: \"outer\") { named { name } ... @defer(label: \"inner\") { dog { barks } } } }");

        List<DeferUsage> deferUsages = collected.getNewDeferUsages();
        assertEquals(2, deferUsages.size());
        DeferUsage outer = deferUsages.get(0);
        DeferUsage inner = deferUsages.get(1);
        assertEquals("outer", outer.getLabel());
        assertNull(outer.getParentDeferUsage());
        assertEquals("inner", inner.getLabel());
        assertSame(outer, inner.getParentDeferUsage());
        assertEquals(Collections.singletonList(outer), inner.getAncestors());

        FieldGroup dog = collected.getGroupedFieldSet().get("dog");
        assertNull(dog.getFields().get(0).getDeferUsage());
        assertSame(inner, dog.getFields().get(1).getDeferUsage());
        assertSame(outer, collected.getGroupedFieldSet().get("named").getFields().get(0).getDeferUsage());
    }

    @Test
    void deferredFragmentSpreadIsExpandedAgain() {
        CollectedFields collected = collect("{ ...F ...F @defer } fragment F on Query { dog { name } }");

        FieldGroup dog = collected.getGroupedFieldSet().get("dog");
        assertEquals(2, dog.getFields().size());
        assertNull(dog.getFields().get(0).getDeferUsage());
        assertSame(collected.getNewDeferUsages().get(0), dog.getFields().get(1).getDeferUsage());
    }

    @Test
    void disabledDeferIsCollectedInline() {
        CollectedFields conditional = collect("{ ... @defer(if: false) { dog { name } } }");
        CollectedFields disabled = collect("{ ... @defer { dog { name } } }", Collections.<String, Object>emptyMap(), false);

        assertTrue(conditional.getNewDeferUsages().isEmpty());
        assertNull(conditional.getGroupedFieldSet().get("dog").getFields().get(0).getDeferUsage());
        assertTrue(disabled.getNewDeferUsages().isEmpty());
        assertNull(disabled.getGroupedFieldSet().get("dog").getFields().get(0).getDeferUsage());
    }

    @Test
    void deferIsRejectedInSubscriptions() {
        LocatedError error = assertThrows(LocatedError.class, () -> collect("subscription { ... @defer { dog { name } } }"));

        assertEquals("`@defer` directive not supported on subscription operations. Disable `@defer` by setting the `if` argument to `false`.",
                error.getMessage());
        assertEquals(1, error.getLocations().get(0).getLine());
    }

    @Test
    void collectsSubfieldsForTheRuntimeType() {
        CollectedFields root = collect("{ named { name ... on Dog { barks } ... on Cat { meows } ... @defer { name } } }");
        FieldCollectorParameters parameters = FieldCollectorParameters.newParameters()
                .schema(SCHEMA)
                .objectType(SCHEMA.getObjectType("Dog"))
                .fragments(Collections.<String, FragmentDefinition>emptyMap())
                .variables(Collections.<String, Object>emptyMap())
                .build();

        CollectedFields subfields = fieldCollector.collectSubfields(parameters, root.getGroupedFieldSet().get("named"));

        assertEquals(Arrays.asList("name", "barks"), new ArrayList<>(subfields.getGroupedFieldSet().getResponseKeys()));
        assertEquals(2, subfields.getGroupedFieldSet().get("name").getFields().size());
        assertEquals(1, subfields.getNewDeferUsages().size());
    }
}

package graphql.consulting.incremental.values;

import graphql.GraphQLError;
import graphql.language.OperationDefinition;
import graphql.language.VariableDefinition;
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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class VariableValuesTest {

    private static final GraphQLSchema SCHEMA = new SchemaGenerator().makeExecutableSchema(new SchemaParser().parse(
            "enum Color { RED GREEN BLUE }\n" +
                    "input Filter { a: Int! b: String c: Color = RED }\n" +
                    "type Query { search(filter: Filter, id: ID, colors: [Color]): String }\n"), RuntimeWiring.MOCKED_WIRING);

    private static CoercedVariableValues coerce(String query, Map<String, Object> inputs, Integer maxErrors) {
        OperationDefinition operation = Parser.parse(query).getDefinitionsOfType(OperationDefinition.class).get(0);
        List<VariableDefinition> variableDefinitions = operation.getVariableDefinitions();
        return VariableValues.coerceVariableValues(SCHEMA, variableDefinitions, inputs, maxErrors);
    }

    private static List<String> messages(CoercedVariableValues values) {
        List<String> messages = new ArrayList<>();
        for (GraphQLError error : values.getErrors()) {
            messages.add(error.getMessage());
        }
        return messages;
    }

    @Test
    void coercesProvidedAndDefaultValues() {
        Map<String, Object> filter = new LinkedHashMap<>();
        filter.put("a", 1);
        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("filter", filter);
        inputs.put("colors", "GREEN");

        CoercedVariableValues values = coerce("query Q($filter: Filter, $colors: [Color], $id: ID = 7) { search }", inputs, 50);

        assertFalse(values.hasErrors());
        Map<String, Object> expectedFilter = new LinkedHashMap<>();
        expectedFilter.put("a", 1);
        expectedFilter.put("c", "RED");
        assertEquals(expectedFilter, values.getCoerced().get("filter"));
        assertEquals(Collections.singletonList("GREEN"), values.getCoerced().get("colors"));
        assertEquals("7", values.getCoerced().get("id"));
    }

    @Test
    void variableWithoutValueOrDefaultIsLeftOut() {
        CoercedVariableValues values = coerce("query Q($id: ID) { search }", Collections.<String, Object>emptyMap(), 50);

        assertFalse(values.hasErrors());
        assertFalse(values.getCoerced().containsKey("id"));
    }

    @Test
    void requiredVariables() {
        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("nulled", null);

        CoercedVariableValues values = coerce("query Q($missing: ID!, $nulled: ID!) { search }", inputs, 50);

        assertTrue(values.hasErrors());
        assertEquals(Arrays.asList(
                "Variable '$missing' of required type 'ID!' was not provided.",
                "Variable '$nulled' of non-null type 'ID!' must not be null."), messages(values));
        assertEquals(1, values.getErrors().get(0).getLocations().get(0).getLine());
    }

    @Test
    void invalidInputObjects() {
        Map<String, Object> missingField = new LinkedHashMap<>();
        missingField.put("b", "x");
        Map<String, Object> unknownField = new LinkedHashMap<>();
        unknownField.put("a", 1);
        unknownField.put("bb", "x");
        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("missing", missingField);
        inputs.put("unknown", unknownField);

        CoercedVariableValues values = coerce("query Q($missing: Filter, $unknown: Filter) { search }", inputs, 50);

        assertEquals(Arrays.asList(
                "Variable '$missing' got invalid value {b: \"x\"}; Field 'a' of required type 'Int!' was not provided.",
                "Variable '$unknown' got invalid value {a: 1, bb: \"x\"}; Field 'bb' is not defined by type 'Filter'. Did you mean 'b'?"),
                messages(values));
    }

    @Test
    void invalidNestedValueReportsItsPath() {
        Map<String, Object> filter = new LinkedHashMap<>();
        filter.put("a", 1);
        filter.put("c", "PURPLE");
        Map<String, Object> inputs = Collections.<String, Object>singletonMap("filter", filter);

        CoercedVariableValues values = coerce("query Q($filter: Filter) { search }", inputs, 50);

        assertEquals(Collections.singletonList(
                "Variable '$filter' got invalid value \"PURPLE\" at 'filter.c'; Value 'PURPLE' does not exist in 'Color' enum."),
                messages(values));
    }

    @Test
    void stopsAfterTooManyErrors() {
        CoercedVariableValues values = coerce("query Q($a: ID!, $b: ID!, $c: ID!) { search }", Collections.<String, Object>emptyMap(), 1);

        assertEquals(Arrays.asList(
                "Variable '$a' of required type 'ID!' was not provided.",
                "Too many errors processing variables, error limit reached. Execution aborted."), messages(values));
    }

    @Test
    void nonInputTypeIsRejected() {
        GraphQLSchema schema = new SchemaGenerator().makeExecutableSchema(new SchemaParser().parse(
                "type Thing { a: Int }\n type Query { thing: Thing }\n"), RuntimeWiring.MOCKED_WIRING);
        OperationDefinition operation = Parser.parse("query Q($t: Thing) { thing { a } }").getDefinitionsOfType(OperationDefinition.class).get(0);

        CoercedVariableValues values = VariableValues.coerceVariableValues(schema, operation.getVariableDefinitions(),
                Collections.<String, Object>emptyMap(), null);

        assertEquals(Collections.singletonList("Variable '$t' expected value of type 'Thing' which cannot be used as an input type."),
                messages(values));
    }
}

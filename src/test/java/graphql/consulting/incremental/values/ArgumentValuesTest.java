package graphql.consulting.incremental.values;

import graphql.Directives;
import graphql.consulting.incremental.LocatedError;
import graphql.language.Field;
import graphql.language.OperationDefinition;
import graphql.parser.Parser;
import graphql.schema.GraphQLArgument;
import graphql.schema.GraphQLSchema;
import graphql.schema.idl.RuntimeWiring;
import graphql.schema.idl.SchemaGenerator;
import graphql.schema.idl.SchemaParser;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ArgumentValuesTest {

    private static final GraphQLSchema SCHEMA = new SchemaGenerator().makeExecutableSchema(new SchemaParser().parse(
            "type Query { search(n: Int!, s: String = \"d\", list: [Int!]): String }\n"), RuntimeWiring.MOCKED_WIRING);

    private static final List<GraphQLArgument> ARGUMENTS = SCHEMA.getQueryType().getFieldDefinition("search").getArguments();

    private static Field field(String query) {
        OperationDefinition operation = Parser.parse(query).getDefinitionsOfType(OperationDefinition.class).get(0);
        return (Field) operation.getSelectionSet().getSelections().get(0);
    }

    private static Map<String, Object> coerce(String query, Map<String, Object> variables) {
        Field field = field(query);
        return ArgumentValues.coerceArgumentValues(ARGUMENTS, field.getArguments(), field, variables, null);
    }

    private static LocatedError failure(String query, Map<String, Object> variables) {
        return assertThrows(LocatedError.class, () -> coerce(query, variables));
    }

    @Test
    void coercesLiteralsAndDefaults() {
        Map<String, Object> values = coerce("{ search(n: 3, list: [1, 2]) }", Collections.<String, Object>emptyMap());

        Map<String, Object> expected = new LinkedHashMap<>();
        expected.put("n", 3);
        expected.put("s", "d");
        expected.put("list", Arrays.asList(1, 2));
        assertEquals(expected, values);
    }

    @Test
    void variablesProvideValuesAndMissingOnesFallBackToDefaults() {
        Map<String, Object> variables = Collections.<String, Object>singletonMap("n", 5);

        Map<String, Object> values = coerce("query Q($n: Int!, $s: String) { search(n: $n, s: $s) }", variables);

        assertEquals(5, values.get("n"));
        assertEquals("d", values.get("s"));
    }

    @Test
    void argumentsAreStoredUnderTheirInternalNames() {
        Field field = field("{ search(n: 1) }");

        Map<String, Object> values = ArgumentValues.coerceArgumentValues(ARGUMENTS, field.getArguments(), field,
                Collections.<String, Object>emptyMap(), Collections.singletonMap("n", "count"));

        assertEquals(1, values.get("count"));
        assertFalse(values.containsKey("n"));
    }

    @Test
    void missingRequiredArgument() {
        LocatedError error = failure("{ search }", Collections.<String, Object>emptyMap());

        assertEquals("Argument 'n' of required type 'Int!' was not provided.", error.getMessage());
        assertEquals(1, error.getLocations().get(0).getLine());
        assertEquals(3, error.getLocations().get(0).getColumn());
    }

    @Test
    void requiredArgumentGivenAVariableWithoutRuntimeValue() {
        LocatedError error = failure("query Q($v: Int) { search(n: $v) }", Collections.<String, Object>emptyMap());

        assertEquals("Argument 'n' of required type 'Int!' was provided the variable '$v' which was not provided a runtime value.",
                error.getMessage());
        assertEquals(1, error.getLocations().size());
    }

    @Test
    void nonNullArgumentGivenNull() {
        LocatedError literal = failure("{ search(n: null) }", Collections.<String, Object>emptyMap());
        LocatedError variable = failure("query Q($v: Int) { search(n: $v) }", Collections.<String, Object>singletonMap("v", null));

        assertEquals("Argument 'n' of non-null type 'Int!' must not be null.", literal.getMessage());
        assertEquals("Argument 'n' of non-null type 'Int!' must not be null.", variable.getMessage());
    }

    @Test
    void invalidLiteral() {
        LocatedError error = failure("{ search(n: \"three\") }", Collections.<String, Object>emptyMap());

        assertEquals("Argument 'n' has invalid value \"three\".", error.getMessage());
        assertEquals(13, error.getLocations().get(0).getColumn());
    }

    @Test
    void missingVariableInsideANonNullListIsInvalid() {
        LocatedError error = failure("query Q($v: Int) { search(n: 1, list: [1, $v]) }", Collections.<String, Object>emptyMap());

        assertTrue(error.getMessage().startsWith("Argument 'list' has invalid value ["), error.getMessage());
    }

    @Test
    void directiveValues() {
        Field field = field("query Q($s: Boolean) { search(n: 1) @skip(if: $s) }");

        Map<String, Object> values = ArgumentValues.getDirectiveValues(Directives.SkipDirective, field.getDirectives(),
                Collections.<String, Object>singletonMap("s", true));

        assertEquals(Collections.<String, Object>singletonMap("if", true), values);
        assertNull(ArgumentValues.getDirectiveValues(Directives.IncludeDirective, field.getDirectives(),
                Collections.<String, Object>emptyMap()));
    }
}

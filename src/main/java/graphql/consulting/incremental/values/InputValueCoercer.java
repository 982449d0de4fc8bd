package graphql.consulting.incremental.values;

import graphql.GraphQLContext;
import graphql.GraphQLError;
import graphql.Internal;
import graphql.consulting.incremental.Inspector;
import graphql.consulting.incremental.LocatedError;
import graphql.language.Node;
import graphql.language.Value;
import graphql.schema.GraphQLEnumType;
import graphql.schema.GraphQLEnumValueDefinition;
import graphql.schema.GraphQLInputObjectField;
import graphql.schema.GraphQLInputObjectType;
import graphql.schema.GraphQLInputType;
import graphql.schema.GraphQLList;
import graphql.schema.GraphQLNonNull;
import graphql.schema.GraphQLScalarType;
import graphql.schema.GraphQLTypeUtil;
import graphql.schema.InputValueWithState;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Coerces external input values (variables, programmatic defaults) to the internal values of
 * an input type.
 */
@Internal
public final class InputValueCoercer {

    /**
     * Raises the first error, prefixed with the invalid value and its path.
     */
    public static final InputValueErrorHandler DEFAULT_ERROR_HANDLER = (path, invalidValue, error) -> {
        String prefix = "Invalid value " + Inspector.inspect(invalidValue);
        if (!path.isEmpty()) {
            prefix += " at 'value" + printPathList(path) + "'";
        }
        throw new LocatedError(prefix + ": " + error.getMessage(), Collections.<Node>emptyList(), null,
                error instanceof Throwable ? (Throwable) error : null, error.getExtensions());
    };

    private InputValueCoercer() {
    }

    public static Object coerceInputValue(Object inputValue, GraphQLInputType type) {
        return coerceInputValue(inputValue, type, DEFAULT_ERROR_HANDLER, Collections.emptyList());
    }

    public static Object coerceInputValue(Object inputValue, GraphQLInputType type, InputValueErrorHandler onError) {
        return coerceInputValue(inputValue, type, onError, Collections.emptyList());
    }

    public static Object coerceInputValue(Object inputValue,
                                          GraphQLInputType type,
                                          InputValueErrorHandler onError,
                                          List<Object> path) {
        if (type instanceof GraphQLNonNull) {
            if (inputValue != null) {
                return coerceInputValue(inputValue, (GraphQLInputType) ((GraphQLNonNull) type).getWrappedType(), onError, path);
            }
            onError.onError(path, null, new LocatedError(
                    "Expected non-nullable type '" + GraphQLTypeUtil.simplePrint(type) + "' not to be null."));
            return ValueFromAst.INVALID;
        }

        if (inputValue == null) {
            return null;
        }

        if (type instanceof GraphQLList) {
            GraphQLInputType itemType = (GraphQLInputType) ((GraphQLList) type).getWrappedType();
            List<Object> items = asList(inputValue);
            if (items != null) {
                List<Object> coercedList = new ArrayList<>();
                for (int index = 0; index < items.size(); index++) {
                    coercedList.add(coerceInputValue(items.get(index), itemType, onError, append(path, index)));
                }
                return coercedList;
            }
            // a single value is accepted as a list of one
            List<Object> singleton = new ArrayList<>();
            singleton.add(coerceInputValue(inputValue, itemType, onError, path));
            return singleton;
        }

        if (type instanceof GraphQLInputObjectType) {
            return coerceInputObject(inputValue, (GraphQLInputObjectType) type, onError, path);
        }

        if (type instanceof GraphQLEnumType) {
            return coerceEnum(inputValue, (GraphQLEnumType) type, onError, path);
        }

        GraphQLScalarType scalarType = (GraphQLScalarType) type;
        Object parseResult;
        try {
            parseResult = scalarType.getCoercing().parseValue(inputValue, GraphQLContext.getDefault(), Locale.getDefault());
        } catch (RuntimeException e) {
            if (e instanceof GraphQLError) {
                onError.onError(path, inputValue, (GraphQLError) e);
            } else {
                onError.onError(path, inputValue, new LocatedError(
                        "Expected type '" + scalarType.getName() + "'. " + e.getMessage(), Collections.emptyList(), null, e, null));
            }
            return ValueFromAst.INVALID;
        }
        if (parseResult == null) {
            onError.onError(path, inputValue, new LocatedError("Expected type '" + scalarType.getName() + "'."));
            return ValueFromAst.INVALID;
        }
        return parseResult;
    }

    private static Object coerceInputObject(Object inputValue,
                                            GraphQLInputObjectType type,
                                            InputValueErrorHandler onError,
                                            List<Object> path) {
        if (!(inputValue instanceof Map)) {
            onError.onError(path, inputValue, new LocatedError("Expected type '" + type.getName() + "' to be an object."));
            return ValueFromAst.INVALID;
        }
        Map<?, ?> inputMap = (Map<?, ?>) inputValue;
        Map<String, Object> coercedMap = new LinkedHashMap<>();

        for (GraphQLInputObjectField field : type.getFieldDefinitions()) {
            String fieldName = field.getName();
            if (!inputMap.containsKey(fieldName)) {
                if (field.hasSetDefaultValue()) {
                    coercedMap.put(fieldName, defaultValue(field.getInputFieldDefaultValue(), field.getType()));
                } else if (field.getType() instanceof GraphQLNonNull) {
                    onError.onError(path, inputValue, new LocatedError(
                            "Field '" + fieldName + "' of required type '" + GraphQLTypeUtil.simplePrint(field.getType()) + "' was not provided."));
                }
                continue;
            }
            coercedMap.put(fieldName, coerceInputValue(inputMap.get(fieldName), field.getType(), onError, append(path, fieldName)));
        }

        List<String> fieldNames = new ArrayList<>();
        for (GraphQLInputObjectField field : type.getFieldDefinitions()) {
            fieldNames.add(field.getName());
        }
        for (Object key : inputMap.keySet()) {
            String fieldName = String.valueOf(key);
            if (type.getFieldDefinition(fieldName) == null) {
                List<String> suggestions = Suggestions.suggestionList(fieldName, fieldNames);
                onError.onError(path, inputValue, new LocatedError(
                        "Field '" + fieldName + "' is not defined by type '" + type.getName() + "'." + Suggestions.didYouMean(suggestions)));
            }
        }

        if (type.hasAppliedDirective("oneOf")) {
            if (coercedMap.size() != 1) {
                onError.onError(path, inputValue, new LocatedError(
                        "Exactly one key must be specified for OneOf type '" + type.getName() + "'."));
            } else {
                Map.Entry<String, Object> entry = coercedMap.entrySet().iterator().next();
                if (entry.getValue() == null) {
                    onError.onError(append(path, entry.getKey()), null, new LocatedError(
                            "Field '" + entry.getKey() + "' must be non-null."));
                }
            }
        }
        return coercedMap;
    }

    private static Object coerceEnum(Object inputValue, GraphQLEnumType type, InputValueErrorHandler onError, List<Object> path) {
        List<String> valueNames = new ArrayList<>();
        for (GraphQLEnumValueDefinition definition : type.getValues()) {
            valueNames.add(definition.getName());
        }
        if (inputValue instanceof String) {
            GraphQLEnumValueDefinition definition = type.getValue((String) inputValue);
            if (definition != null) {
                return definition.getValue();
            }
            onError.onError(path, inputValue, new LocatedError(
                    "Value '" + inputValue + "' does not exist in '" + type.getName() + "' enum."
                            + Suggestions.didYouMean(Suggestions.suggestionList((String) inputValue, valueNames))));
            return ValueFromAst.INVALID;
        }
        String valueString = Inspector.inspect(inputValue);
        onError.onError(path, inputValue, new LocatedError(
                "Enum '" + type.getName() + "' cannot represent non-string value: " + valueString + "."
                        + Suggestions.didYouMean(Suggestions.suggestionList(valueString, valueNames))));
        return ValueFromAst.INVALID;
    }

    /**
     * The internal value of a default of an argument or input field.
     */
    public static Object defaultValue(InputValueWithState state, GraphQLInputType type) {
        if (state == null || state.isNotSet()) {
            return ValueFromAst.INVALID;
        }
        if (state.isLiteral()) {
            return ValueFromAst.valueFromAst((Value<?>) state.getValue(), type, null);
        }
        if (state.isExternal()) {
            return coerceInputValue(state.getValue(), type);
        }
        return state.getValue();
    }

    public static String printPathList(List<Object> path) {
        StringBuilder sb = new StringBuilder();
        for (Object segment : path) {
            if (segment instanceof Integer) {
                sb.append('[').append(segment).append(']');
            } else {
                sb.append('.').append(segment);
            }
        }
        return sb.toString();
    }

    @SuppressWarnings("unchecked")
    private static List<Object> asList(Object value) {
        if (value instanceof List) {
            return (List<Object>) value;
        }
        if (value instanceof Iterable) {
            List<Object> result = new ArrayList<>();
            for (Object item : (Iterable<Object>) value) {
                result.add(item);
            }
            return result;
        }
        if (value.getClass().isArray()) {
            List<Object> result = new ArrayList<>();
            for (int i = 0; i < Array.getLength(value); i++) {
                result.add(Array.get(value, i));
            }
            return result;
        }
        return null;
    }

    private static List<Object> append(List<Object> path, Object segment) {
        List<Object> result = new ArrayList<>(path);
        result.add(segment);
        return result;
    }
}

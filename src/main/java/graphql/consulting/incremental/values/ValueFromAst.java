package graphql.consulting.incremental.values;

import graphql.GraphQLContext;
import graphql.Internal;
import graphql.execution.CoercedVariables;
import graphql.language.ArrayValue;
import graphql.language.EnumValue;
import graphql.language.NullValue;
import graphql.language.ObjectField;
import graphql.language.ObjectValue;
import graphql.language.Value;
import graphql.language.VariableReference;
import graphql.schema.GraphQLEnumType;
import graphql.schema.GraphQLEnumValueDefinition;
import graphql.schema.GraphQLInputObjectField;
import graphql.schema.GraphQLInputObjectType;
import graphql.schema.GraphQLInputType;
import graphql.schema.GraphQLList;
import graphql.schema.GraphQLNonNull;
import graphql.schema.GraphQLScalarType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Coerces a literal of the document to the internal value of an input type.
 * <p>
 * Never throws for invalid input: {@link #INVALID} is returned instead and the caller decides how
 * severe that is.
 */
@Internal
public final class ValueFromAst {

    public static final Object INVALID = new Object() {
        @Override
        public String toString() {
            return "INVALID";
        }
    };

    private ValueFromAst() {
    }

    public static Object valueFromAst(Value<?> valueNode, GraphQLInputType type, Map<String, Object> variables) {
        if (valueNode == null) {
            // no node at all is different from the value null
            return INVALID;
        }

        if (type instanceof GraphQLNonNull) {
            if (valueNode instanceof NullValue) {
                return INVALID;
            }
            return valueFromAst(valueNode, (GraphQLInputType) ((GraphQLNonNull) type).getWrappedType(), variables);
        }

        if (valueNode instanceof NullValue) {
            return null;
        }

        if (valueNode instanceof VariableReference) {
            String variableName = ((VariableReference) valueNode).getName();
            if (variables == null || !variables.containsKey(variableName)) {
                return INVALID;
            }
            Object variableValue = variables.get(variableName);
            if (variableValue == INVALID) {
                return INVALID;
            }
            // the variable is assumed to be of the right type, validation checks that
            return variableValue;
        }

        if (type instanceof GraphQLList) {
            GraphQLInputType itemType = (GraphQLInputType) ((GraphQLList) type).getWrappedType();
            if (valueNode instanceof ArrayValue) {
                List<Object> coercedValues = new ArrayList<>();
                for (Value<?> itemNode : ((ArrayValue) valueNode).getValues()) {
                    if (isMissingVariable(itemNode, variables)) {
                        if (itemType instanceof GraphQLNonNull) {
                            return INVALID;
                        }
                        coercedValues.add(null);
                    } else {
                        Object itemValue = valueFromAst(itemNode, itemType, variables);
                        if (itemValue == INVALID) {
                            return INVALID;
                        }
                        coercedValues.add(itemValue);
                    }
                }
                return coercedValues;
            }
            Object coercedValue = valueFromAst(valueNode, itemType, variables);
            if (coercedValue == INVALID) {
                return INVALID;
            }
            List<Object> singleton = new ArrayList<>();
            singleton.add(coercedValue);
            return singleton;
        }

        if (type instanceof GraphQLInputObjectType) {
            if (!(valueNode instanceof ObjectValue)) {
                return INVALID;
            }
            GraphQLInputObjectType objectType = (GraphQLInputObjectType) type;
            Map<String, Value<?>> fieldNodes = new LinkedHashMap<>();
            for (ObjectField objectField : ((ObjectValue) valueNode).getObjectFields()) {
                fieldNodes.put(objectField.getName(), objectField.getValue());
            }
            Map<String, Object> coercedObject = new LinkedHashMap<>();
            for (GraphQLInputObjectField field : objectType.getFieldDefinitions()) {
                Value<?> fieldNode = fieldNodes.get(field.getName());
                if (fieldNode == null || isMissingVariable(fieldNode, variables)) {
                    if (field.hasSetDefaultValue()) {
                        coercedObject.put(field.getName(), InputValueCoercer.defaultValue(field.getInputFieldDefaultValue(), field.getType()));
                    } else if (field.getType() instanceof GraphQLNonNull) {
                        return INVALID;
                    }
                    continue;
                }
                Object fieldValue = valueFromAst(fieldNode, field.getType(), variables);
                if (fieldValue == INVALID) {
                    return INVALID;
                }
                coercedObject.put(field.getName(), fieldValue);
            }
            if (objectType.hasAppliedDirective("oneOf")) {
                if (coercedObject.size() != 1 || coercedObject.values().iterator().next() == null) {
                    return INVALID;
                }
            }
            return coercedObject;
        }

        if (type instanceof GraphQLEnumType) {
            if (!(valueNode instanceof EnumValue)) {
                return INVALID;
            }
            GraphQLEnumValueDefinition enumValue = ((GraphQLEnumType) type).getValue(((EnumValue) valueNode).getName());
            if (enumValue == null) {
                return INVALID;
            }
            return enumValue.getValue();
        }

        GraphQLScalarType scalarType = (GraphQLScalarType) type;
        Object result;
        try {
            CoercedVariables coercedVariables = CoercedVariables.of(variables == null ? Collections.<String, Object>emptyMap() : variables);
            result = scalarType.getCoercing().parseLiteral(valueNode, coercedVariables, GraphQLContext.getDefault(), Locale.getDefault());
        } catch (RuntimeException e) {
            return INVALID;
        }
        return result == null ? INVALID : result;
    }

    /**
     * A variable reference to a variable that has no value.
     */
    static boolean isMissingVariable(Value<?> valueNode, Map<String, Object> variables) {
        return valueNode instanceof VariableReference &&
                (variables == null || !variables.containsKey(((VariableReference) valueNode).getName()));
    }
}

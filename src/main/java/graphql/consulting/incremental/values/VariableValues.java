package graphql.consulting.incremental.values;

import graphql.GraphQLError;
import graphql.Internal;
import graphql.consulting.incremental.Inspector;
import graphql.consulting.incremental.LocatedError;
import graphql.language.AstPrinter;
import graphql.language.Node;
import graphql.language.VariableDefinition;
import graphql.schema.GraphQLInputType;
import graphql.schema.GraphQLNonNull;
import graphql.schema.GraphQLSchema;
import graphql.schema.GraphQLType;
import graphql.schema.GraphQLTypeUtil;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

@Internal
public final class VariableValues {

    private VariableValues() {
    }

    /**
     * Coerces the raw variable inputs of a request against the variable definitions of the
     * operation. All problems are collected, up to {@code maxErrors} of them.
     */
    public static CoercedVariableValues coerceVariableValues(GraphQLSchema schema,
                                                             List<VariableDefinition> variableDefinitions,
                                                             Map<String, Object> inputs,
                                                             Integer maxErrors) {
        List<GraphQLError> errors = new ArrayList<>();
        Consumer<GraphQLError> onError = error -> {
            if (maxErrors != null && errors.size() >= maxErrors) {
                throw new LocatedError("Too many errors processing variables, error limit reached. Execution aborted.");
            }
            errors.add(error);
        };
        try {
            Map<String, Object> coerced = coerceVariableValues(schema, variableDefinitions, inputs, onError);
            if (errors.isEmpty()) {
                return CoercedVariableValues.coerced(coerced);
            }
        } catch (LocatedError e) {
            errors.add(e);
        }
        return CoercedVariableValues.errors(errors);
    }

    private static Map<String, Object> coerceVariableValues(GraphQLSchema schema,
                                                            List<VariableDefinition> variableDefinitions,
                                                            Map<String, Object> inputs,
                                                            Consumer<GraphQLError> onError) {
        Map<String, Object> coercedValues = new LinkedHashMap<>();
        for (VariableDefinition variableDefinition : variableDefinitions) {
            String variableName = variableDefinition.getName();
            GraphQLType variableType = TypeFromAst.typeFromAst(schema, variableDefinition.getType());
            if (variableType == null || !(GraphQLTypeUtil.unwrapAll(variableType) instanceof GraphQLInputType)) {
                onError.accept(new LocatedError("Variable '$" + variableName + "' expected value of type '"
                        + AstPrinter.printAst(variableDefinition.getType()) + "' which cannot be used as an input type.",
                        variableDefinition.getType()));
                continue;
            }
            GraphQLInputType inputType = (GraphQLInputType) variableType;

            if (!inputs.containsKey(variableName)) {
                if (variableDefinition.getDefaultValue() != null) {
                    Object defaultValue = ValueFromAst.valueFromAst(variableDefinition.getDefaultValue(), inputType, null);
                    if (defaultValue != ValueFromAst.INVALID) {
                        coercedValues.put(variableName, defaultValue);
                    }
                } else if (inputType instanceof GraphQLNonNull) {
                    onError.accept(new LocatedError("Variable '$" + variableName + "' of required type '"
                            + GraphQLTypeUtil.simplePrint(inputType) + "' was not provided.", variableDefinition));
                }
                continue;
            }

            Object value = inputs.get(variableName);
            if (value == null && inputType instanceof GraphQLNonNull) {
                onError.accept(new LocatedError("Variable '$" + variableName + "' of non-null type '"
                        + GraphQLTypeUtil.simplePrint(inputType) + "' must not be null.", variableDefinition));
                continue;
            }

            InputValueErrorHandler onInputValueError = (path, invalidValue, error) -> {
                String prefix = "Variable '$" + variableName + "' got invalid value " + Inspector.inspect(invalidValue);
                if (!path.isEmpty()) {
                    prefix += " at '" + variableName + InputValueCoercer.printPathList(path) + "'";
                }
                onError.accept(new LocatedError(prefix + "; " + error.getMessage(),
                        Collections.<Node>singletonList(variableDefinition), null,
                        error instanceof Throwable ? (Throwable) error : null, null));
            };
            coercedValues.put(variableName, InputValueCoercer.coerceInputValue(value, inputType, onInputValueError));
        }
        return coercedValues;
    }
}

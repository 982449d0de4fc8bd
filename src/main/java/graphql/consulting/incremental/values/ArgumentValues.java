package graphql.consulting.incremental.values;

import graphql.Internal;
import graphql.consulting.incremental.LocatedError;
import graphql.language.Argument;
import graphql.language.AstPrinter;
import graphql.language.Directive;
import graphql.language.Node;
import graphql.language.NullValue;
import graphql.language.Value;
import graphql.language.VariableReference;
import graphql.schema.GraphQLArgument;
import graphql.schema.GraphQLDirective;
import graphql.schema.GraphQLInputType;
import graphql.schema.GraphQLNonNull;
import graphql.schema.GraphQLTypeUtil;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Internal
public final class ArgumentValues {

    private ArgumentValues() {
    }

    /**
     * Coerces the arguments given on a field or directive node. Unlike variable coercion this
     * fails on the first invalid argument.
     *
     * @param outNames internal names for arguments, may be null
     */
    public static Map<String, Object> coerceArgumentValues(List<GraphQLArgument> argumentDefinitions,
                                                           List<Argument> argumentNodes,
                                                           Node<?> node,
                                                           Map<String, Object> variableValues,
                                                           Map<String, String> outNames) {
        Map<String, Object> coercedValues = new LinkedHashMap<>();
        Map<String, Argument> argumentNodeMap = new LinkedHashMap<>();
        for (Argument argument : argumentNodes) {
            argumentNodeMap.put(argument.getName(), argument);
        }

        for (GraphQLArgument argumentDefinition : argumentDefinitions) {
            String name = argumentDefinition.getName();
            String outName = outNames != null && outNames.containsKey(name) ? outNames.get(name) : name;
            GraphQLInputType argumentType = argumentDefinition.getType();
            Argument argumentNode = argumentNodeMap.get(name);

            if (argumentNode == null) {
                if (argumentDefinition.hasSetDefaultValue()) {
                    coercedValues.put(outName, InputValueCoercer.defaultValue(argumentDefinition.getArgumentDefaultValue(), argumentType));
                } else if (argumentType instanceof GraphQLNonNull) {
                    throw new LocatedError("Argument '" + name + "' of required type '"
                            + GraphQLTypeUtil.simplePrint(argumentType) + "' was not provided.", node);
                }
                continue;
            }

            Value<?> valueNode = argumentNode.getValue();
            boolean isNull = valueNode instanceof NullValue;

            if (valueNode instanceof VariableReference) {
                String variableName = ((VariableReference) valueNode).getName();
                if (variableValues == null || !variableValues.containsKey(variableName)) {
                    if (argumentDefinition.hasSetDefaultValue()) {
                        coercedValues.put(outName, InputValueCoercer.defaultValue(argumentDefinition.getArgumentDefaultValue(), argumentType));
                    } else if (argumentType instanceof GraphQLNonNull) {
                        throw new LocatedError("Argument '" + name + "' of required type '"
                                + GraphQLTypeUtil.simplePrint(argumentType) + "' was provided the variable '$"
                                + variableName + "' which was not provided a runtime value.", valueNode);
                    }
                    continue;
                }
                isNull = variableValues.get(variableName) == null;
            }

            if (isNull && argumentType instanceof GraphQLNonNull) {
                throw new LocatedError("Argument '" + name + "' of non-null type '"
                        + GraphQLTypeUtil.simplePrint(argumentType) + "' must not be null.", valueNode);
            }

            Object coercedValue = ValueFromAst.valueFromAst(valueNode, argumentType, variableValues);
            if (coercedValue == ValueFromAst.INVALID) {
                throw new LocatedError("Argument '" + name + "' has invalid value " + AstPrinter.printAst(valueNode) + ".", valueNode);
            }
            coercedValues.put(outName, coercedValue);
        }
        return coercedValues;
    }

    /**
     * The coerced arguments of the first application of {@code directiveDefinition} among the given
     * directives, or null if the directive is not applied.
     */
    public static Map<String, Object> getDirectiveValues(GraphQLDirective directiveDefinition,
                                                         List<Directive> directives,
                                                         Map<String, Object> variableValues) {
        if (directives == null) {
            return null;
        }
        for (Directive directive : directives) {
            if (directive.getName().equals(directiveDefinition.getName())) {
                return coerceArgumentValues(directiveDefinition.getArguments(), directive.getArguments(), directive, variableValues, null);
            }
        }
        return null;
    }
}

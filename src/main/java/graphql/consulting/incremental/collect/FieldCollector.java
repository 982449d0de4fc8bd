package graphql.consulting.incremental.collect;

import graphql.Directives;
import graphql.Internal;
import graphql.consulting.incremental.LocatedError;
import graphql.consulting.incremental.values.ArgumentValues;
import graphql.language.Directive;
import graphql.language.Field;
import graphql.language.FragmentDefinition;
import graphql.language.FragmentSpread;
import graphql.language.InlineFragment;
import graphql.language.Node;
import graphql.language.OperationDefinition;
import graphql.language.Selection;
import graphql.language.SelectionSet;
import graphql.language.TypeName;
import graphql.schema.GraphQLInterfaceType;
import graphql.schema.GraphQLNamedType;
import graphql.schema.GraphQLObjectType;
import graphql.schema.GraphQLUnionType;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Iterates over selection sets and builds the grouped field set of a concrete object type,
 * expanding named and inline fragments and tagging every field with the defer usage it was
 * selected under.
 */
@Internal
public class FieldCollector {

    /**
     * Collects the fields of the operation's root selection set.
     */
    public CollectedFields collectFields(FieldCollectorParameters parameters, OperationDefinition operationDefinition) {
        Map<String, List<FieldDetails>> fields = new LinkedHashMap<>();
        List<DeferUsage> newDeferUsages = new ArrayList<>();
        collectFields(parameters, operationDefinition.getSelectionSet(), new HashSet<>(), fields, newDeferUsages, null);
        return toCollectedFields(fields, newDeferUsages);
    }

    /**
     * Collects the sub fields of all nodes of a field group. Each node keeps the defer usage it was
     * collected under.
     */
    public CollectedFields collectSubfields(FieldCollectorParameters parameters, FieldGroup fieldGroup) {
        Map<String, List<FieldDetails>> fields = new LinkedHashMap<>();
        List<DeferUsage> newDeferUsages = new ArrayList<>();
        Set<String> visitedFragments = new HashSet<>();
        for (FieldDetails fieldDetails : fieldGroup.getFields()) {
            SelectionSet selectionSet = fieldDetails.getField().getSelectionSet();
            if (selectionSet == null) {
                continue;
            }
            collectFields(parameters, selectionSet, visitedFragments, fields, newDeferUsages, fieldDetails.getDeferUsage());
        }
        return toCollectedFields(fields, newDeferUsages);
    }

    private CollectedFields toCollectedFields(Map<String, List<FieldDetails>> fields, List<DeferUsage> newDeferUsages) {
        Map<String, FieldGroup> fieldGroups = new LinkedHashMap<>();
        for (Map.Entry<String, List<FieldDetails>> entry : fields.entrySet()) {
            fieldGroups.put(entry.getKey(), new FieldGroup(entry.getValue()));
        }
        return new CollectedFields(new GroupedFieldSet(fieldGroups), newDeferUsages);
    }

    private void collectFields(FieldCollectorParameters parameters,
                               SelectionSet selectionSet,
                               Set<String> visitedFragments,
                               Map<String, List<FieldDetails>> fields,
                               List<DeferUsage> newDeferUsages,
                               DeferUsage deferUsage) {
        for (Selection<?> selection : selectionSet.getSelections()) {
            if (selection instanceof Field) {
                collectField(parameters, fields, (Field) selection, deferUsage);
            } else if (selection instanceof InlineFragment) {
                collectInlineFragment(parameters, visitedFragments, fields, newDeferUsages, (InlineFragment) selection, deferUsage);
            } else if (selection instanceof FragmentSpread) {
                collectFragmentSpread(parameters, visitedFragments, fields, newDeferUsages, (FragmentSpread) selection, deferUsage);
            }
        }
    }

    private void collectField(FieldCollectorParameters parameters, Map<String, List<FieldDetails>> fields, Field field, DeferUsage deferUsage) {
        if (!shouldInclude(parameters, field.getDirectives())) {
            return;
        }
        String name = getFieldEntryKey(field);
        List<FieldDetails> fieldList = fields.get(name);
        if (fieldList == null) {
            fieldList = new ArrayList<>();
            fields.put(name, fieldList);
        }
        fieldList.add(new FieldDetails(field, deferUsage));
    }

    private void collectInlineFragment(FieldCollectorParameters parameters,
                                       Set<String> visitedFragments,
                                       Map<String, List<FieldDetails>> fields,
                                       List<DeferUsage> newDeferUsages,
                                       InlineFragment inlineFragment,
                                       DeferUsage deferUsage) {
        if (!shouldInclude(parameters, inlineFragment.getDirectives())
                || !doesFragmentConditionMatch(parameters, inlineFragment.getTypeCondition())) {
            return;
        }
        DeferUsage newDeferUsage = getDeferUsage(parameters, inlineFragment, inlineFragment.getDirectives(), deferUsage);
        if (newDeferUsage == null) {
            collectFields(parameters, inlineFragment.getSelectionSet(), visitedFragments, fields, newDeferUsages, deferUsage);
        } else {
            newDeferUsages.add(newDeferUsage);
            collectFields(parameters, inlineFragment.getSelectionSet(), visitedFragments, fields, newDeferUsages, newDeferUsage);
        }
    }

    private void collectFragmentSpread(FieldCollectorParameters parameters,
                                       Set<String> visitedFragments,
                                       Map<String, List<FieldDetails>> fields,
                                       List<DeferUsage> newDeferUsages,
                                       FragmentSpread fragmentSpread,
                                       DeferUsage deferUsage) {
        String fragmentName = fragmentSpread.getName();
        if (!shouldInclude(parameters, fragmentSpread.getDirectives())) {
            return;
        }
        DeferUsage newDeferUsage = getDeferUsage(parameters, fragmentSpread, fragmentSpread.getDirectives(), deferUsage);
        // a fragment spread again under a new defer is expanded again for that defer
        if (newDeferUsage == null && visitedFragments.contains(fragmentName)) {
            return;
        }
        FragmentDefinition fragmentDefinition = parameters.getFragmentsByName().get(fragmentName);
        if (fragmentDefinition == null || !doesFragmentConditionMatch(parameters, fragmentDefinition.getTypeCondition())) {
            return;
        }
        if (newDeferUsage == null) {
            visitedFragments.add(fragmentName);
            collectFields(parameters, fragmentDefinition.getSelectionSet(), visitedFragments, fields, newDeferUsages, deferUsage);
        } else {
            newDeferUsages.add(newDeferUsage);
            collectFields(parameters, fragmentDefinition.getSelectionSet(), visitedFragments, fields, newDeferUsages, newDeferUsage);
        }
    }

    /**
     * A new defer usage if the fragment carries an enabled {@code @defer}, otherwise null.
     */
    private DeferUsage getDeferUsage(FieldCollectorParameters parameters, Node<?> node, List<Directive> directives, DeferUsage parentDeferUsage) {
        if (!parameters.isIncrementalDelivery()) {
            return null;
        }
        Map<String, Object> defer = ArgumentValues.getDirectiveValues(IncrementalDirectives.DeferDirective, directives, parameters.getVariables());
        if (defer == null || Boolean.FALSE.equals(defer.get("if"))) {
            return null;
        }
        if (parameters.getOperation() == OperationDefinition.Operation.SUBSCRIPTION) {
            throw new LocatedError("`@defer` directive not supported on subscription operations."
                    + " Disable `@defer` by setting the `if` argument to `false`.", node);
        }
        return new DeferUsage((String) defer.get("label"), parentDeferUsage);
    }

    private boolean shouldInclude(FieldCollectorParameters parameters, List<Directive> directives) {
        Map<String, Object> skip = ArgumentValues.getDirectiveValues(Directives.SkipDirective, directives, parameters.getVariables());
        if (skip != null && Boolean.TRUE.equals(skip.get("if"))) {
            return false;
        }
        Map<String, Object> include = ArgumentValues.getDirectiveValues(Directives.IncludeDirective, directives, parameters.getVariables());
        return include == null || !Boolean.FALSE.equals(include.get("if"));
    }

    private boolean doesFragmentConditionMatch(FieldCollectorParameters parameters, TypeName typeCondition) {
        if (typeCondition == null) {
            return true;
        }
        GraphQLNamedType conditionType = (GraphQLNamedType) parameters.getGraphQLSchema().getType(typeCondition.getName());
        GraphQLObjectType type = parameters.getObjectType();
        if (conditionType == null) {
            return false;
        }
        if (conditionType.getName().equals(type.getName())) {
            return true;
        }
        if (conditionType instanceof GraphQLInterfaceType || conditionType instanceof GraphQLUnionType) {
            return parameters.getGraphQLSchema().isPossibleType(conditionType, type);
        }
        return false;
    }

    private String getFieldEntryKey(Field field) {
        if (field.getAlias() != null) {
            return field.getAlias();
        } else {
            return field.getName();
        }
    }
}

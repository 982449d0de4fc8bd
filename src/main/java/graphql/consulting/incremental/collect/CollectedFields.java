package graphql.consulting.incremental.collect;

import graphql.Internal;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The result of collecting one selection set: the grouped fields and the defer usages created
 * while collecting them. Field plans derived from it are cached per parent defer usage set.
 */
@Internal
public class CollectedFields {

    private final GroupedFieldSet groupedFieldSet;
    private final List<DeferUsage> newDeferUsages;
    private final ConcurrentHashMap<Set<DeferUsage>, FieldPlan> fieldPlans = new ConcurrentHashMap<>();

    public CollectedFields(GroupedFieldSet groupedFieldSet, List<DeferUsage> newDeferUsages) {
        this.groupedFieldSet = groupedFieldSet;
        this.newDeferUsages = Collections.unmodifiableList(newDeferUsages);
    }

    public GroupedFieldSet getGroupedFieldSet() {
        return groupedFieldSet;
    }

    public List<DeferUsage> getNewDeferUsages() {
        return newDeferUsages;
    }

    public FieldPlan getFieldPlan(FieldPlanBuilder fieldPlanBuilder, Set<DeferUsage> parentDeferUsages) {
        Set<DeferUsage> key = parentDeferUsages == null ? Collections.<DeferUsage>emptySet() : parentDeferUsages;
        return fieldPlans.computeIfAbsent(key, k -> fieldPlanBuilder.buildFieldPlan(groupedFieldSet, k));
    }
}

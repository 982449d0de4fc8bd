package graphql.consulting.incremental.collect;

import graphql.Internal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Partitions a grouped field set into the fields to execute now and buckets keyed by the defer
 * usages that gate them.
 */
@Internal
public class FieldPlanBuilder {

    public FieldPlan buildFieldPlan(GroupedFieldSet originalGroupedFieldSet) {
        return buildFieldPlan(originalGroupedFieldSet, Collections.<DeferUsage>emptySet());
    }

    public FieldPlan buildFieldPlan(GroupedFieldSet originalGroupedFieldSet, Set<DeferUsage> parentDeferUsages) {
        Set<DeferUsage> parent = parentDeferUsages == null ? Collections.<DeferUsage>emptySet() : parentDeferUsages;
        Map<String, FieldGroup> immediate = new LinkedHashMap<>();
        Map<Set<DeferUsage>, Map<String, FieldGroup>> buckets = new LinkedHashMap<>();

        for (Map.Entry<String, FieldGroup> entry : originalGroupedFieldSet.entrySet()) {
            Set<DeferUsage> deferUsageSet = bucketKey(entry.getValue());
            if (deferUsageSet.equals(parent)) {
                immediate.put(entry.getKey(), entry.getValue());
                continue;
            }
            Map<String, FieldGroup> bucket = buckets.get(deferUsageSet);
            if (bucket == null) {
                bucket = new LinkedHashMap<>();
                buckets.put(deferUsageSet, bucket);
            }
            bucket.put(entry.getKey(), entry.getValue());
        }

        Map<Set<DeferUsage>, GroupedFieldSet> newGroupedFieldSets = new LinkedHashMap<>();
        for (Map.Entry<Set<DeferUsage>, Map<String, FieldGroup>> bucket : buckets.entrySet()) {
            newGroupedFieldSets.put(bucket.getKey(), new GroupedFieldSet(bucket.getValue()));
        }
        return new FieldPlan(new GroupedFieldSet(immediate), newGroupedFieldSets);
    }

    /**
     * Empty when any occurrence is not deferred; otherwise the ancestor-reduced defer usages of
     * the occurrences, closed over their ancestors.
     */
    private Set<DeferUsage> bucketKey(FieldGroup fieldGroup) {
        Set<DeferUsage> deferUsages = new LinkedHashSet<>();
        for (FieldDetails fieldDetails : fieldGroup.getFields()) {
            if (fieldDetails.getDeferUsage() == null) {
                return Collections.emptySet();
            }
            deferUsages.add(fieldDetails.getDeferUsage());
        }

        List<DeferUsage> reduced = new ArrayList<>();
        for (DeferUsage deferUsage : deferUsages) {
            if (!hasAncestorIn(deferUsage, deferUsages)) {
                reduced.add(deferUsage);
            }
        }

        Set<DeferUsage> key = new LinkedHashSet<>();
        for (DeferUsage deferUsage : reduced) {
            key.addAll(deferUsage.getAncestors());
            key.add(deferUsage);
        }
        return key;
    }

    private boolean hasAncestorIn(DeferUsage deferUsage, Set<DeferUsage> deferUsages) {
        for (DeferUsage ancestor : deferUsage.getAncestors()) {
            if (deferUsages.contains(ancestor)) {
                return true;
            }
        }
        return false;
    }
}

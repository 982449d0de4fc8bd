package graphql.consulting.incremental.collect;

import graphql.Internal;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * The fields of one selection set split into those executed now and buckets of deferred fields.
 * A bucket key contains the defer usages gating the bucket together with all their ancestors.
 */
@Internal
public class FieldPlan {

    private final GroupedFieldSet groupedFieldSet;
    private final Map<Set<DeferUsage>, GroupedFieldSet> newGroupedFieldSets;

    public FieldPlan(GroupedFieldSet groupedFieldSet, Map<Set<DeferUsage>, GroupedFieldSet> newGroupedFieldSets) {
        this.groupedFieldSet = groupedFieldSet;
        this.newGroupedFieldSets = Collections.unmodifiableMap(new LinkedHashMap<>(newGroupedFieldSets));
    }

    public GroupedFieldSet getGroupedFieldSet() {
        return groupedFieldSet;
    }

    public Map<Set<DeferUsage>, GroupedFieldSet> getNewGroupedFieldSets() {
        return newGroupedFieldSets;
    }

    /**
     * The members of a bucket key that are not an ancestor of another member: the fragments a
     * bucket's result reports to.
     */
    public static Set<DeferUsage> gatingDeferUsages(Set<DeferUsage> deferUsageSet) {
        Set<DeferUsage> ancestors = new LinkedHashSet<>();
        for (DeferUsage deferUsage : deferUsageSet) {
            ancestors.addAll(deferUsage.getAncestors());
        }
        Set<DeferUsage> result = new LinkedHashSet<>();
        for (DeferUsage deferUsage : deferUsageSet) {
            if (!ancestors.contains(deferUsage)) {
                result.add(deferUsage);
            }
        }
        return result;
    }

    /**
     * Whether executing a bucket starts at least one defer that is not already in effect.
     */
    public static boolean shouldInitiateDefer(Set<DeferUsage> parentDeferUsages, Set<DeferUsage> deferUsageSet) {
        for (DeferUsage deferUsage : deferUsageSet) {
            if (parentDeferUsages == null || !parentDeferUsages.contains(deferUsage)) {
                return true;
            }
        }
        return false;
    }
}

package graphql.consulting.incremental.collect;

import graphql.Internal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One application of {@code @defer} in the document, linked to the defer application enclosing
 * it. Compared by identity: two applications with the same label are still distinct.
 */
@Internal
public class DeferUsage {

    private final String label;
    private final DeferUsage parentDeferUsage;

    public DeferUsage(String label, DeferUsage parentDeferUsage) {
        this.label = label;
        this.parentDeferUsage = parentDeferUsage;
    }

    public String getLabel() {
        return label;
    }

    public DeferUsage getParentDeferUsage() {
        return parentDeferUsage;
    }

    /**
     * The enclosing defer usages, outermost first.
     */
    public List<DeferUsage> getAncestors() {
        List<DeferUsage> ancestors = new ArrayList<>();
        DeferUsage current = parentDeferUsage;
        while (current != null) {
            ancestors.add(current);
            current = current.parentDeferUsage;
        }
        Collections.reverse(ancestors);
        return ancestors;
    }

    @Override
    public String toString() {
        return "DeferUsage{" +
                "label='" + label + '\'' +
                '}';
    }
}

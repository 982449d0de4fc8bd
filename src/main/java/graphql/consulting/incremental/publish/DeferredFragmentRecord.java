package graphql.consulting.incremental.publish;

import graphql.Internal;
import graphql.execution.ResultPath;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Runtime state of one {@code @defer} application at one path. Released once every grouped field
 * set result it expects has been reconciled. Guarded by the owning {@link IncrementalGraph}.
 */
@Internal
public class DeferredFragmentRecord extends SubsequentResultRecord {

    private final DeferredFragmentRecord parent;
    private int expectedReconcilableResults;
    private final List<DeferredGroupedFieldSetResult> results = new ArrayList<>();
    private final List<ReconcilableDeferredGroupedFieldSetResult> reconcilableResults = new ArrayList<>();
    private final Set<DeferredFragmentRecord> children = new LinkedHashSet<>();

    public DeferredFragmentRecord(ResultPath path, String label, DeferredFragmentRecord parent) {
        super(path, label);
        this.parent = parent;
    }

    public DeferredFragmentRecord getParent() {
        return parent;
    }

    public int getExpectedReconcilableResults() {
        return expectedReconcilableResults;
    }

    void incrementExpectedReconcilableResults() {
        expectedReconcilableResults++;
    }

    List<DeferredGroupedFieldSetResult> getResults() {
        return results;
    }

    List<ReconcilableDeferredGroupedFieldSetResult> getReconcilableResults() {
        return reconcilableResults;
    }

    Set<DeferredFragmentRecord> getChildren() {
        return children;
    }
}

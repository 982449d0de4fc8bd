package graphql.consulting.incremental.publish;

import graphql.Internal;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * The execution of one deferred grouped field set, reporting to one or more deferred fragments.
 */
@Internal
public class DeferredGroupedFieldSetRecord implements IncrementalDataRecord {

    private final List<DeferredFragmentRecord> deferredFragmentRecords;
    private volatile CompletableFuture<DeferredGroupedFieldSetResult> result;

    public DeferredGroupedFieldSetRecord(List<DeferredFragmentRecord> deferredFragmentRecords) {
        this.deferredFragmentRecords = Collections.unmodifiableList(deferredFragmentRecords);
    }

    public List<DeferredFragmentRecord> getDeferredFragmentRecords() {
        return deferredFragmentRecords;
    }

    public CompletableFuture<DeferredGroupedFieldSetResult> getResult() {
        return result;
    }

    public void setResult(CompletableFuture<DeferredGroupedFieldSetResult> result) {
        this.result = result;
    }
}

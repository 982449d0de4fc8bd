package graphql.consulting.incremental.publish;

import graphql.Internal;

import java.util.List;

@Internal
public abstract class DeferredGroupedFieldSetResult implements IncrementalDataRecordResult {

    private final List<DeferredFragmentRecord> deferredFragmentRecords;
    private final List<Object> path;

    protected DeferredGroupedFieldSetResult(List<DeferredFragmentRecord> deferredFragmentRecords, List<Object> path) {
        this.deferredFragmentRecords = deferredFragmentRecords;
        this.path = path;
    }

    public List<DeferredFragmentRecord> getDeferredFragmentRecords() {
        return deferredFragmentRecords;
    }

    public List<Object> getPath() {
        return path;
    }
}

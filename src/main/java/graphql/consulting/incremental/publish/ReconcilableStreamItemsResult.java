package graphql.consulting.incremental.publish;

import graphql.GraphQLError;
import graphql.Internal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Internal
public class ReconcilableStreamItemsResult extends StreamItemsResult {

    private final List<Object> items;
    private final List<GraphQLError> errors;
    private final List<IncrementalDataRecord> incrementalDataRecords;

    public ReconcilableStreamItemsResult(StreamRecord streamRecord,
                                         List<Object> items,
                                         List<GraphQLError> errors,
                                         List<IncrementalDataRecord> incrementalDataRecords) {
        super(streamRecord);
        this.items = items;
        this.errors = errors == null || errors.isEmpty() ? null : errors;
        this.incrementalDataRecords = incrementalDataRecords == null ? Collections.<IncrementalDataRecord>emptyList() : incrementalDataRecords;
    }

    public List<Object> getItems() {
        return items;
    }

    /**
     * @return the field errors, or null if there were none
     */
    public List<GraphQLError> getErrors() {
        return errors;
    }

    public List<IncrementalDataRecord> getIncrementalDataRecords() {
        return incrementalDataRecords;
    }

    /**
     * A copy that also carries the next stream items, ahead of the records found in these items.
     */
    public ReconcilableStreamItemsResult prependIncrementalDataRecord(IncrementalDataRecord next) {
        List<IncrementalDataRecord> records = new ArrayList<>(incrementalDataRecords.size() + 1);
        records.add(next);
        records.addAll(incrementalDataRecords);
        return new ReconcilableStreamItemsResult(getStreamRecord(), items, errors, records);
    }
}

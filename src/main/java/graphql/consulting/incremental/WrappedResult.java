package graphql.consulting.incremental;

import graphql.Internal;
import graphql.consulting.incremental.publish.IncrementalDataRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A completed value together with the incremental work discovered while completing it. Records
 * travel with the value, so a value nulled by an error drops its records too.
 */
@Internal
public class WrappedResult {

    private static final WrappedResult NULL = new WrappedResult(null, Collections.<IncrementalDataRecord>emptyList());

    private final Object value;
    private final List<IncrementalDataRecord> incrementalDataRecords;

    private WrappedResult(Object value, List<IncrementalDataRecord> incrementalDataRecords) {
        this.value = value;
        this.incrementalDataRecords = incrementalDataRecords;
    }

    public static WrappedResult nullValue() {
        return NULL;
    }

    public static WrappedResult of(Object value) {
        return value == null ? NULL : new WrappedResult(value, Collections.<IncrementalDataRecord>emptyList());
    }

    public static WrappedResult of(Object value, List<IncrementalDataRecord> incrementalDataRecords) {
        if (incrementalDataRecords == null || incrementalDataRecords.isEmpty()) {
            return of(value);
        }
        return new WrappedResult(value, Collections.unmodifiableList(new ArrayList<>(incrementalDataRecords)));
    }

    @SuppressWarnings("unchecked")
    public <T> T getValue() {
        return (T) value;
    }

    public List<IncrementalDataRecord> getIncrementalDataRecords() {
        return incrementalDataRecords;
    }

    public WrappedResult withIncrementalDataRecords(List<IncrementalDataRecord> additional) {
        if (additional.isEmpty()) {
            return this;
        }
        List<IncrementalDataRecord> records = new ArrayList<>(incrementalDataRecords);
        records.addAll(additional);
        return new WrappedResult(value, records);
    }
}

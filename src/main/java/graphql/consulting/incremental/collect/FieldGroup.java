package graphql.consulting.incremental.collect;

import graphql.Internal;
import graphql.language.Field;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * All field nodes sharing one response key. Instances are used as identity keys for per-request
 * caches.
 */
@Internal
public class FieldGroup {

    private final List<FieldDetails> fields;

    public FieldGroup(List<FieldDetails> fields) {
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
    }

    public List<FieldDetails> getFields() {
        return fields;
    }

    public Field getFirstField() {
        return fields.get(0).getField();
    }

    public List<Field> toNodes() {
        List<Field> nodes = new ArrayList<>(fields.size());
        for (FieldDetails fieldDetails : fields) {
            nodes.add(fieldDetails.getField());
        }
        return nodes;
    }

    /**
     * The same nodes, none of them deferred. Streamed items are executed this way.
     */
    public FieldGroup withoutDeferUsages() {
        List<FieldDetails> result = new ArrayList<>(fields.size());
        for (FieldDetails fieldDetails : fields) {
            result.add(new FieldDetails(fieldDetails.getField(), null));
        }
        return new FieldGroup(result);
    }
}

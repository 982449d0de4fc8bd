package graphql.consulting.incremental;

import graphql.Internal;
import graphql.consulting.incremental.collect.FieldGroup;

/**
 * An enabled {@code @stream} on a list field. Streamed items are completed with
 * {@link #getFieldGroup()}, whose nodes carry no defer usages.
 */
@Internal
public class StreamUsage {

    private final String label;
    private final int initialCount;
    private final FieldGroup fieldGroup;

    public StreamUsage(String label, int initialCount, FieldGroup fieldGroup) {
        this.label = label;
        this.initialCount = initialCount;
        this.fieldGroup = fieldGroup;
    }

    public String getLabel() {
        return label;
    }

    public int getInitialCount() {
        return initialCount;
    }

    public FieldGroup getFieldGroup() {
        return fieldGroup;
    }
}

package graphql.consulting.incremental.collect;

import graphql.Internal;
import graphql.language.Field;

/**
 * A field node together with the defer usage it was collected under, null when not deferred.
 */
@Internal
public class FieldDetails {

    private final Field field;
    private final DeferUsage deferUsage;

    public FieldDetails(Field field, DeferUsage deferUsage) {
        this.field = field;
        this.deferUsage = deferUsage;
    }

    public Field getField() {
        return field;
    }

    public DeferUsage getDeferUsage() {
        return deferUsage;
    }
}

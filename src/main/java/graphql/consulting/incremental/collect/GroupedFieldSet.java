package graphql.consulting.incremental.collect;

import graphql.Internal;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Response keys mapped to their field groups, in the order the keys first appear in the document.
 */
@Internal
public class GroupedFieldSet {

    private final Map<String, FieldGroup> fieldGroups;

    public GroupedFieldSet(Map<String, FieldGroup> fieldGroups) {
        this.fieldGroups = Collections.unmodifiableMap(new LinkedHashMap<>(fieldGroups));
    }

    public FieldGroup get(String responseKey) {
        return fieldGroups.get(responseKey);
    }

    public Set<String> getResponseKeys() {
        return fieldGroups.keySet();
    }

    public Set<Map.Entry<String, FieldGroup>> entrySet() {
        return fieldGroups.entrySet();
    }

    public int size() {
        return fieldGroups.size();
    }

    public boolean isEmpty() {
        return fieldGroups.isEmpty();
    }

    @Override
    public String toString() {
        return "GroupedFieldSet" + fieldGroups.keySet();
    }
}

package graphql.consulting.incremental.result;

import graphql.PublicApi;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Announces a deferred fragment or a stream the client should expect more data for.
 */
@PublicApi
public class PendingResult {

    private final String id;
    private final List<Object> path;
    private final String label;

    public PendingResult(String id, List<Object> path, String label) {
        this.id = id;
        this.path = path;
        this.label = label;
    }

    public String getId() {
        return id;
    }

    public List<Object> getPath() {
        return path;
    }

    public String getLabel() {
        return label;
    }

    public Map<String, Object> toSpecification() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("id", id);
        result.put("path", path);
        if (label != null) {
            result.put("label", label);
        }
        return result;
    }

    @Override
    public String toString() {
        return "PendingResult" + toSpecification();
    }
}

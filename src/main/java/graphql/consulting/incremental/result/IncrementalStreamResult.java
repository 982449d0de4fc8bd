package graphql.consulting.incremental.result;

import graphql.GraphQLError;
import graphql.PublicApi;

import java.util.List;
import java.util.Map;

@PublicApi
public class IncrementalStreamResult extends IncrementalResult {

    private final List<Object> items;

    public IncrementalStreamResult(String id, List<Object> items, List<GraphQLError> errors) {
        super(id, null, errors);
        this.items = items;
    }

    public List<Object> getItems() {
        return items;
    }

    @Override
    protected void putPayload(Map<String, Object> result) {
        result.put("items", items);
    }
}

package graphql.consulting.incremental.result;

import graphql.GraphQLError;
import graphql.PublicApi;

import java.util.List;
import java.util.Map;

@PublicApi
public class IncrementalDeferResult extends IncrementalResult {

    private final Map<String, Object> data;

    public IncrementalDeferResult(String id, List<Object> subPath, Map<String, Object> data, List<GraphQLError> errors) {
        super(id, subPath, errors);
        this.data = data;
    }

    public Map<String, Object> getData() {
        return data;
    }

    @Override
    protected void putPayload(Map<String, Object> result) {
        result.put("data", data);
    }
}

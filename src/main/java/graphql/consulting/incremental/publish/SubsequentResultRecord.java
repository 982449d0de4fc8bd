package graphql.consulting.incremental.publish;

import graphql.Internal;
import graphql.execution.ResultPath;

import java.util.Collections;
import java.util.List;

/**
 * Something announced as pending to the client: a deferred fragment or a stream. The id is
 * assigned when the record is first announced.
 */
@Internal
public abstract class SubsequentResultRecord {

    private final ResultPath path;
    private final String label;
    private volatile String id;

    protected SubsequentResultRecord(ResultPath path, String label) {
        this.path = path;
        this.label = label;
    }

    public ResultPath getPath() {
        return path;
    }

    public List<Object> getPathList() {
        return path == null ? Collections.emptyList() : path.toList();
    }

    public String getLabel() {
        return label;
    }

    public String getId() {
        return id;
    }

    void setId(String id) {
        this.id = id;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "path=" + path +
                ", label='" + label + '\'' +
                ", id='" + id + '\'' +
                '}';
    }
}

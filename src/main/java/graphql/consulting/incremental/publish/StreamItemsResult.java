package graphql.consulting.incremental.publish;

import graphql.Internal;

@Internal
public abstract class StreamItemsResult implements IncrementalDataRecordResult {

    private final StreamRecord streamRecord;

    protected StreamItemsResult(StreamRecord streamRecord) {
        this.streamRecord = streamRecord;
    }

    public StreamRecord getStreamRecord() {
        return streamRecord;
    }
}

package graphql.consulting.incremental.publish;

import graphql.Internal;

import java.util.concurrent.CompletableFuture;

/**
 * The completion of the next streamed items. The result may be replaced while stream items are
 * chained behind it.
 */
@Internal
public class StreamItemsRecord implements IncrementalDataRecord {

    private final StreamRecord streamRecord;
    private volatile CompletableFuture<StreamItemsResult> result;

    public StreamItemsRecord(StreamRecord streamRecord, CompletableFuture<StreamItemsResult> result) {
        this.streamRecord = streamRecord;
        this.result = result;
    }

    public StreamRecord getStreamRecord() {
        return streamRecord;
    }

    public CompletableFuture<StreamItemsResult> getResult() {
        return result;
    }

    public void setResult(CompletableFuture<StreamItemsResult> result) {
        this.result = result;
    }
}

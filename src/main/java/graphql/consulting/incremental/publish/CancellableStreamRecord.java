package graphql.consulting.incremental.publish;

import graphql.Internal;
import graphql.execution.ResultPath;
import reactor.core.publisher.Mono;

import java.util.function.Supplier;

/**
 * A stream fed by an asynchronous source that has to be released when the client stops listening
 * or the stream fails.
 */
@Internal
public class CancellableStreamRecord extends StreamRecord {

    private final Supplier<Mono<Void>> earlyReturn;

    public CancellableStreamRecord(ResultPath path, String label, Supplier<Mono<Void>> earlyReturn) {
        super(path, label);
        this.earlyReturn = earlyReturn;
    }

    public Mono<Void> earlyReturn() {
        return Mono.defer(earlyReturn);
    }
}

package graphql.consulting.incremental;

import graphql.Internal;
import org.reactivestreams.Publisher;
import org.reactivestreams.Subscription;
import reactor.core.publisher.BaseSubscriber;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Pulls the items of a {@link Publisher} one at a time.
 * <p>
 * {@link #next()} requests exactly one item and completes empty once the source is exhausted or
 * cancelled. Cancelling via {@link #earlyReturn()} releases the upstream resources.
 */
@Internal
public class PublisherIterator extends BaseSubscriber<Object> {

    private final Publisher<?> source;
    private boolean subscribed;
    private boolean done;
    private Throwable error;
    private Sinks.One<Object> waiting;

    public PublisherIterator(Publisher<?> source) {
        this.source = source;
    }

    public Mono<Object> next() {
        return Mono.defer(() -> {
            Sinks.One<Object> sink = Sinks.one();
            boolean subscribeNow;
            synchronized (this) {
                if (done) {
                    return error != null ? Mono.error(error) : Mono.empty();
                }
                waiting = sink;
                subscribeNow = !subscribed;
                subscribed = true;
            }
            if (subscribeNow) {
                Flux.from(source).subscribe(this);
            } else {
                request(1);
            }
            return sink.asMono();
        });
    }

    public Mono<Void> earlyReturn() {
        return Mono.fromRunnable(this::dispose);
    }

    @Override
    protected void hookOnSubscribe(Subscription subscription) {
        subscription.request(1);
    }

    @Override
    protected void hookOnNext(Object value) {
        Sinks.One<Object> sink = takeWaiting(false, null);
        if (sink != null) {
            sink.tryEmitValue(value);
        }
    }

    @Override
    protected void hookOnComplete() {
        Sinks.One<Object> sink = takeWaiting(true, null);
        if (sink != null) {
            sink.tryEmitEmpty();
        }
    }

    @Override
    protected void hookOnError(Throwable throwable) {
        Sinks.One<Object> sink = takeWaiting(true, throwable);
        if (sink != null) {
            sink.tryEmitError(throwable);
        }
    }

    @Override
    protected void hookOnCancel() {
        Sinks.One<Object> sink = takeWaiting(true, null);
        if (sink != null) {
            sink.tryEmitEmpty();
        }
    }

    private synchronized Sinks.One<Object> takeWaiting(boolean terminate, Throwable throwable) {
        if (terminate) {
            done = true;
            error = throwable;
        }
        Sinks.One<Object> sink = waiting;
        waiting = null;
        return sink;
    }
}

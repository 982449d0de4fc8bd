package graphql.consulting.incremental;

import graphql.Internal;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

@Internal
public class Async {

    /**
     * A resolver value that is not ready yet.
     */
    public static boolean isPending(Object value) {
        return value instanceof Mono || value instanceof CompletionStage;
    }

    @SuppressWarnings("unchecked")
    public static Mono<Object> toMono(Object pending) {
        if (pending instanceof Mono) {
            return (Mono<Object>) pending;
        }
        return Mono.fromCompletionStage((CompletionStage<Object>) pending);
    }

    /**
     * Subscribes to all monos eagerly and keeps the results in the order of the given list.
     */
    public static <T> Mono<List<T>> each(List<Mono<T>> monos) {
        return Flux.fromIterable(monos)
                .flatMapSequential(Function.identity())
                .collectList();
    }
}
